package com.flamingo.ai.indexer.service.pipeline.classifier;

import com.google.common.io.Files;
import java.io.IOException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Component;

/**
 * Determines the {@link FileType} of an uploaded file.
 *
 * <p>The extension decides when present. Files without one are sniffed with Tika.
 */
@Component
@Slf4j
public class FileTypeDetector {

  private static final Tika TIKA = new Tika();

  public FileType detect(Path file) {
    String extension = Files.getFileExtension(file.getFileName().toString());
    if (!extension.isEmpty()) {
      return FileType.fromExtension(extension);
    }

    try {
      String mimeType = TIKA.detect(file);
      log.debug("Sniffed {} as {}", file.getFileName(), mimeType);
      return FileType.fromMimeType(mimeType);
    } catch (IOException e) {
      log.warn("Could not sniff content type of {}: {}", file.getFileName(), e.getMessage());
      return FileType.UNKNOWN;
    }
  }
}
