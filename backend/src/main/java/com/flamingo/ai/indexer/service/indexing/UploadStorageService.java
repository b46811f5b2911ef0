package com.flamingo.ai.indexer.service.indexing;

import com.flamingo.ai.indexer.config.IndexerConfig;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

/** Keeps uploaded files on disk while the pipeline reads them. */
@Service
@RequiredArgsConstructor
@Slf4j
public class UploadStorageService {

  static final String FALLBACK_NAME = "upload";

  private final IndexerConfig indexerConfig;

  /**
   * Copies an upload to {@code <upload-path>/<random hex>_<original name>}.
   *
   * @param file the uploaded file
   * @return the stored path
   */
  public Path store(MultipartFile file) {
    Path directory = Path.of(indexerConfig.getUploadPath());
    String storedName = UUID.randomUUID().toString().replace("-", "") + "_" + originalName(file);
    Path target = directory.resolve(storedName);
    try (InputStream in = file.getInputStream()) {
      Files.createDirectories(directory);
      Files.copy(in, target);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to store upload " + file.getOriginalFilename(), e);
    }
    log.debug(
        "Stored upload '{}' ({} bytes) at {}", file.getOriginalFilename(), file.getSize(), target);
    return target;
  }

  /** Removes a stored upload. Failures are logged, not thrown. */
  public void delete(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not delete upload {}: {}", path, e.getMessage());
    }
  }

  /** Returns the file name part of the client-supplied name. */
  public static String originalName(MultipartFile file) {
    String name = StringUtils.getFilename(file.getOriginalFilename());
    return StringUtils.hasText(name) ? name : FALLBACK_NAME;
  }
}
