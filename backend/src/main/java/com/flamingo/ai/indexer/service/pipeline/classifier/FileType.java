package com.flamingo.ai.indexer.service.pipeline.classifier;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/** File types the indexing pipeline knows how to convert. */
public enum FileType {
  TEXT("txt", Set.of("text/plain")),
  PDF("pdf", Set.of("application/pdf")),
  MARKDOWN("md", Set.of("text/markdown", "text/x-markdown", "text/x-web-markdown")),
  UNKNOWN("", Set.of());

  private final String extension;
  private final Set<String> mimeTypes;

  FileType(String extension, Set<String> mimeTypes) {
    this.extension = extension;
    this.mimeTypes = mimeTypes;
  }

  public String extension() {
    return extension;
  }

  public static FileType fromExtension(String extension) {
    if (extension == null || extension.isBlank()) {
      return UNKNOWN;
    }
    String normalized = extension.toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type != UNKNOWN && type.extension.equals(normalized))
        .findFirst()
        .orElse(UNKNOWN);
  }

  public static FileType fromMimeType(String mimeType) {
    if (mimeType == null) {
      return UNKNOWN;
    }
    String baseType = mimeType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(type -> type.mimeTypes.contains(baseType))
        .findFirst()
        .orElse(UNKNOWN);
  }
}
