package com.flamingo.ai.indexer.exception;

import java.nio.file.Path;

/** Exception thrown when a file cannot be converted to text. */
public class DocumentConversionException extends RuntimeException {

  private final Path filePath;
  private final String userMessage;

  public DocumentConversionException(Path filePath, String message, Throwable cause) {
    super(message, cause);
    this.filePath = filePath;
    this.userMessage = "Failed to convert uploaded file";
  }

  public Path getFilePath() {
    return filePath;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
