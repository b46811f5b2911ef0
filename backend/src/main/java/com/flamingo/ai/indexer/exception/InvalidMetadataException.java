package com.flamingo.ai.indexer.exception;

/** Thrown when the {@code meta} form field does not decode to a JSON object. */
public class InvalidMetadataException extends RuntimeException {

  public InvalidMetadataException(String actualType) {
    super("The meta field must be a dict or None, not " + actualType);
  }

  public InvalidMetadataException(String message, Throwable cause) {
    super(message, cause);
  }
}
