package com.flamingo.ai.indexer.exception;

/** Thrown when a bulk write to the document store fails. */
public class IndexWriteException extends DocumentStoreException {

  public IndexWriteException(String collection, String message) {
    super(collection, message);
  }

  public IndexWriteException(String collection, String message, Throwable cause) {
    super(collection, message, cause);
  }
}
