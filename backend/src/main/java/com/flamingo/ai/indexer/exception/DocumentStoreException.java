package com.flamingo.ai.indexer.exception;

/** Base exception for failures talking to the document store. */
public class DocumentStoreException extends RuntimeException {

  private final String collection;

  public DocumentStoreException(String collection, String message) {
    super(message);
    this.collection = collection;
  }

  public DocumentStoreException(String collection, String message, Throwable cause) {
    super(message, cause);
    this.collection = collection;
  }

  public String getCollection() {
    return collection;
  }
}
