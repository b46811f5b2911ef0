package com.flamingo.ai.indexer.exception;

/** Thrown when an existing index does not match the configured embedding layout. */
public class IndexMismatchException extends DocumentStoreException {

  public IndexMismatchException(String collection, String message) {
    super(collection, message);
  }
}
