package com.flamingo.ai.indexer.exception;

/** Thrown when a batch carries no collection identifier to select the target index. */
public class MissingCollectionException extends RuntimeException {

  public MissingCollectionException(String message) {
    super(message);
  }
}
