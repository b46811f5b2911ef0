package com.flamingo.ai.indexer.exception;

/** Exception thrown when the embedding model fails or returns unusable vectors. */
public class EmbeddingException extends RuntimeException {

  public EmbeddingException(String message) {
    super(message);
  }

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
  }
}
