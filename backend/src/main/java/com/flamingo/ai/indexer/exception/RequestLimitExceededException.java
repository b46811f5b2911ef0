package com.flamingo.ai.indexer.exception;

/** Thrown when the per-process concurrent request limit is reached. */
public class RequestLimitExceededException extends RuntimeException {

  private final int limit;

  public RequestLimitExceededException(int limit) {
    super("Concurrent request limit of " + limit + " reached");
    this.limit = limit;
  }

  public int getLimit() {
    return limit;
  }
}
