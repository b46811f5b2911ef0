package com.flamingo.ai.indexer.exception;

/** Thrown when a converter or preprocessor override has an unusable value. */
public class InvalidPipelineParameterException extends RuntimeException {

  private final String parameter;

  public InvalidPipelineParameterException(String parameter, String message) {
    super(message);
    this.parameter = parameter;
  }

  public String getParameter() {
    return parameter;
  }
}
