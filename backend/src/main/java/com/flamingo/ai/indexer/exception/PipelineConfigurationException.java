package com.flamingo.ai.indexer.exception;

/** Thrown when a pipeline graph is wired incorrectly. */
public class PipelineConfigurationException extends RuntimeException {

  public PipelineConfigurationException(String message) {
    super(message);
  }
}
