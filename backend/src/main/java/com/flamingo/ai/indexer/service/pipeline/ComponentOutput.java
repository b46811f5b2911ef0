package com.flamingo.ai.indexer.service.pipeline;

import com.flamingo.ai.indexer.service.pipeline.model.PipelinePayload;

/**
 * Result of running one {@link PipelineComponent}: the payload and the channel it leaves on.
 *
 * @param edge output channel name, {@code output_1} for single-output components
 * @param payload the payload for downstream nodes
 */
public record ComponentOutput(String edge, PipelinePayload payload) {

  public static final String DEFAULT_EDGE = edgeName(1);

  public static ComponentOutput single(PipelinePayload payload) {
    return new ComponentOutput(DEFAULT_EDGE, payload);
  }

  public static ComponentOutput on(int channel, PipelinePayload payload) {
    return new ComponentOutput(edgeName(channel), payload);
  }

  public static String edgeName(int channel) {
    return "output_" + channel;
  }
}
