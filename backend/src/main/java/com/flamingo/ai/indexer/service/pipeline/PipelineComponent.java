package com.flamingo.ai.indexer.service.pipeline;

import com.flamingo.ai.indexer.service.pipeline.model.PipelinePayload;
import java.util.Optional;

/**
 * A node implementation in a {@link Pipeline}.
 *
 * <p>Components are built per request and hold only request-scoped state, so one instance serves
 * every file of the request in turn.
 */
public interface PipelineComponent {

  /**
   * Number of output channels this component can emit on. Downstream nodes may bind to a specific
   * channel with {@code <Node>.output_<n>}, {@code n} in {@code 1..outgoingEdges()}.
   *
   * @return the channel count, 1 for ordinary components
   */
  default int outgoingEdges() {
    return 1;
  }

  /**
   * Processes one payload.
   *
   * @param payload the payload from the upstream node
   * @return the output and the channel it is emitted on, or empty to stop this file here
   */
  Optional<ComponentOutput> run(PipelinePayload payload);
}
