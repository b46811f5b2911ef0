package com.flamingo.ai.indexer.service.pipeline.embedding;

import com.flamingo.ai.indexer.config.IndexerConfig;
import com.flamingo.ai.indexer.exception.EmbeddingException;
import com.google.common.collect.Lists;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Computes passage embeddings with the configured embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final IndexerConfig indexerConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds passage texts in batches.
   *
   * @param texts passage texts
   * @return one vector per text, in input order
   * @throws EmbeddingException if the model fails or returns vectors of the wrong shape
   */
  @Timed(value = "embedding.embedPassages", description = "Time to embed the passages of a file")
  @CircuitBreaker(name = "embedding")
  public List<List<Float>> embedPassages(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    int dimensions = indexerConfig.getEmbedding().getDimensions();
    int batchSize = Math.max(1, indexerConfig.getEmbedding().getBatchSize());

    List<List<Float>> vectors = new ArrayList<>(texts.size());
    for (List<String> batch : Lists.partition(texts, batchSize)) {
      List<TextSegment> segments = batch.stream().map(TextSegment::from).toList();
      Response<List<Embedding>> response;
      try {
        response = embeddingModel.embedAll(segments);
      } catch (RuntimeException e) {
        throw new EmbeddingException("Embedding model call failed: " + e.getMessage(), e);
      }

      List<Embedding> embeddings = response.content();
      if (embeddings == null || embeddings.size() != batch.size()) {
        throw new EmbeddingException(
            "Embedding model returned "
                + (embeddings == null ? 0 : embeddings.size())
                + " vectors for "
                + batch.size()
                + " passages");
      }
      for (Embedding embedding : embeddings) {
        if (embedding.dimension() != dimensions) {
          throw new EmbeddingException(
              "Expected embeddings of dimension "
                  + dimensions
                  + " but the model returned "
                  + embedding.dimension());
        }
        vectors.add(embedding.vectorAsList());
      }
      log.debug("Embedded batch of {} passage(s)", batch.size());
    }

    meterRegistry.counter("embedding.requests.success", "type", "passage").increment(texts.size());
    return vectors;
  }
}
