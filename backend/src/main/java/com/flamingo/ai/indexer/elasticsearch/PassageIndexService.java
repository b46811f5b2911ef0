package com.flamingo.ai.indexer.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TypeMapping;
import co.elastic.clients.json.JsonData;
import com.flamingo.ai.indexer.config.IndexerConfig;
import com.flamingo.ai.indexer.exception.IndexMismatchException;
import com.flamingo.ai.indexer.service.pipeline.model.Passage;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index service for embedded {@link Passage}s.
 *
 * <p>The embedding is stored as an unindexed {@code dense_vector}: scoring happens at query time
 * with the similarity recorded in the index {@code _meta}, which also works for vectors that are
 * not unit length.
 */
@Service
@Slf4j
public class PassageIndexService extends AbstractElasticsearchIndexService<Passage> {

  static final String META_SIMILARITY = "similarity";
  static final String META_EMBEDDING_DIM = "embedding_dim";

  private final int vectorDimensions;
  private final VectorSimilarity similarity;
  private final DuplicatePolicy duplicatePolicy;

  @Autowired
  public PassageIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      IndexerConfig indexerConfig) {
    this(
        elasticsearchClient,
        meterRegistry,
        indexerConfig.getEmbedding().getDimensions(),
        indexerConfig.getStore().getSimilarity(),
        indexerConfig.getStore().getDuplicateDocuments());
  }

  /** Constructor for testing - allows setting the layout and the duplicate policy. */
  @VisibleForTesting
  public PassageIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      int vectorDimensions,
      VectorSimilarity similarity,
      DuplicatePolicy duplicatePolicy) {
    super(elasticsearchClient, meterRegistry);
    this.vectorDimensions = vectorDimensions;
    this.similarity = similarity;
    this.duplicatePolicy = duplicatePolicy;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("content", Property.of(p -> p.text(t -> t)));
    properties.put("content_type", Property.of(p -> p.keyword(k -> k)));
    properties.put("name", Property.of(p -> p.keyword(k -> k)));
    // request metadata is free-form
    properties.put("meta", Property.of(p -> p.object(o -> o.dynamic(DynamicMapping.True))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(d -> d.dims(vectorDimensions).index(false)))));
    return properties;
  }

  @Override
  protected Map<String, JsonData> defineIndexMeta() {
    return Map.of(
        META_SIMILARITY, JsonData.of(similarity.value()),
        META_EMBEDDING_DIM, JsonData.of(vectorDimensions));
  }

  @Override
  protected void validateExistingIndex(String index, TypeMapping mapping) {
    Property embedding = mapping.properties().get("embedding");
    if (embedding != null && embedding.isDenseVector()) {
      Integer dims = embedding.denseVector().dims();
      if (dims != null && dims != vectorDimensions) {
        throw new IndexMismatchException(
            index,
            String.format(
                "Index '%s' stores embeddings of dimension %d, but the model produces %d",
                index, dims, vectorDimensions));
      }
    }

    JsonData storedSimilarity = mapping.meta().get(META_SIMILARITY);
    if (storedSimilarity == null) {
      log.warn("Index '{}' does not record a similarity, assuming {}", index, similarity.value());
      return;
    }
    String stored = storedSimilarity.to(String.class);
    if (VectorSimilarity.fromValue(stored) != similarity) {
      throw new IndexMismatchException(
          index,
          String.format(
              "Index '%s' was created for similarity '%s', but '%s' is configured",
              index, stored, similarity.value()));
    }
  }

  @Override
  protected Map<String, Object> convertToDocument(Passage passage) {
    Map<String, Object> document = new HashMap<>();
    document.put("content", passage.getContent());
    document.put("content_type", passage.getContentType());
    Object name = passage.getMeta().get("name");
    if (name != null) {
      document.put("name", name.toString());
    }
    document.put("meta", passage.getMeta());
    if (passage.getEmbedding() != null) {
      List<Float> vector = passage.getEmbedding();
      document.put("embedding", similarity == VectorSimilarity.COSINE ? normalize(vector) : vector);
    }
    return document;
  }

  @Override
  protected String getDocumentId(Passage passage) {
    return passage.getId();
  }

  @Override
  protected DuplicatePolicy getDuplicatePolicy() {
    return duplicatePolicy;
  }

  @Override
  protected String getMetricPrefix() {
    return "indexing.passages";
  }

  /** Scales a vector to unit length. Zero vectors are returned unchanged. */
  static List<Float> normalize(List<Float> vector) {
    double sumOfSquares = 0;
    for (Float value : vector) {
      sumOfSquares += value * value;
    }
    if (sumOfSquares == 0) {
      return vector;
    }
    double norm = Math.sqrt(sumOfSquares);
    List<Float> normalized = new ArrayList<>(vector.size());
    for (Float value : vector) {
      normalized.add((float) (value / norm));
    }
    return normalized;
  }
}
