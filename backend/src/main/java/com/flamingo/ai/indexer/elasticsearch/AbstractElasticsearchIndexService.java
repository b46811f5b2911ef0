package com.flamingo.ai.indexer.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TypeMapping;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.MgetResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.mget.MultiGetResponseItem;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import co.elastic.clients.json.JsonData;
import com.flamingo.ai.indexer.exception.DocumentStoreException;
import com.flamingo.ai.indexer.exception.DuplicateDocumentException;
import com.flamingo.ai.indexer.exception.IndexMismatchException;
import com.flamingo.ai.indexer.exception.IndexWriteException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for services writing documents into caller-named indices.
 *
 * <p>Subclasses define the schema and the document conversion. Indices are created with {@code
 * dynamic=false} so only the declared fields are mapped.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T> {

  private static final String ALREADY_EXISTS = "resource_already_exists_exception";
  private static final int CONFLICT = 409;

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  /** Defines the index properties (schema) for this document type. */
  protected abstract Map<String, Property> defineIndexProperties();

  /** Values recorded in the mapping {@code _meta} of new indices. */
  protected abstract Map<String, JsonData> defineIndexMeta();

  /**
   * Checks an existing index was created for the same layout.
   *
   * @param index the index name
   * @param mapping the current mapping of the index
   * @throws IndexMismatchException if it was not
   */
  protected abstract void validateExistingIndex(String index, TypeMapping mapping);

  /** Converts a document to its Elasticsearch source. */
  protected abstract Map<String, Object> convertToDocument(T document);

  /** Extracts the document ID. */
  protected abstract String getDocumentId(T document);

  /** Returns the policy applied when a document id is already stored. */
  protected abstract DuplicatePolicy getDuplicatePolicy();

  /** Returns the metric prefix, e.g. {@code indexing.passages}. */
  protected abstract String getMetricPrefix();

  @Override
  @Timed(value = "elasticsearch.ensure_index", description = "Time to create or check an index")
  @CircuitBreaker(name = "elasticsearch")
  public void ensureIndex(String index) {
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(index)).value();
      if (!exists) {
        createIndex(index);
      } else {
        updateAndValidateMappings(index);
      }
    } catch (ElasticsearchException e) {
      throw new DocumentStoreException(
          index, "Failed to prepare index '" + index + "': " + e.getMessage(), e);
    } catch (IOException e) {
      throw new DocumentStoreException(
          index, "Elasticsearch is unreachable while preparing index '" + index + "'", e);
    }
  }

  private void createIndex(String index) throws IOException {
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(index)
                    .mappings(
                        m ->
                            m.dynamic(DynamicMapping.False)
                                .meta(defineIndexMeta())
                                .properties(defineIndexProperties())));
    try {
      elasticsearchClient.indices().create(request);
      log.info("Created Elasticsearch index: {}", index);
    } catch (ElasticsearchException e) {
      if (!ALREADY_EXISTS.equals(e.error().type())) {
        throw e;
      }
      // created by a concurrent request
      log.debug("Index '{}' was created concurrently", index);
      updateAndValidateMappings(index);
    }
  }

  /**
   * Checks the existing index and adds missing fields.
   *
   * <p>Elasticsearch allows adding new fields via the Put Mapping API but not changing the type of
   * existing ones, so type mismatches fail the request.
   */
  private void updateAndValidateMappings(String index) throws IOException {
    var response = elasticsearchClient.indices().getMapping(g -> g.index(index));
    var indexMapping = response.get(index);
    if (indexMapping == null) {
      return;
    }
    TypeMapping mapping = indexMapping.mappings();
    validateExistingIndex(index, mapping);

    Map<String, Property> expectedProperties = defineIndexProperties();
    Map<String, Property> actualProperties = mapping.properties();

    List<String> mismatches = new ArrayList<>();
    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual == null) {
        missingFields.put(entry.getKey(), entry.getValue());
      } else if (actual._kind() != entry.getValue()._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), actual._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IndexMismatchException(
          index,
          "Index '" + index + "' has incompatible field type(s): " + String.join("; ", mismatches));
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(index).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          index,
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", index);
    }
  }

  @Override
  @Timed(value = "elasticsearch.write", description = "Time to write documents")
  @CircuitBreaker(name = "elasticsearch")
  public void writeDocuments(String index, List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    // the last occurrence of an id within one batch wins
    Map<String, T> byId = new LinkedHashMap<>();
    for (T document : documents) {
      byId.remove(getDocumentId(document));
      byId.put(getDocumentId(document), document);
    }

    DuplicatePolicy policy = getDuplicatePolicy();
    try {
      if (policy == DuplicatePolicy.FAIL) {
        rejectExisting(index, new ArrayList<>(byId.keySet()));
      }

      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder().refresh(Refresh.WaitFor);
      for (Map.Entry<String, T> entry : byId.entrySet()) {
        String id = entry.getKey();
        Map<String, Object> docMap = convertToDocument(entry.getValue());
        if (policy == DuplicatePolicy.SKIP) {
          bulkBuilder.operations(op -> op.create(c -> c.index(index).id(id).document(docMap)));
        } else {
          bulkBuilder.operations(op -> op.index(i -> i.index(index).id(id).document(docMap)));
        }
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      int written = countWritten(index, response, policy);
      log.debug("Wrote {} of {} document(s) to {}", written, byId.size(), index);
      meterRegistry.counter(getMetricPrefix() + ".written").increment(written);
    } catch (ElasticsearchException e) {
      throw new IndexWriteException(
          index, "Bulk write to '" + index + "' was rejected: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new IndexWriteException(index, "Failed to write documents to '" + index + "'", e);
    }
  }

  private int countWritten(String index, BulkResponse response, DuplicatePolicy policy) {
    if (!response.errors()) {
      return response.items().size();
    }
    int written = 0;
    int skipped = 0;
    List<String> failures = new ArrayList<>();
    for (BulkResponseItem item : response.items()) {
      if (item.error() == null) {
        written++;
      } else if (policy == DuplicatePolicy.SKIP && item.status() == CONFLICT) {
        skipped++;
      } else {
        failures.add(item.id() + ": " + item.error().type() + " " + item.error().reason());
      }
    }
    if (skipped > 0) {
      log.info("Skipped {} document(s) already present in {}", skipped, index);
    }
    if (!failures.isEmpty()) {
      meterRegistry.counter(getMetricPrefix() + ".errors").increment(failures.size());
      throw new IndexWriteException(
          index,
          failures.size() + " document(s) failed to index into '" + index + "': " + failures);
    }
    return written;
  }

  private void rejectExisting(String index, List<String> ids) throws IOException {
    MgetResponse<Map> response =
        elasticsearchClient.mget(
            m -> m.index(index).ids(ids).source(s -> s.fetch(false)), Map.class);
    List<String> existing = new ArrayList<>();
    for (MultiGetResponseItem<Map> item : response.docs()) {
      if (item.isResult() && item.result().found()) {
        existing.add(item.result().id());
      }
    }
    if (!existing.isEmpty()) {
      throw new DuplicateDocumentException(index, existing);
    }
  }

  @Override
  public long count(String index) {
    try {
      return elasticsearchClient.count(c -> c.index(index)).count();
    } catch (IOException e) {
      throw new DocumentStoreException(index, "Failed to count documents in '" + index + "'", e);
    }
  }

  @Override
  public boolean ping() {
    try {
      return elasticsearchClient.ping().value();
    } catch (IOException | ElasticsearchException e) {
      log.warn("Elasticsearch ping failed: {}", e.getMessage());
      return false;
    }
  }
}
