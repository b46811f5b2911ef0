package com.flamingo.ai.indexer.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import com.flamingo.ai.indexer.exception.DuplicateDocumentException;
import com.flamingo.ai.indexer.exception.IndexMismatchException;
import com.flamingo.ai.indexer.service.pipeline.model.Passage;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.apache.hc.core5.http.HttpHost;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.elasticsearch.ElasticsearchContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the passage index service against a real Elasticsearch node: index creation, layout checks
 * and the duplicate policies.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("PassageIndexService Integration Test")
class PassageIndexServiceIntegrationTest {

  @Container
  private static final ElasticsearchContainer ELASTICSEARCH_CONTAINER =
      new ElasticsearchContainer("docker.elastic.co/elasticsearch/elasticsearch:9.0.1")
          .withEnv("xpack.security.enabled", "false")
          .withEnv("xpack.security.http.ssl.enabled", "false")
          .withStartupTimeout(Duration.ofMinutes(2));

  private Rest5Client restClient;
  private ElasticsearchClient elasticsearchClient;
  private MeterRegistry meterRegistry;
  private String index;

  @BeforeEach
  void setUp() {
    restClient =
        Rest5Client.builder(
                new HttpHost(
                    "http",
                    ELASTICSEARCH_CONTAINER.getHost(),
                    ELASTICSEARCH_CONTAINER.getMappedPort(9200)))
            .build();
    elasticsearchClient =
        new ElasticsearchClient(new Rest5ClientTransport(restClient, new JacksonJsonpMapper()));
    meterRegistry = new SimpleMeterRegistry();
    index = "passages-" + UUID.randomUUID().toString().substring(0, 8);
  }

  @AfterEach
  void tearDown() throws IOException {
    restClient.close();
  }

  private PassageIndexService service(
      int dims, VectorSimilarity similarity, DuplicatePolicy policy) {
    return new PassageIndexService(elasticsearchClient, meterRegistry, dims, similarity, policy);
  }

  private static Passage passage(String id, String content) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("name", "notes.txt");
    meta.put("author", "ops");
    meta.put(Passage.SPLIT_ID, 0);
    return Passage.builder()
        .id(id)
        .content(content)
        .meta(meta)
        .embedding(List.of(0.1f, 0.2f, 0.3f))
        .build();
  }

  private Map<String, Object> source(String id) throws IOException {
    return elasticsearchClient.get(g -> g.index(index).id(id), Map.class).source();
  }

  @Test
  @DisplayName("Should create the index once and overwrite re-uploaded passages")
  void shouldOverwriteDuplicates() throws IOException {
    PassageIndexService service =
        service(3, VectorSimilarity.DOT_PRODUCT, DuplicatePolicy.OVERWRITE);
    service.ensureIndex(index);
    service.ensureIndex(index);

    service.writeDocuments(index, List.of(passage("a", "first"), passage("b", "second")));
    service.writeDocuments(index, List.of(passage("a", "first again")));

    assertThat(service.count(index)).isEqualTo(2);
    assertThat(source("a"))
        .containsEntry("content", "first again")
        .containsEntry("name", "notes.txt");
    assertThat(elasticsearchClient.indices().exists(e -> e.index(index)).value()).isTrue();
  }

  @Test
  @DisplayName("Should keep stored passages under the skip policy")
  void shouldSkipDuplicates() throws IOException {
    PassageIndexService service = service(3, VectorSimilarity.DOT_PRODUCT, DuplicatePolicy.SKIP);
    service.ensureIndex(index);

    service.writeDocuments(index, List.of(passage("a", "original")));
    service.writeDocuments(index, List.of(passage("a", "replacement"), passage("b", "new")));

    assertThat(service.count(index)).isEqualTo(2);
    assertThat(source("a")).containsEntry("content", "original");
  }

  @Test
  @DisplayName("Should reject stored ids under the fail policy")
  void shouldFailOnDuplicates() {
    PassageIndexService service = service(3, VectorSimilarity.DOT_PRODUCT, DuplicatePolicy.FAIL);
    service.ensureIndex(index);
    service.writeDocuments(index, List.of(passage("a", "original")));

    assertThatThrownBy(
            () -> service.writeDocuments(index, List.of(passage("a", "again"), passage("c", "x"))))
        .isInstanceOf(DuplicateDocumentException.class)
        .extracting("duplicateIds")
        .isEqualTo(List.of("a"));
    assertThat(service.count(index)).isEqualTo(1);
  }

  @Test
  @DisplayName("Should refuse an index created for another embedding layout")
  void shouldRejectMismatchedIndex() {
    service(3, VectorSimilarity.DOT_PRODUCT, DuplicatePolicy.OVERWRITE).ensureIndex(index);

    assertThatThrownBy(
            () ->
                service(4, VectorSimilarity.DOT_PRODUCT, DuplicatePolicy.OVERWRITE)
                    .ensureIndex(index))
        .isInstanceOf(IndexMismatchException.class);
    assertThatThrownBy(
            () -> service(3, VectorSimilarity.COSINE, DuplicatePolicy.OVERWRITE).ensureIndex(index))
        .isInstanceOf(IndexMismatchException.class);
  }

  @Test
  @DisplayName("Should answer ping when the node is reachable")
  void shouldPing() {
    assertThat(service(3, VectorSimilarity.DOT_PRODUCT, DuplicatePolicy.OVERWRITE).ping()).isTrue();
  }
}
