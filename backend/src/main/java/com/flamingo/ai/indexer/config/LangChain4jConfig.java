package com.flamingo.ai.indexer.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j embedding model.
 *
 * <p>The model is reached through the OpenAI embeddings protocol, which Text Embeddings Inference
 * also serves, so a sentence-transformers model can be hosted next to the service and addressed by
 * its Hugging Face name.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.embedding-model.base-url:http://localhost:8080/v1}")
  private String baseUrl;

  @Value("${langchain4j.embedding-model.api-key:}")
  private String apiKey;

  @Value(
      "${langchain4j.embedding-model.model-name:sentence-transformers/multi-qa-mpnet-base-dot-v1}")
  private String modelName;

  @Value("${langchain4j.embedding-model.timeout-seconds:30}")
  private long timeoutSeconds;

  @Bean
  public EmbeddingModel embeddingModel() {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new IllegalStateException(
          "Embedding endpoint is required. Set EMBEDDING_BASE_URL environment variable.");
    }
    log.info("Embedding model '{}' served at {}", modelName, baseUrl);

    return OpenAiEmbeddingModel.builder()
        .baseUrl(baseUrl)
        // TEI does not check the key
        .apiKey(apiKey.isBlank() ? "unused" : apiKey)
        .modelName(modelName)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .logRequests(false)
        .logResponses(false)
        .build();
  }
}
