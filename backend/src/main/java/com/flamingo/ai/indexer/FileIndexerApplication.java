package com.flamingo.ai.indexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the file indexing service.
 *
 * <p>The Elasticsearch client is wired by {@link
 * com.flamingo.ai.indexer.config.ElasticsearchConfig} on top of the Rest5 transport, so Spring
 * Boot's own client auto-configuration is switched off.
 */
@SpringBootApplication(
    excludeName = {
      "org.springframework.boot.autoconfigure.elasticsearch.ElasticsearchClientAutoConfiguration",
      "org.springframework.boot.autoconfigure.elasticsearch.ElasticsearchRestClientAutoConfiguration"
    })
public class FileIndexerApplication {

  public static void main(String[] args) {
    SpringApplication.run(FileIndexerApplication.class, args);
  }
}
