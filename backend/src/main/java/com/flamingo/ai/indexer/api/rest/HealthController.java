package com.flamingo.ai.indexer.api.rest;

import com.flamingo.ai.indexer.elasticsearch.ElasticsearchIndexOperations;
import com.flamingo.ai.indexer.service.pipeline.model.Passage;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final ElasticsearchIndexOperations<Passage> indexOperations;

  /** Returns UP when Elasticsearch answers, DEGRADED otherwise. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    boolean elasticsearchUp = indexOperations.ping();
    Map<String, Object> health = new HashMap<>();
    health.put("status", elasticsearchUp ? "UP" : "DEGRADED");
    health.put("elasticsearch", elasticsearchUp ? "UP" : "DOWN");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "file-indexer");
    return ResponseEntity.ok(health);
  }
}
