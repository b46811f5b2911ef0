package com.flamingo.ai.indexer.service.pipeline.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A span of normalized text travelling through the pipeline.
 *
 * <p>Converters emit one passage holding a whole file; the preprocessor replaces it with the split
 * passages; the embedder fills {@link #embedding}. After the store writer succeeds the passage is
 * owned by Elasticsearch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Passage {

  /** Key of the passage's position in its source document. */
  public static final String SPLIT_ID = "_split_id";

  private String id;
  private String content;
  @Builder.Default private String contentType = "text";
  @Builder.Default private Map<String, Object> meta = new LinkedHashMap<>();
  private List<Float> embedding;
}
