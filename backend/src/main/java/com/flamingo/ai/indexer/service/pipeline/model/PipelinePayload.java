package com.flamingo.ai.indexer.service.pipeline.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The value handed from one pipeline node to the next for a single file.
 *
 * @param filePath temporary location of the uploaded file
 * @param meta metadata of the file, including {@code name} and {@code index}
 * @param passages passages produced so far (empty until a converter ran)
 */
public record PipelinePayload(Path filePath, Map<String, Object> meta, List<Passage> passages) {

  public PipelinePayload {
    // JSON metadata may carry null values, which Map.copyOf rejects
    meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    passages = List.copyOf(passages);
  }

  public static PipelinePayload forFile(Path filePath, Map<String, Object> meta) {
    return new PipelinePayload(filePath, meta, List.of());
  }

  public PipelinePayload withPassages(List<Passage> newPassages) {
    return new PipelinePayload(filePath, meta, newPassages);
  }
}
