package com.flamingo.ai.indexer.service.pipeline.embedding;

import com.flamingo.ai.indexer.service.pipeline.ComponentOutput;
import com.flamingo.ai.indexer.service.pipeline.PipelineComponent;
import com.flamingo.ai.indexer.service.pipeline.model.Passage;
import com.flamingo.ai.indexer.service.pipeline.model.PipelinePayload;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Attaches an embedding to every passage of a file. */
public class PassageEmbedder implements PipelineComponent {

  private final EmbeddingService embeddingService;
  private final String modelName;
  private final String modelFormat;

  public PassageEmbedder(EmbeddingService embeddingService, String modelName, String modelFormat) {
    this.embeddingService = embeddingService;
    this.modelName = modelName;
    this.modelFormat = modelFormat;
  }

  @Override
  public Optional<ComponentOutput> run(PipelinePayload payload) {
    List<Passage> passages = payload.passages();
    List<List<Float>> vectors =
        embeddingService.embedPassages(passages.stream().map(Passage::getContent).toList());

    List<Passage> embedded = new ArrayList<>(passages.size());
    for (int i = 0; i < passages.size(); i++) {
      Passage passage = passages.get(i);
      Map<String, Object> meta = new LinkedHashMap<>(passage.getMeta());
      meta.putIfAbsent("embedding_model", modelName);
      meta.putIfAbsent("embedding_model_format", modelFormat);
      embedded.add(
          Passage.builder()
              .id(passage.getId())
              .content(passage.getContent())
              .contentType(passage.getContentType())
              .meta(meta)
              .embedding(vectors.get(i))
              .build());
    }
    return Optional.of(ComponentOutput.single(payload.withPassages(embedded)));
  }
}
