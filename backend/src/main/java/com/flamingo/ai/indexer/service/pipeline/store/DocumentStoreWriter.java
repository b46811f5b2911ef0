package com.flamingo.ai.indexer.service.pipeline.store;

import com.flamingo.ai.indexer.elasticsearch.ElasticsearchIndexOperations;
import com.flamingo.ai.indexer.service.pipeline.ComponentOutput;
import com.flamingo.ai.indexer.service.pipeline.PipelineComponent;
import com.flamingo.ai.indexer.service.pipeline.model.Passage;
import com.flamingo.ai.indexer.service.pipeline.model.PipelinePayload;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/** Terminal node writing the embedded passages of a file into the request's collection. */
@Slf4j
public class DocumentStoreWriter implements PipelineComponent {

  private final ElasticsearchIndexOperations<Passage> indexOperations;
  private final String collection;

  public DocumentStoreWriter(
      ElasticsearchIndexOperations<Passage> indexOperations, String collection) {
    this.indexOperations = indexOperations;
    this.collection = collection;
  }

  public String getCollection() {
    return collection;
  }

  @Override
  public Optional<ComponentOutput> run(PipelinePayload payload) {
    indexOperations.writeDocuments(collection, payload.passages());
    log.info(
        "Indexed {} passage(s) of '{}' into '{}'",
        payload.passages().size(),
        payload.meta().get("name"),
        collection);
    return Optional.of(ComponentOutput.single(payload));
  }
}
