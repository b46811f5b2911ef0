package com.flamingo.ai.indexer.service.pipeline.preprocessing;

import com.flamingo.ai.indexer.service.pipeline.ComponentOutput;
import com.flamingo.ai.indexer.service.pipeline.PipelineComponent;
import com.flamingo.ai.indexer.service.pipeline.model.Passage;
import com.flamingo.ai.indexer.service.pipeline.model.PipelinePayload;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Cleans converted documents and splits them into passages.
 *
 * <p>Every passage carries a copy of its document's metadata plus {@value Passage#SPLIT_ID}, its
 * 0-based position in the document, and an id derived from the configured hash keys.
 */
@Slf4j
public class PreProcessor implements PipelineComponent {

  private final PreProcessorSettings settings;
  private final TextSplitter splitter;
  private final List<String> idHashKeys;

  public PreProcessor(PreProcessorSettings settings, List<String> idHashKeys) {
    this.settings = settings.validate();
    this.splitter = new TextSplitter(settings);
    this.idHashKeys = PassageIds.validateKeys(idHashKeys);
  }

  @Override
  public Optional<ComponentOutput> run(PipelinePayload payload) {
    List<Passage> passages = new ArrayList<>();
    for (Passage document : payload.passages()) {
      passages.addAll(process(document));
    }
    log.debug(
        "Split {} into {} passage(s) by {}",
        payload.filePath().getFileName(),
        passages.size(),
        settings.splitBy());
    return Optional.of(ComponentOutput.single(payload.withPassages(passages)));
  }

  /**
   * Cleans and splits one document.
   *
   * @param document a converter output holding a whole file
   * @return the passages in document order
   */
  public List<Passage> process(Passage document) {
    String cleaned = TextCleaner.clean(document.getContent(), settings);
    String flattened = cleaned.replace(TextCleaner.PAGE_BREAK, "\n\n");

    List<String> texts = splitter.split(flattened);
    List<Passage> passages = new ArrayList<>(texts.size());
    for (int splitId = 0; splitId < texts.size(); splitId++) {
      String text = texts.get(splitId);
      Map<String, Object> meta = new LinkedHashMap<>(document.getMeta());
      meta.put(Passage.SPLIT_ID, splitId);
      passages.add(
          Passage.builder()
              .id(PassageIds.of(text, meta, idHashKeys))
              .content(text)
              .contentType(document.getContentType())
              .meta(meta)
              .build());
    }
    return passages;
  }
}
