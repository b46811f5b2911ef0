package com.flamingo.ai.indexer.service.pipeline.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.flamingo.ai.indexer.service.pipeline.model.Passage;
import com.flamingo.ai.indexer.service.pipeline.model.PipelinePayload;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("PassageEmbedder Tests")
class PassageEmbedderTest {

  @Mock private EmbeddingService embeddingService;

  @Test
  @DisplayName("Should attach vectors and record the model on each passage")
  void shouldAttachEmbeddings() {
    Map<String, Object> userMeta = new LinkedHashMap<>();
    userMeta.put("name", "notes.txt");
    userMeta.put("embedding_model", "client-supplied");
    Passage first = Passage.builder().id("1").content("first").meta(userMeta).build();
    Passage second = Passage.builder().id("2").content("second").build();
    when(embeddingService.embedPassages(List.of("first", "second")))
        .thenReturn(List.of(List.of(0.1f, 0.2f), List.of(0.3f, 0.4f)));
    PassageEmbedder embedder =
        new PassageEmbedder(embeddingService, "multilingual-e5-base", "sentence_transformers");

    List<Passage> passages =
        embedder
            .run(
                PipelinePayload.forFile(Path.of("notes.txt"), Map.of())
                    .withPassages(List.of(first, second)))
            .orElseThrow()
            .payload()
            .passages();

    assertThat(passages).extracting(Passage::getId).containsExactly("1", "2");
    assertThat(passages.get(0).getEmbedding()).containsExactly(0.1f, 0.2f);
    assertThat(passages.get(0).getMeta())
        .containsEntry("embedding_model", "client-supplied")
        .containsEntry("embedding_model_format", "sentence_transformers");
    assertThat(passages.get(1).getMeta())
        .containsEntry("embedding_model", "multilingual-e5-base");
    assertThat(first.getEmbedding()).isNull();
  }
}
