package com.flamingo.ai.indexer.service.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.indexer.config.IndexerConfig;
import com.flamingo.ai.indexer.elasticsearch.ElasticsearchIndexOperations;
import com.flamingo.ai.indexer.service.pipeline.classifier.FileTypeDetector;
import com.flamingo.ai.indexer.service.pipeline.conversion.ConverterSettings;
import com.flamingo.ai.indexer.service.pipeline.conversion.LanguageValidator;
import com.flamingo.ai.indexer.service.pipeline.embedding.EmbeddingService;
import com.flamingo.ai.indexer.service.pipeline.model.Passage;
import com.flamingo.ai.indexer.service.pipeline.model.PipelinePayload;
import com.flamingo.ai.indexer.service.pipeline.preprocessing.PreProcessorSettings;
import com.flamingo.ai.indexer.service.pipeline.preprocessing.SplitBy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("IndexingPipelineFactory Tests")
class IndexingPipelineFactoryTest {

  private static final String COLLECTION = "docs";

  @TempDir Path tempDir;

  @Mock private LanguageValidator languageValidator;
  @Mock private EmbeddingService embeddingService;
  @Mock private ElasticsearchIndexOperations<Passage> indexOperations;

  private IndexerConfig config;
  private IndexingPipelineFactory factory;
  private ConverterSettings converterSettings;
  private PreProcessorSettings preProcessorSettings;

  @BeforeEach
  void setUp() {
    config = new IndexerConfig();
    factory =
        new IndexingPipelineFactory(
            config,
            new FileTypeDetector(),
            languageValidator,
            embeddingService,
            indexOperations,
            new SimpleMeterRegistry(),
            "intfloat/multilingual-e5-base");
    converterSettings = ConverterSettings.from(config.getConverter());
    preProcessorSettings =
        new PreProcessorSettings(true, true, true, SplitBy.SENTENCE, 1, 0, false, 10_000);
    lenient().when(languageValidator.isValid(anyString(), anyList())).thenReturn(true);
  }

  @Test
  @DisplayName("Should prepare the collection and wire the standard graph")
  void shouldWireStandardGraph() {
    try (Pipeline pipeline = factory.create(COLLECTION, converterSettings, preProcessorSettings)) {
      verify(indexOperations).ensureIndex(COLLECTION);
      assertThat(pipeline.nodeNames())
          .containsExactly(
              "FileTypeClassifier",
              "TextConverter",
              "PDFToTextConverter",
              "MarkdownConverter",
              "PreProcessor",
              "EmbeddingRetriever",
              "DocumentStore");
      assertThat(pipeline.inputsOf("FileTypeClassifier")).containsExactly("File");
      assertThat(pipeline.inputsOf("TextConverter"))
          .containsExactly("FileTypeClassifier.output_1");
      assertThat(pipeline.inputsOf("PDFToTextConverter"))
          .containsExactly("FileTypeClassifier.output_2");
      assertThat(pipeline.inputsOf("MarkdownConverter"))
          .containsExactly("FileTypeClassifier.output_3");
      assertThat(pipeline.inputsOf("PreProcessor"))
          .containsExactly("TextConverter", "PDFToTextConverter", "MarkdownConverter");
      assertThat(pipeline.inputsOf("DocumentStore")).containsExactly("EmbeddingRetriever");
    }
  }

  @Test
  @DisplayName("Should only wire converters for the configured types")
  void shouldFollowConfiguredTypes() {
    config.getClassifier().setSupportedTypes(List.of("md", "txt"));

    try (Pipeline pipeline = factory.create(COLLECTION, converterSettings, preProcessorSettings)) {
      assertThat(pipeline.nodeNames()).doesNotContain("PDFToTextConverter");
      assertThat(pipeline.inputsOf("MarkdownConverter"))
          .containsExactly("FileTypeClassifier.output_1");
      assertThat(pipeline.inputsOf("TextConverter"))
          .containsExactly("FileTypeClassifier.output_2");
    }
  }

  @Test
  @DisplayName("Should index a text file end to end")
  void shouldIndexTextFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("notes.txt"), "First fact. Second fact.");
    when(embeddingService.embedPassages(List.of("First fact.", "Second fact.")))
        .thenReturn(List.of(Collections.nCopies(768, 0.1f), Collections.nCopies(768, 0.2f)));

    List<String> executed;
    try (Pipeline pipeline = factory.create(COLLECTION, converterSettings, preProcessorSettings)) {
      executed =
          pipeline.run(
              PipelinePayload.forFile(file, Map.of("name", "notes.txt", "index", COLLECTION)));
    }

    assertThat(executed)
        .containsExactly(
            "FileTypeClassifier",
            "TextConverter",
            "PreProcessor",
            "EmbeddingRetriever",
            "DocumentStore");
    ArgumentCaptor<List<Passage>> written = ArgumentCaptor.forClass(List.class);
    verify(indexOperations).writeDocuments(eq(COLLECTION), written.capture());
    assertThat(written.getValue()).hasSize(2);
    Passage first = written.getValue().get(0);
    assertThat(first.getContent()).isEqualTo("First fact.");
    assertThat(first.getEmbedding()).hasSize(768);
    assertThat(first.getMeta())
        .containsEntry("name", "notes.txt")
        .containsEntry("index", COLLECTION)
        .containsEntry(Passage.SPLIT_ID, 0)
        .containsEntry("embedding_model", "intfloat/multilingual-e5-base");
  }

  @Test
  @DisplayName("Should skip files the classifier cannot route")
  void shouldNotWriteUnsupportedFiles() throws IOException {
    Path file = Files.write(tempDir.resolve("archive.zip"), new byte[] {0x50, 0x4B, 0x03, 0x04});

    List<String> executed;
    try (Pipeline pipeline = factory.create(COLLECTION, converterSettings, preProcessorSettings)) {
      executed = pipeline.run(PipelinePayload.forFile(file, Map.of("name", "archive.zip")));
    }

    assertThat(executed).containsExactly("FileTypeClassifier");
    verify(embeddingService, never()).embedPassages(anyList());
    verify(indexOperations, never()).writeDocuments(eq(COLLECTION), anyList());
  }
}
