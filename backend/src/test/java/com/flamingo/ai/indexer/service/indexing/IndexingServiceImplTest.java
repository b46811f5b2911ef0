package com.flamingo.ai.indexer.service.indexing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.indexer.api.dto.request.FileConverterParams;
import com.flamingo.ai.indexer.api.dto.request.PreprocessorParams;
import com.flamingo.ai.indexer.config.IndexerConfig;
import com.flamingo.ai.indexer.exception.EmbeddingException;
import com.flamingo.ai.indexer.exception.InvalidMetadataException;
import com.flamingo.ai.indexer.exception.InvalidPipelineParameterException;
import com.flamingo.ai.indexer.exception.MissingCollectionException;
import com.flamingo.ai.indexer.service.pipeline.IndexingPipelineFactory;
import com.flamingo.ai.indexer.service.pipeline.Pipeline;
import com.flamingo.ai.indexer.service.pipeline.conversion.ConverterSettings;
import com.flamingo.ai.indexer.service.pipeline.model.PipelinePayload;
import com.flamingo.ai.indexer.service.pipeline.preprocessing.PreProcessorSettings;
import com.flamingo.ai.indexer.service.pipeline.preprocessing.SplitBy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

@ExtendWith(MockitoExtension.class)
@DisplayName("IndexingService Tests")
class IndexingServiceImplTest {

  @Mock private UploadStorageService uploadStorageService;
  @Mock private IndexingPipelineFactory pipelineFactory;
  @Mock private Pipeline pipeline;

  private SimpleMeterRegistry meterRegistry;
  private IndexingServiceImpl indexingService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    indexingService =
        new IndexingServiceImpl(
            new RequestMetadataParser(new ObjectMapper()),
            uploadStorageService,
            pipelineFactory,
            new IndexerConfig(),
            meterRegistry);
  }

  private static MultipartFile upload(String name) {
    return new MockMultipartFile("files", name, "text/plain", new byte[] {'x'});
  }

  @Test
  @DisplayName("Should run every file through one pipeline for the named collection")
  void shouldIndexBatch() {
    MultipartFile first = upload("a.txt");
    MultipartFile second = upload("b.pdf");
    when(uploadStorageService.store(first)).thenReturn(Path.of("/uploads/1_a.txt"));
    when(uploadStorageService.store(second)).thenReturn(Path.of("/uploads/2_b.pdf"));
    when(pipelineFactory.create(eq("docs"), any(), any())).thenReturn(pipeline);

    indexingService.index(
        List.of(first, second),
        "{\"index\": \"docs\", \"author\": \"ops\"}",
        FileConverterParams.none(),
        PreprocessorParams.none());

    ArgumentCaptor<PipelinePayload> payloads = ArgumentCaptor.forClass(PipelinePayload.class);
    verify(pipeline, times(2)).run(payloads.capture());
    assertThat(payloads.getAllValues())
        .extracting(PipelinePayload::filePath)
        .containsExactly(Path.of("/uploads/1_a.txt"), Path.of("/uploads/2_b.pdf"));
    assertThat(payloads.getAllValues().get(0).meta())
        .containsEntry("index", "docs")
        .containsEntry("author", "ops")
        .containsEntry("name", "a.txt");
    assertThat(payloads.getAllValues().get(1).meta()).containsEntry("name", "b.pdf");
    verify(pipeline).close();
    verify(uploadStorageService).delete(Path.of("/uploads/1_a.txt"));
    verify(uploadStorageService).delete(Path.of("/uploads/2_b.pdf"));
    assertThat(meterRegistry.counter("indexing.files.received").count()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("Should hand request overrides to the pipeline")
  void shouldApplyOverrides() {
    when(uploadStorageService.store(any())).thenReturn(Path.of("/uploads/1_a.txt"));
    when(pipelineFactory.create(eq("docs"), any(), any())).thenReturn(pipeline);

    indexingService.index(
        List.of(upload("a.txt")),
        "{\"index\": \"docs\"}",
        new FileConverterParams(true, List.of("en")),
        new PreprocessorParams(null, null, null, "word", 100, 20, true));

    ArgumentCaptor<ConverterSettings> converter = ArgumentCaptor.forClass(ConverterSettings.class);
    ArgumentCaptor<PreProcessorSettings> preprocessor =
        ArgumentCaptor.forClass(PreProcessorSettings.class);
    verify(pipelineFactory).create(eq("docs"), converter.capture(), preprocessor.capture());
    assertThat(converter.getValue().removeNumericTables()).isTrue();
    assertThat(converter.getValue().validLanguages()).containsExactly("en");
    assertThat(preprocessor.getValue().splitBy()).isEqualTo(SplitBy.WORD);
    assertThat(preprocessor.getValue().splitLength()).isEqualTo(100);
    assertThat(preprocessor.getValue().splitOverlap()).isEqualTo(20);
    assertThat(preprocessor.getValue().splitRespectSentenceBoundary()).isTrue();
  }

  @Test
  @DisplayName("Should reject metadata that is not an object before storing uploads")
  void shouldRejectInvalidMetadata() {
    assertThatThrownBy(
            () ->
                indexingService.index(
                    List.of(upload("a.txt")),
                    "[1, 2, 3]",
                    FileConverterParams.none(),
                    PreprocessorParams.none()))
        .isInstanceOf(InvalidMetadataException.class)
        .hasMessage("The meta field must be a dict or None, not array");
    verifyNoInteractions(uploadStorageService, pipelineFactory);
  }

  @Test
  @DisplayName("Should reject a batch without a collection")
  void shouldRejectMissingCollection() {
    assertThatThrownBy(
            () ->
                indexingService.index(
                    List.of(upload("a.txt")),
                    "{\"author\": \"ops\"}",
                    FileConverterParams.none(),
                    PreprocessorParams.none()))
        .isInstanceOf(MissingCollectionException.class);
    assertThatThrownBy(
            () ->
                indexingService.index(
                    List.of(), "{\"index\": \"docs\"}", null, PreprocessorParams.none()))
        .isInstanceOf(MissingCollectionException.class);
    verifyNoInteractions(uploadStorageService, pipelineFactory);
  }

  @Test
  @DisplayName("Should reject invalid preprocessor overrides before storing uploads")
  void shouldRejectInvalidOverrides() {
    assertThatThrownBy(
            () ->
                indexingService.index(
                    List.of(upload("a.txt")),
                    "{\"index\": \"docs\"}",
                    FileConverterParams.none(),
                    new PreprocessorParams(null, null, null, "sentence", 10, 10, null)))
        .isInstanceOf(InvalidPipelineParameterException.class)
        .extracting("parameter")
        .isEqualTo("split_overlap");
    verifyNoInteractions(uploadStorageService, pipelineFactory);
  }

  @Test
  @DisplayName("Should keep uploads and close the pipeline when a file fails")
  void shouldKeepUploadsOnFailure() {
    when(uploadStorageService.store(any())).thenReturn(Path.of("/uploads/1_a.txt"));
    when(pipelineFactory.create(eq("docs"), any(), any())).thenReturn(pipeline);
    doThrow(new EmbeddingException("model unavailable")).when(pipeline).run(any());

    assertThatThrownBy(
            () ->
                indexingService.index(
                    List.of(upload("a.txt")),
                    "{\"index\": \"docs\"}",
                    FileConverterParams.none(),
                    PreprocessorParams.none()))
        .isInstanceOf(EmbeddingException.class);
    verify(pipeline).close();
    verify(uploadStorageService, never()).delete(any());
  }
}
