package com.flamingo.ai.indexer.service.pipeline;

import com.flamingo.ai.indexer.config.IndexerConfig;
import com.flamingo.ai.indexer.elasticsearch.ElasticsearchIndexOperations;
import com.flamingo.ai.indexer.service.pipeline.classifier.FileType;
import com.flamingo.ai.indexer.service.pipeline.classifier.FileTypeClassifier;
import com.flamingo.ai.indexer.service.pipeline.classifier.FileTypeDetector;
import com.flamingo.ai.indexer.service.pipeline.conversion.ConverterSettings;
import com.flamingo.ai.indexer.service.pipeline.conversion.FileConverter;
import com.flamingo.ai.indexer.service.pipeline.conversion.LanguageValidator;
import com.flamingo.ai.indexer.service.pipeline.conversion.MarkdownConverter;
import com.flamingo.ai.indexer.service.pipeline.conversion.PdfToTextConverter;
import com.flamingo.ai.indexer.service.pipeline.conversion.TextConverter;
import com.flamingo.ai.indexer.service.pipeline.embedding.EmbeddingService;
import com.flamingo.ai.indexer.service.pipeline.embedding.PassageEmbedder;
import com.flamingo.ai.indexer.service.pipeline.model.Passage;
import com.flamingo.ai.indexer.service.pipeline.preprocessing.PreProcessor;
import com.flamingo.ai.indexer.service.pipeline.preprocessing.PreProcessorSettings;
import com.flamingo.ai.indexer.service.pipeline.store.DocumentStoreWriter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds the indexing pipeline of one request.
 *
 * <pre>
 * File -> FileTypeClassifier -+-> TextConverter      -+-> PreProcessor -> EmbeddingRetriever
 *                             +-> PDFToTextConverter -+                  -> DocumentStore
 *                             +-> MarkdownConverter  -+
 * </pre>
 */
@Component
@Slf4j
public class IndexingPipelineFactory {

  public static final String CLASSIFIER = "FileTypeClassifier";
  public static final String TEXT_CONVERTER = "TextConverter";
  public static final String PDF_CONVERTER = "PDFToTextConverter";
  public static final String MARKDOWN_CONVERTER = "MarkdownConverter";
  public static final String PRE_PROCESSOR = "PreProcessor";
  public static final String EMBEDDER = "EmbeddingRetriever";
  public static final String DOCUMENT_STORE = "DocumentStore";

  private final IndexerConfig indexerConfig;
  private final FileTypeDetector fileTypeDetector;
  private final LanguageValidator languageValidator;
  private final EmbeddingService embeddingService;
  private final ElasticsearchIndexOperations<Passage> indexOperations;
  private final MeterRegistry meterRegistry;
  private final String embeddingModelName;

  public IndexingPipelineFactory(
      IndexerConfig indexerConfig,
      FileTypeDetector fileTypeDetector,
      LanguageValidator languageValidator,
      EmbeddingService embeddingService,
      ElasticsearchIndexOperations<Passage> indexOperations,
      MeterRegistry meterRegistry,
      @Value("${langchain4j.embedding-model.model-name}") String embeddingModelName) {
    this.indexerConfig = indexerConfig;
    this.fileTypeDetector = fileTypeDetector;
    this.languageValidator = languageValidator;
    this.embeddingService = embeddingService;
    this.indexOperations = indexOperations;
    this.meterRegistry = meterRegistry;
    this.embeddingModelName = embeddingModelName;
  }

  /**
   * Prepares the collection and wires the pipeline.
   *
   * @param collection the Elasticsearch index the request writes into
   * @param converterSettings converter settings with the request overrides applied
   * @param preProcessorSettings preprocessor settings with the request overrides applied
   * @return a validated pipeline, to be closed by the caller
   */
  public Pipeline create(
      String collection,
      ConverterSettings converterSettings,
      PreProcessorSettings preProcessorSettings) {
    indexOperations.ensureIndex(collection);

    FileTypeClassifier classifier =
        new FileTypeClassifier(
            fileTypeDetector, indexerConfig.getClassifier().getSupportedTypes(), meterRegistry);

    Pipeline pipeline = new Pipeline();
    pipeline.addNode(classifier, CLASSIFIER, List.of(Pipeline.ROOT_NODE));

    List<String> converterNodes = new ArrayList<>();
    for (FileType type : classifier.supportedTypes()) {
      String node = converterNodeName(type);
      String edge = CLASSIFIER + "." + ComponentOutput.edgeName(classifier.channelOf(type));
      pipeline.addNode(converterFor(type, converterSettings), node, List.of(edge));
      converterNodes.add(node);
    }

    pipeline
        .addNode(
            new PreProcessor(preProcessorSettings, indexerConfig.getStore().getIdHashKeys()),
            PRE_PROCESSOR,
            converterNodes)
        .addNode(
            new PassageEmbedder(
                embeddingService,
                embeddingModelName,
                indexerConfig.getEmbedding().getModelFormat()),
            EMBEDDER,
            List.of(PRE_PROCESSOR))
        .addNode(
            new DocumentStoreWriter(indexOperations, collection),
            DOCUMENT_STORE,
            List.of(EMBEDDER));
    pipeline.validate();

    log.debug("Built indexing pipeline {} for collection '{}'", pipeline.nodeNames(), collection);
    return pipeline;
  }

  private FileConverter converterFor(FileType type, ConverterSettings settings) {
    return switch (type) {
      case TEXT -> new TextConverter(settings, languageValidator);
      case PDF -> new PdfToTextConverter(settings, languageValidator);
      case MARKDOWN -> new MarkdownConverter(settings, languageValidator);
      case UNKNOWN -> throw new IllegalArgumentException("No converter for " + type);
    };
  }

  private static String converterNodeName(FileType type) {
    return switch (type) {
      case TEXT -> TEXT_CONVERTER;
      case PDF -> PDF_CONVERTER;
      case MARKDOWN -> MARKDOWN_CONVERTER;
      case UNKNOWN -> throw new IllegalArgumentException("No converter for " + type);
    };
  }
}
