package com.flamingo.ai.indexer.config;

import com.flamingo.ai.indexer.elasticsearch.DuplicatePolicy;
import com.flamingo.ai.indexer.elasticsearch.VectorSimilarity;
import com.flamingo.ai.indexer.service.pipeline.preprocessing.SplitBy;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the indexing pipeline. */
@Configuration
@ConfigurationProperties(prefix = "indexer")
@Getter
@Setter
public class IndexerConfig {

  /** Directory receiving uploaded files before they enter the pipeline. */
  private String uploadPath = System.getProperty("java.io.tmpdir") + "/file-upload";

  /** Maximum number of index requests handled at the same time by this process. */
  private int concurrentRequestLimit = 4;

  private Embedding embedding = new Embedding();
  private Store store = new Store();
  private Classifier classifier = new Classifier();
  private Converter converter = new Converter();
  private Preprocessor preprocessor = new Preprocessor();

  @Getter
  @Setter
  public static class Embedding {
    private int dimensions = 768;
    private int batchSize = 32;

    /** Framework tag of the model, recorded on each stored passage. */
    private String modelFormat = "sentence_transformers";
  }

  @Getter
  @Setter
  public static class Store {
    /** Similarity used at query time; must match the retrieval configuration. */
    private VectorSimilarity similarity = VectorSimilarity.DOT_PRODUCT;

    private DuplicatePolicy duplicateDocuments = DuplicatePolicy.OVERWRITE;

    /** Passage fields hashed into the document id: "content" and/or "meta". */
    private List<String> idHashKeys = new ArrayList<>(List.of("content"));
  }

  @Getter
  @Setter
  public static class Classifier {
    /** Extensions in output-channel order: the first type maps to output_1. */
    private List<String> supportedTypes = new ArrayList<>(List.of("txt", "pdf", "md"));
  }

  @Getter
  @Setter
  public static class Converter {
    private boolean removeNumericTables = false;
    private List<String> validLanguages = new ArrayList<>();
    private String encoding = "UTF-8";
    private boolean removeCodeSnippets = true;
  }

  @Getter
  @Setter
  public static class Preprocessor {
    private boolean cleanWhitespace = true;
    private boolean cleanEmptyLines = true;
    private boolean cleanHeaderFooter = true;
    private SplitBy splitBy = SplitBy.SENTENCE;
    private int splitLength = 50;
    private int splitOverlap = 0;
    private boolean splitRespectSentenceBoundary = false;
    private int maxCharsCheck = 10_000;
  }
}
