package com.flamingo.ai.indexer.service.pipeline.preprocessing;

import com.flamingo.ai.indexer.api.dto.request.PreprocessorParams;
import com.flamingo.ai.indexer.config.IndexerConfig;
import com.flamingo.ai.indexer.exception.InvalidPipelineParameterException;

/**
 * Cleaning and splitting settings for one request.
 *
 * @param cleanWhitespace strip lines and collapse runs of blanks
 * @param cleanEmptyLines collapse consecutive empty lines
 * @param cleanHeaderFooter remove text repeated at the top or bottom of every page
 * @param splitBy unit the text is split into
 * @param splitLength maximum number of units per passage
 * @param splitOverlap units shared by consecutive passages
 * @param splitRespectSentenceBoundary pack whole sentences when splitting by word
 * @param maxCharsCheck passages longer than this are cut into pieces of this size
 */
public record PreProcessorSettings(
    boolean cleanWhitespace,
    boolean cleanEmptyLines,
    boolean cleanHeaderFooter,
    SplitBy splitBy,
    int splitLength,
    int splitOverlap,
    boolean splitRespectSentenceBoundary,
    int maxCharsCheck) {

  public static PreProcessorSettings from(IndexerConfig.Preprocessor config) {
    return new PreProcessorSettings(
        config.isCleanWhitespace(),
        config.isCleanEmptyLines(),
        config.isCleanHeaderFooter(),
        config.getSplitBy(),
        config.getSplitLength(),
        config.getSplitOverlap(),
        config.isSplitRespectSentenceBoundary(),
        config.getMaxCharsCheck());
  }

  /**
   * Applies the non-null request overrides.
   *
   * @throws InvalidPipelineParameterException if {@code split_by} is unknown
   */
  public PreProcessorSettings withOverrides(PreprocessorParams params) {
    if (params == null) {
      return this;
    }
    return new PreProcessorSettings(
        orDefault(params.cleanWhitespace(), cleanWhitespace),
        orDefault(params.cleanEmptyLines(), cleanEmptyLines),
        orDefault(params.cleanHeaderFooter(), cleanHeaderFooter),
        params.splitBy() != null ? SplitBy.fromValue(params.splitBy()) : splitBy,
        params.splitLength() != null ? params.splitLength() : splitLength,
        params.splitOverlap() != null ? params.splitOverlap() : splitOverlap,
        orDefault(params.splitRespectSentenceBoundary(), splitRespectSentenceBoundary),
        maxCharsCheck);
  }

  /**
   * Checks the settings can be applied together.
   *
   * @return this instance
   * @throws InvalidPipelineParameterException naming the offending field
   */
  public PreProcessorSettings validate() {
    if (splitBy != SplitBy.NONE) {
      if (splitLength <= 0) {
        throw new InvalidPipelineParameterException(
            "split_length", "split_length must be positive, not " + splitLength);
      }
      if (splitOverlap < 0 || splitOverlap >= splitLength) {
        throw new InvalidPipelineParameterException(
            "split_overlap",
            "split_overlap must be at least 0 and less than split_length ("
                + splitLength
                + "), not "
                + splitOverlap);
      }
    }
    if (splitRespectSentenceBoundary && splitBy != SplitBy.WORD) {
      throw new InvalidPipelineParameterException(
          "split_respect_sentence_boundary",
          "split_respect_sentence_boundary can only be used with split_by=word");
    }
    if (maxCharsCheck <= 0) {
      throw new InvalidPipelineParameterException(
          "max_chars_check", "max_chars_check must be positive, not " + maxCharsCheck);
    }
    return this;
  }

  private static boolean orDefault(Boolean override, boolean fallback) {
    return override != null ? override : fallback;
  }
}
