package com.flamingo.ai.indexer.service.pipeline.preprocessing;

import com.flamingo.ai.indexer.exception.InvalidPipelineParameterException;
import java.util.Arrays;
import java.util.Locale;

/** Unit a document is split into before passages are assembled. */
public enum SplitBy {
  WORD,
  SENTENCE,
  /** Blank-line separated paragraphs. */
  PASSAGE,
  /** Keep the document whole. */
  NONE;

  /**
   * Parses the {@code split_by} form value.
   *
   * @throws InvalidPipelineParameterException for unknown values
   */
  public static SplitBy fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidPipelineParameterException("split_by", "split_by must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(unit -> unit.name().equals(normalized))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidPipelineParameterException(
                    "split_by",
                    "split_by must be one of word, sentence, passage or none, not '"
                        + value
                        + "'"));
  }
}
