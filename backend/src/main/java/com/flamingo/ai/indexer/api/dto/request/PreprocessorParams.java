package com.flamingo.ai.indexer.api.dto.request;

import org.springframework.web.bind.annotation.BindParam;

/** Per-request preprocessor overrides sent as form fields. Absent fields keep the defaults. */
public record PreprocessorParams(
    @BindParam("clean_whitespace") Boolean cleanWhitespace,
    @BindParam("clean_empty_lines") Boolean cleanEmptyLines,
    @BindParam("clean_header_footer") Boolean cleanHeaderFooter,
    @BindParam("split_by") String splitBy,
    @BindParam("split_length") Integer splitLength,
    @BindParam("split_overlap") Integer splitOverlap,
    @BindParam("split_respect_sentence_boundary") Boolean splitRespectSentenceBoundary) {

  public static PreprocessorParams none() {
    return new PreprocessorParams(null, null, null, null, null, null, null);
  }
}
