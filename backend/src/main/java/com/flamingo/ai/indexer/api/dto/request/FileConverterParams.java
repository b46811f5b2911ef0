package com.flamingo.ai.indexer.api.dto.request;

import java.util.List;
import org.springframework.web.bind.annotation.BindParam;

/**
 * Per-request converter overrides sent as form fields. A {@code null} component keeps the
 * configured default.
 *
 * @param removeNumericTables drop lines that look like rows of a numeric table
 * @param validLanguages ISO 639-1 codes the text is expected to be written in
 */
public record FileConverterParams(
    @BindParam("remove_numeric_tables") Boolean removeNumericTables,
    @BindParam("valid_languages") List<String> validLanguages) {

  public static FileConverterParams none() {
    return new FileConverterParams(null, null);
  }
}
