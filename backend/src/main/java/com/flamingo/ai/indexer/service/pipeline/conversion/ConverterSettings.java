package com.flamingo.ai.indexer.service.pipeline.conversion;

import com.flamingo.ai.indexer.api.dto.request.FileConverterParams;
import com.flamingo.ai.indexer.config.IndexerConfig;
import com.flamingo.ai.indexer.exception.InvalidPipelineParameterException;
import com.flamingo.ai.indexer.exception.PipelineConfigurationException;
import java.nio.charset.Charset;
import java.util.List;
import java.util.Locale;

/**
 * Settings shared by the converters of one request.
 *
 * @param removeNumericTables drop lines that look like numeric table rows
 * @param validLanguages expected ISO 639-1 languages, empty to skip the check
 * @param encoding charset of plain-text and Markdown uploads
 * @param removeCodeSnippets drop code blocks from Markdown
 */
public record ConverterSettings(
    boolean removeNumericTables,
    List<String> validLanguages,
    Charset encoding,
    boolean removeCodeSnippets) {

  public ConverterSettings {
    validLanguages = List.copyOf(validLanguages);
  }

  public static ConverterSettings from(IndexerConfig.Converter config) {
    Charset charset;
    try {
      charset = Charset.forName(config.getEncoding());
    } catch (IllegalArgumentException e) {
      throw new PipelineConfigurationException(
          "Unsupported converter encoding: " + config.getEncoding());
    }
    return new ConverterSettings(
        config.isRemoveNumericTables(),
        normalizeLanguages(config.getValidLanguages()),
        charset,
        config.isRemoveCodeSnippets());
  }

  public ConverterSettings withOverrides(FileConverterParams params) {
    if (params == null) {
      return this;
    }
    List<String> languages = validLanguages;
    if (params.validLanguages() != null) {
      languages = normalizeLanguages(params.validLanguages());
      for (String language : languages) {
        if (language.length() != 2) {
          throw new InvalidPipelineParameterException(
              "valid_languages",
              "valid_languages must hold ISO 639-1 codes, not '" + language + "'");
        }
      }
    }
    return new ConverterSettings(
        params.removeNumericTables() != null
            ? params.removeNumericTables()
            : removeNumericTables,
        languages,
        encoding,
        removeCodeSnippets);
  }

  private static List<String> normalizeLanguages(List<String> languages) {
    return languages.stream()
        .filter(language -> language != null && !language.isBlank())
        .map(language -> language.trim().toLowerCase(Locale.ROOT))
        .distinct()
        .toList();
  }
}
