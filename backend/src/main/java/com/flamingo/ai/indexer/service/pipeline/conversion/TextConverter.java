package com.flamingo.ai.indexer.service.pipeline.conversion;

import java.io.IOException;
import java.nio.file.Path;

/** Decodes plain-text uploads with the configured charset. */
public class TextConverter extends FileConverter {

  public TextConverter(ConverterSettings settings, LanguageValidator languageValidator) {
    super(settings, languageValidator);
  }

  @Override
  protected String extractText(Path file) throws IOException {
    return decode(file);
  }
}
