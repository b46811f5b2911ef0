package com.flamingo.ai.indexer.service.pipeline.conversion;

import com.flamingo.ai.indexer.exception.DocumentConversionException;
import com.flamingo.ai.indexer.service.pipeline.ComponentOutput;
import com.flamingo.ai.indexer.service.pipeline.PipelineComponent;
import com.flamingo.ai.indexer.service.pipeline.model.Passage;
import com.flamingo.ai.indexer.service.pipeline.model.PipelinePayload;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class of the converter nodes. Subclasses extract the raw text of one file type; this class
 * applies the shared filters and emits the whole document as a single passage.
 *
 * <p>Pages, where the format has them, are separated by a form feed ({@code \f}).
 */
@Slf4j
public abstract class FileConverter implements PipelineComponent {

  static final char PAGE_BREAK = '\f';

  private static final double NUMERIC_WORD_RATIO = 0.4;

  protected final ConverterSettings settings;
  private final LanguageValidator languageValidator;

  protected FileConverter(ConverterSettings settings, LanguageValidator languageValidator) {
    this.settings = settings;
    this.languageValidator = languageValidator;
  }

  /**
   * Reads the text of a file.
   *
   * @param file the uploaded file
   * @return text with pages separated by {@code \f}
   * @throws IOException if the file cannot be read or parsed
   */
  protected abstract String extractText(Path file) throws IOException;

  /**
   * Decodes a file with the configured charset. Malformed or unmappable bytes fail the file.
   *
   * @throws java.nio.charset.CharacterCodingException if the bytes are not valid in the charset
   */
  protected String decode(Path file) throws IOException {
    CharsetDecoder decoder =
        settings
            .encoding()
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    return decoder.decode(ByteBuffer.wrap(Files.readAllBytes(file))).toString();
  }

  @Override
  public Optional<ComponentOutput> run(PipelinePayload payload) {
    Path file = payload.filePath();
    String text;
    try {
      text = extractText(file);
    } catch (IOException e) {
      String message =
          String.format(
              "%s could not read %s: %s",
              getClass().getSimpleName(), file.getFileName(), e.getMessage());
      throw new DocumentConversionException(file, message, e);
    }

    if (settings.removeNumericTables()) {
      text = removeNumericTables(text);
    }
    if (!languageValidator.isValid(text, settings.validLanguages())) {
      log.warn(
          "The language of '{}' is not one of {}. The file may not have been decoded correctly.",
          payload.meta().get("name"),
          settings.validLanguages());
    }

    Passage document =
        Passage.builder().content(text).meta(new LinkedHashMap<>(payload.meta())).build();
    log.debug(
        "{} extracted {} characters from {}",
        getClass().getSimpleName(),
        text.length(),
        file.getFileName());
    return Optional.of(ComponentOutput.single(payload.withPassages(List.of(document))));
  }

  /**
   * Drops lines in which more than 40% of the words contain a digit, unless the line ends with a
   * period.
   */
  static String removeNumericTables(String text) {
    String[] pages = text.split(String.valueOf(PAGE_BREAK), -1);
    List<String> cleanedPages = new ArrayList<>(pages.length);
    for (String page : pages) {
      List<String> kept = new ArrayList<>();
      for (String line : page.split("\n", -1)) {
        if (!isNumericRow(line)) {
          kept.add(line);
        }
      }
      cleanedPages.add(String.join("\n", kept));
    }
    return String.join(String.valueOf(PAGE_BREAK), cleanedPages);
  }

  private static boolean isNumericRow(String line) {
    String trimmed = line.strip();
    if (trimmed.isEmpty() || trimmed.endsWith(".")) {
      return false;
    }
    String[] words = trimmed.split("\\s+");
    long numeric = 0;
    for (String word : words) {
      if (word.chars().anyMatch(Character::isDigit)) {
        numeric++;
      }
    }
    return (double) numeric / words.length > NUMERIC_WORD_RATIO;
  }
}
