package com.flamingo.ai.indexer.service.pipeline.conversion;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.language.detect.LanguageDetector;
import org.apache.tika.language.detect.LanguageResult;
import org.apache.tika.langdetect.optimaize.OptimaizeLangDetector;
import org.springframework.stereotype.Component;

/** Checks that extracted text is written in one of the expected languages. */
@Component
@Slf4j
public class LanguageValidator {

  private LanguageDetector detector;

  /**
   * Detects the language of {@code text}.
   *
   * @param text extracted text
   * @param validLanguages expected ISO 639-1 codes; empty accepts everything
   * @return {@code true} when no languages are required or the detected one is listed
   */
  public synchronized boolean isValid(String text, List<String> validLanguages) {
    if (validLanguages.isEmpty()) {
      return true;
    }
    if (text == null || text.isBlank()) {
      return false;
    }
    LanguageResult result = detector().detect(text);
    log.debug("Detected language '{}' ({})", result.getLanguage(), result.getConfidence());
    return !result.isUnknown() && validLanguages.contains(result.getLanguage());
  }

  private LanguageDetector detector() {
    if (detector == null) {
      detector = new OptimaizeLangDetector().loadModels();
    }
    return detector;
  }
}
