package com.flamingo.ai.indexer.service.pipeline.preprocessing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/** Splits cleaned text into passage texts according to {@link PreProcessorSettings}. */
@Slf4j
final class TextSplitter {

  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern PARAGRAPH_BOUNDARY = Pattern.compile("\\n\\s*\\n");

  private final PreProcessorSettings settings;

  TextSplitter(PreProcessorSettings settings) {
    this.settings = settings;
  }

  /**
   * Splits {@code text}. Form feeds must already be replaced.
   *
   * @return passage texts in document order, never blank
   */
  List<String> split(String text) {
    List<String> passages =
        switch (settings.splitBy()) {
          case NONE -> List.of(text);
          case WORD ->
              settings.splitRespectSentenceBoundary()
                  ? packSentences(sentences(text))
                  : window(words(text), " ");
          case SENTENCE -> window(sentences(text), " ");
          case PASSAGE -> window(paragraphs(text), "\n\n");
        };

    List<String> result = new ArrayList<>();
    for (String passage : passages) {
      for (String piece : enforceMaxChars(passage)) {
        if (!piece.isBlank()) {
          result.add(piece);
        }
      }
    }
    return result;
  }

  static List<String> words(String text) {
    return Arrays.stream(text.split(" ")).filter(word -> !word.isEmpty()).toList();
  }

  static List<String> sentences(String text) {
    return Arrays.stream(SENTENCE_BOUNDARY.split(text.strip()))
        .filter(sentence -> !sentence.isBlank())
        .toList();
  }

  static List<String> paragraphs(String text) {
    return Arrays.stream(PARAGRAPH_BOUNDARY.split(text))
        .map(String::strip)
        .filter(paragraph -> !paragraph.isEmpty())
        .toList();
  }

  /**
   * Groups units into windows of {@code splitLength} that advance by {@code splitLength -
   * splitOverlap}. The last window ends at the last unit.
   */
  private List<String> window(List<String> units, String delimiter) {
    int length = settings.splitLength();
    int step = length - settings.splitOverlap();
    List<String> windows = new ArrayList<>();
    for (int start = 0; start < units.size(); start += step) {
      int end = Math.min(start + length, units.size());
      windows.add(String.join(delimiter, units.subList(start, end)));
      if (end == units.size()) {
        break;
      }
    }
    return windows;
  }

  /**
   * Packs whole sentences while the word budget allows. An over-long sentence becomes a passage of
   * its own. The overlap carries trailing sentences until it holds at least {@code splitOverlap}
   * words.
   */
  private List<String> packSentences(List<String> sentences) {
    int budget = settings.splitLength();
    int overlap = settings.splitOverlap();
    List<List<String>> slices = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int wordCount = 0;

    for (String sentence : sentences) {
      int sentenceWords = words(sentence).size();
      if (sentenceWords > budget) {
        log.warn(
            "A sentence of {} words exceeds split_length {} and becomes its own passage",
            sentenceWords,
            budget);
      }
      if (wordCount + sentenceWords > budget && !current.isEmpty()) {
        slices.add(current);
        List<String> carried = new ArrayList<>();
        int carriedWords = 0;
        for (int i = current.size() - 1; i >= 0 && carriedWords < overlap; i--) {
          carried.add(0, current.get(i));
          carriedWords += words(current.get(i)).size();
        }
        current = carried;
        wordCount = carriedWords;
      }
      current.add(sentence);
      wordCount += sentenceWords;
    }
    if (!current.isEmpty()) {
      slices.add(current);
    }
    return slices.stream().map(slice -> String.join(" ", slice)).toList();
  }

  private List<String> enforceMaxChars(String passage) {
    int max = settings.maxCharsCheck();
    if (passage.length() <= max) {
      return List.of(passage);
    }
    log.warn(
        "Passage of {} characters exceeds max_chars_check {} and is cut into pieces",
        passage.length(),
        max);
    List<String> pieces = new ArrayList<>();
    for (int start = 0; start < passage.length(); start += max) {
      pieces.add(passage.substring(start, Math.min(start + max, passage.length())));
    }
    return pieces;
  }
}
