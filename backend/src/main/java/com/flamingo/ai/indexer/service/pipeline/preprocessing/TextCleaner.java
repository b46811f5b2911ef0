package com.flamingo.ai.indexer.service.pipeline.preprocessing;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Page-aware text cleanup applied before splitting. Pages are separated by {@code \f}. */
final class TextCleaner {

  static final String PAGE_BREAK = "\f";

  /** Characters at the top or bottom of a page searched for a header or footer. */
  static final int HEADER_FOOTER_CHARS = 300;

  static final int MIN_NGRAM = 3;
  static final int MAX_NGRAM = 30;

  private static final Pattern BLANK_RUN = Pattern.compile("[ \\t]+");
  private static final Pattern EMPTY_LINES = Pattern.compile("\\n\\n+");

  private TextCleaner() {}

  static String clean(String text, PreProcessorSettings settings) {
    String cleaned = text;
    if (settings.cleanHeaderFooter()) {
      cleaned = removeHeaderFooter(cleaned);
    }
    if (settings.cleanWhitespace()) {
      cleaned = cleanWhitespace(cleaned);
    }
    if (settings.cleanEmptyLines()) {
      cleaned = EMPTY_LINES.matcher(cleaned).replaceAll("\n\n");
    }
    return cleaned;
  }

  /**
   * Removes the longest word n-gram shared by the start (header) and then by the end (footer) of
   * every page. The first and last page are not sampled and at least two sampled pages are
   * needed.
   */
  static String removeHeaderFooter(String text) {
    List<String> pages = new ArrayList<>(Arrays.asList(text.split(PAGE_BREAK, -1)));
    if (pages.size() < 4) {
      return text;
    }

    String header =
        longestCommonNgram(
            samplePages(pages).stream()
                .map(page -> page.substring(0, Math.min(HEADER_FOOTER_CHARS, page.length())))
                .toList());
    if (header != null) {
      pages.replaceAll(page -> page.replace(header, ""));
    }

    String footer =
        longestCommonNgram(
            samplePages(pages).stream()
                .map(page -> page.substring(Math.max(0, page.length() - HEADER_FOOTER_CHARS)))
                .toList());
    if (footer != null) {
      pages.replaceAll(page -> page.replace(footer, ""));
    }
    return String.join(PAGE_BREAK, pages);
  }

  static String cleanWhitespace(String text) {
    return Arrays.stream(text.split(PAGE_BREAK, -1))
        .map(
            page ->
                page.lines()
                    .map(line -> BLANK_RUN.matcher(line.strip()).replaceAll(" "))
                    .collect(Collectors.joining("\n")))
        .collect(Collectors.joining(PAGE_BREAK));
  }

  private static List<String> samplePages(List<String> pages) {
    return pages.subList(1, pages.size() - 1);
  }

  private static String longestCommonNgram(List<String> sequences) {
    List<String> nonEmpty = sequences.stream().filter(s -> !s.isEmpty()).toList();
    if (nonEmpty.size() < 2) {
      return null;
    }

    Set<String> common = null;
    for (String sequence : nonEmpty) {
      Set<String> ngrams = ngrams(sequence);
      if (common == null) {
        common = ngrams;
      } else {
        common.retainAll(ngrams);
      }
      if (common.isEmpty()) {
        return null;
      }
    }

    String longest = null;
    for (String ngram : common) {
      if (longest == null
          || ngram.length() > longest.length()
          || (ngram.length() == longest.length() && ngram.compareTo(longest) < 0)) {
        longest = ngram;
      }
    }
    return longest == null || longest.isBlank() ? null : longest;
  }

  /** All n-grams of 3 to 29 space-separated words; line breaks and tabs count as words. */
  private static Set<String> ngrams(String sequence) {
    String[] words = sequence.replace("\n", " \n").replace("\t", " \t").split(" ", -1);
    Set<String> result = new HashSet<>();
    for (int n = MIN_NGRAM; n < MAX_NGRAM; n++) {
      for (int i = 0; i + n <= words.length; i++) {
        String ngram =
            String.join(" ", Arrays.asList(words).subList(i, i + n))
                .replace(" \n", "\n")
                .replace(" \t", "\t");
        result.add(ngram);
      }
    }
    return result;
  }
}
