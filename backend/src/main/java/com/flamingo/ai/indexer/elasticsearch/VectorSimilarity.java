package com.flamingo.ai.indexer.elasticsearch;

import java.util.Locale;

/** Similarity function the passage vectors are scored with at query time. */
public enum VectorSimilarity {
  DOT_PRODUCT,
  COSINE,
  L2_NORM;

  /** Name recorded in the index {@code _meta}, e.g. {@code dot_product}. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a stored similarity name.
   *
   * @param value name as written by {@link #value()}
   * @return the similarity, or {@code null} when the value is unknown
   */
  public static VectorSimilarity fromValue(String value) {
    for (VectorSimilarity similarity : values()) {
      if (similarity.value().equalsIgnoreCase(value)) {
        return similarity;
      }
    }
    return null;
  }
}
