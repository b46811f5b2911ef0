package com.flamingo.ai.indexer.service.pipeline.preprocessing;

import com.flamingo.ai.indexer.exception.PipelineConfigurationException;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Derives passage ids from their content. Equal content yields equal ids, so a re-upload
 * addresses the documents written before.
 */
public final class PassageIds {

  public static final String CONTENT_KEY = "content";
  public static final String META_KEY = "meta";

  private static final Set<String> SUPPORTED_KEYS = Set.of(CONTENT_KEY, META_KEY);

  private PassageIds() {}

  /**
   * Checks the configured hash keys.
   *
   * @throws PipelineConfigurationException if a key is unknown or none is given
   */
  public static List<String> validateKeys(List<String> idHashKeys) {
    if (idHashKeys == null || idHashKeys.isEmpty()) {
      throw new PipelineConfigurationException("At least one id hash key is required");
    }
    for (String key : idHashKeys) {
      if (!SUPPORTED_KEYS.contains(key)) {
        throw new PipelineConfigurationException(
            "Unsupported id hash key '" + key + "', expected one of " + SUPPORTED_KEYS);
      }
    }
    return List.copyOf(idHashKeys);
  }

  /** Returns the hex murmur3 128-bit hash of the selected passage fields. */
  public static String of(String content, Map<String, Object> meta, List<String> idHashKeys) {
    Hasher hasher = Hashing.murmur3_128().newHasher();
    for (String key : idHashKeys) {
      if (CONTENT_KEY.equals(key)) {
        hasher.putString(content, StandardCharsets.UTF_8);
      } else {
        // sorted so the id does not depend on the order of the request's JSON keys
        hasher.putString(String.valueOf(new TreeMap<>(meta)), StandardCharsets.UTF_8);
      }
    }
    return hasher.hash().toString();
  }
}
