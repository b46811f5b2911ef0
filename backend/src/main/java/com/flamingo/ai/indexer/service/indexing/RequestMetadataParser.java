package com.flamingo.ai.indexer.service.indexing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.indexer.exception.InvalidMetadataException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Decodes the {@code meta} form field of an index request. */
@Component
@RequiredArgsConstructor
public class RequestMetadataParser {

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  /**
   * Parses request metadata.
   *
   * @param rawMeta JSON text, {@code null} or {@code "null"} for no metadata
   * @return the metadata object as a mutable map, empty when absent
   * @throws InvalidMetadataException if the text is not JSON or not a JSON object
   */
  public Map<String, Object> parse(String rawMeta) {
    if (rawMeta == null || rawMeta.isBlank()) {
      return new LinkedHashMap<>();
    }

    JsonNode node;
    try {
      node = objectMapper.readTree(rawMeta);
    } catch (JsonProcessingException e) {
      throw new InvalidMetadataException(
          "The meta field must be a JSON object, but could not be parsed: "
              + e.getOriginalMessage(),
          e);
    }

    if (node == null || node.isNull() || node.isMissingNode()) {
      return new LinkedHashMap<>();
    }
    if (!node.isObject()) {
      throw new InvalidMetadataException(node.getNodeType().name().toLowerCase(Locale.ROOT));
    }
    return objectMapper.convertValue(node, MAP_TYPE);
  }
}
