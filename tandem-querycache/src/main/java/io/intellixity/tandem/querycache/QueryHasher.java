package io.intellixity.tandem.querycache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Content-addressed row id: hex SHA-256 of the query text and the canonical variables JSON.\n
 *
 * Variables are serialized with sorted map keys so {@code {a,b}} and {@code {b,a}} hash alike.\n
 */
public final class QueryHasher {
  private static final ObjectMapper CANONICAL = new ObjectMapper()
      .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

  private QueryHasher() {}

  public static String id(String query, Map<String, Object> variables) {
    String payload = query + "\n" + canonicalJson(variables);
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(md.digest(payload.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  static String canonicalJson(Map<String, Object> variables) {
    try {
      return CANONICAL.writeValueAsString(variables == null ? Map.of() : variables);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Variables are not JSON-serializable: " + e.getOriginalMessage(), e);
    }
  }
}
