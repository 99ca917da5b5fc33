package org.chucc.graphserver.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Computes stable SHA-256 hashes of entity content.
 * Map entries are serialized in key order, so equal content always yields equal hashes.
 */
public final class ContentHasher {

  private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
      .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

  private ContentHasher() {
    // Utility class
  }

  /**
   * Hashes the canonical JSON form of the given content.
   *
   * @param content content fields
   * @return lowercase hex SHA-256
   */
  public static String hash(Map<String, Object> content) {
    try {
      byte[] json = CANONICAL_MAPPER.writeValueAsString(content)
          .getBytes(StandardCharsets.UTF_8);
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(json));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize content for hashing", e);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
