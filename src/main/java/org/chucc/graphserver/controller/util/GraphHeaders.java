package org.chucc.graphserver.controller.util;

import java.util.UUID;
import org.springframework.http.HttpHeaders;

/**
 * Helpers for the version headers of the graph API.
 *
 * <p>The ETag of an object or relationship is its version id; clients send it back in
 * {@code If-Match} to make a write conditional on the head they read.
 */
public final class GraphHeaders {

  private GraphHeaders() {
    // Utility class - prevent instantiation
  }

  /**
   * Builds headers carrying the ETag of a version.
   *
   * @param versionId the version id
   * @return headers with a strong ETag
   */
  public static HttpHeaders etag(UUID versionId) {
    HttpHeaders headers = new HttpHeaders();
    headers.setETag("\"" + versionId + "\"");
    return headers;
  }

  /**
   * Parses an {@code If-Match} header value.
   * Quotes and a weak prefix are ignored; {@code *} and absence mean no precondition.
   *
   * @param value raw header value, may be null
   * @return the expected version id, or null
   * @throws IllegalArgumentException if the value is not a version id
   */
  public static UUID parseIfMatch(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String trimmed = value.trim();
    if ("*".equals(trimmed)) {
      return null;
    }
    if (trimmed.startsWith("W/")) {
      trimmed = trimmed.substring(2);
    }
    if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
      trimmed = trimmed.substring(1, trimmed.length() - 1);
    }
    try {
      return UUID.fromString(trimmed);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("If-Match must carry a version id: " + value, e);
    }
  }
}
