package org.chucc.graphserver.util;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.UUID;

/**
 * Encodes and decodes opaque pagination cursors.
 *
 * <p>Search cursors carry the (created_at, id) of the last returned item; traversal cursors
 * carry a result offset. Both are URL-safe base64 without padding.
 */
public final class CursorCodec {

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private CursorCodec() {
    // Utility class
  }

  /**
   * Position of the last item of a search page.
   *
   * @param createdAt item timestamp
   * @param id item id
   */
  public record SearchPosition(Instant createdAt, UUID id) {
  }

  /**
   * Encodes a search cursor.
   *
   * @param createdAt created_at of the last item
   * @param id id of the last item
   * @return the cursor
   */
  public static String encodeSearch(Instant createdAt, UUID id) {
    return encode(createdAt.toString() + "|" + id);
  }

  /**
   * Decodes a search cursor.
   *
   * @param cursor the cursor
   * @return the position
   * @throws IllegalArgumentException if the cursor is malformed
   */
  public static SearchPosition decodeSearch(String cursor) {
    String raw = decode(cursor);
    int sep = raw.indexOf('|');
    if (sep < 0) {
      throw new IllegalArgumentException("Invalid cursor");
    }
    try {
      return new SearchPosition(Instant.parse(raw.substring(0, sep)),
          UUID.fromString(raw.substring(sep + 1)));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid cursor", e);
    }
  }

  /**
   * Encodes a traversal offset cursor.
   *
   * @param offset zero-based offset into the result
   * @return the cursor
   */
  public static String encodeOffset(int offset) {
    return encode("o:" + offset);
  }

  /**
   * Decodes a traversal offset cursor.
   *
   * @param cursor the cursor
   * @return the offset
   * @throws IllegalArgumentException if the cursor is malformed
   */
  public static int decodeOffset(String cursor) {
    String raw = decode(cursor);
    if (!raw.startsWith("o:")) {
      throw new IllegalArgumentException("Invalid cursor");
    }
    try {
      int offset = Integer.parseInt(raw.substring(2));
      if (offset < 0) {
        throw new IllegalArgumentException("Invalid cursor");
      }
      return offset;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid cursor", e);
    }
  }

  private static String encode(String raw) {
    return ENCODER.encodeToString(raw.getBytes(StandardCharsets.UTF_8));
  }

  private static String decode(String cursor) {
    try {
      return new String(DECODER.decode(cursor), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid cursor", e);
    }
  }
}
