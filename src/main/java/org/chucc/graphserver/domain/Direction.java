package org.chucc.graphserver.domain;

import java.util.Locale;

/**
 * Edge direction for graph expansion, relative to the node being expanded.
 */
public enum Direction {
  OUT,
  IN,
  BOTH;

  /**
   * Parses a direction from its wire form.
   * Accepts {@code out}/{@code outgoing}, {@code in}/{@code incoming} and {@code both};
   * null or blank yields the given default.
   *
   * @param value wire value
   * @param defaultDirection direction used when value is absent
   * @return the direction
   * @throws IllegalArgumentException for unknown values
   */
  public static Direction parse(String value, Direction defaultDirection) {
    if (value == null || value.isBlank()) {
      return defaultDirection;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "out", "outgoing" -> OUT;
      case "in", "incoming" -> IN;
      case "both" -> BOTH;
      default -> throw new IllegalArgumentException(
          "Invalid direction: " + value + " (expected out, in or both)");
    };
  }

  public boolean includesOutgoing() {
    return this != IN;
  }

  public boolean includesIncoming() {
    return this != OUT;
  }
}
