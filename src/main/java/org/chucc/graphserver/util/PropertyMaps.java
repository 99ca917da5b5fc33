package org.chucc.graphserver.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for the open property maps of objects and relationships.
 */
public final class PropertyMaps {

  private PropertyMaps() {
    // Utility class
  }

  /**
   * Copies a map, dropping null values.
   *
   * @param input property map, may be null
   * @return the copy (empty for null input)
   */
  public static Map<String, Object> withoutNulls(Map<String, Object> input) {
    Map<String, Object> copy = new LinkedHashMap<>();
    if (input != null) {
      input.forEach((k, v) -> {
        if (v != null) {
          copy.put(k, v);
        }
      });
    }
    return copy;
  }

  /**
   * Shallow-merges a patch into a base map; a null patch value removes the key.
   *
   * @param base current properties
   * @param patch properties to set or remove, may be null
   * @return the merged copy
   */
  public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> patch) {
    Map<String, Object> merged = new LinkedHashMap<>(base);
    if (patch != null) {
      patch.forEach((k, v) -> {
        if (v == null) {
          merged.remove(k);
        } else {
          merged.put(k, v);
        }
      });
    }
    return merged;
  }
}
