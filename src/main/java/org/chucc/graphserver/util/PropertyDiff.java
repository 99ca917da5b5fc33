package org.chucc.graphserver.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.chucc.graphserver.domain.ChangeSummary;

/**
 * Computes property-level differences between entity versions.
 *
 * <p>Paths use JSON Pointer syntax; nested maps are flattened to their leaves
 * (e.g. {@code /address/city}). Non-map values, including lists, are compared whole.
 */
public final class PropertyDiff {

  private PropertyDiff() {
    // Utility class
  }

  /**
   * Flattens a property map to leaf values keyed by JSON pointer path.
   *
   * @param properties property map
   * @return path to leaf value, sorted by path
   */
  public static Map<String, Object> flatten(Map<String, Object> properties) {
    Map<String, Object> leaves = new LinkedHashMap<>();
    flattenInto("", properties, leaves);
    List<String> keys = new ArrayList<>(leaves.keySet());
    Collections.sort(keys);
    Map<String, Object> sorted = new LinkedHashMap<>();
    for (String k : keys) {
      sorted.put(k, leaves.get(k));
    }
    return sorted;
  }

  @SuppressWarnings("unchecked")
  private static void flattenInto(String prefix, Map<String, Object> map,
      Map<String, Object> out) {
    if (map == null) {
      return;
    }
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      String path = prefix + "/" + escape(entry.getKey());
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested && !nested.isEmpty()) {
        flattenInto(path, (Map<String, Object>) nested, out);
      } else {
        out.put(path, value);
      }
    }
  }

  private static String escape(String key) {
    return key.replace("~", "~0").replace("/", "~1");
  }

  /**
   * Lists the property paths whose values differ between two maps.
   *
   * @param before old properties
   * @param after new properties
   * @return sorted differing paths
   */
  public static List<String> changedPaths(Map<String, Object> before, Map<String, Object> after) {
    Map<String, Object> left = flatten(before);
    Map<String, Object> right = flatten(after);
    Set<String> paths = new TreeSet<>();
    for (Map.Entry<String, Object> e : left.entrySet()) {
      if (!right.containsKey(e.getKey()) || !Objects.equals(e.getValue(), right.get(e.getKey()))) {
        paths.add(e.getKey());
      }
    }
    for (String path : right.keySet()) {
      if (!left.containsKey(path)) {
        paths.add(path);
      }
    }
    return List.copyOf(paths);
  }

  /**
   * Builds a change summary between two versions' fields.
   *
   * @param beforeProps properties of the superseded version (null for a first version)
   * @param afterProps properties of the new version
   * @param meta non-property changes, keyed by field name
   * @return the summary
   */
  public static ChangeSummary summarize(Map<String, Object> beforeProps,
      Map<String, Object> afterProps, Map<String, Object> meta) {
    Map<String, Object> left = flatten(beforeProps);
    Map<String, Object> right = flatten(afterProps);
    List<String> added = new ArrayList<>();
    List<String> removed = new ArrayList<>();
    List<String> updated = new ArrayList<>();
    for (Map.Entry<String, Object> e : right.entrySet()) {
      if (!left.containsKey(e.getKey())) {
        added.add(e.getKey());
      } else if (!Objects.equals(left.get(e.getKey()), e.getValue())) {
        updated.add(e.getKey());
      }
    }
    for (String path : left.keySet()) {
      if (!right.containsKey(path)) {
        removed.add(path);
      }
    }
    Set<String> all = new TreeSet<>(added);
    all.addAll(removed);
    all.addAll(updated);
    return new ChangeSummary(added, removed, updated, new ArrayList<>(all), meta);
  }
}
