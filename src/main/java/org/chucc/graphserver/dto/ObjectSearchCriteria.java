package org.chucc.graphserver.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Query parameters of object search.
 *
 * @param type single type filter
 * @param types any-of type filter
 * @param label single label filter
 * @param labels any-of label filter
 * @param status status filter
 * @param key business key filter
 * @param branchRef branch id, "main" or absent
 * @param includeDeleted whether tombstoned heads are returned
 * @param limit page size (absent for the default)
 * @param cursor cursor from a previous page
 * @param order "asc" or "desc" by created_at
 */
public record ObjectSearchCriteria(
    String type,
    List<String> types,
    String label,
    List<String> labels,
    String status,
    String key,
    String branchRef,
    boolean includeDeleted,
    Integer limit,
    String cursor,
    String order
) {

  /**
   * Compact constructor with defensive copying.
   */
  public ObjectSearchCriteria {
    types = types == null ? List.of() : List.copyOf(types);
    labels = labels == null ? List.of() : List.copyOf(labels);
  }

  /**
   * Effective type filter: {@code type} plus {@code types}.
   *
   * @return accepted types, empty for any
   */
  public List<String> allTypes() {
    List<String> all = new ArrayList<>(types);
    if (type != null && !type.isBlank()) {
      all.add(type);
    }
    return all;
  }

  /**
   * Effective label filter: {@code label} plus {@code labels}.
   *
   * @return accepted labels (any-of), empty for any
   */
  public List<String> allLabels() {
    List<String> all = new ArrayList<>(labels);
    if (label != null && !label.isBlank()) {
      all.add(label);
    }
    return all;
  }
}
