package org.chucc.graphserver.dto;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Query parameters of relationship search.
 *
 * @param type single type filter
 * @param types any-of type filter
 * @param srcId source object (version or canonical id)
 * @param dstId destination object (version or canonical id)
 * @param branchRef branch id, "main" or absent
 * @param includeDeleted whether tombstoned heads are returned
 * @param limit page size
 * @param cursor cursor from a previous page
 * @param order "asc" or "desc"
 */
public record RelationshipSearchCriteria(
    String type,
    List<String> types,
    UUID srcId,
    UUID dstId,
    String branchRef,
    boolean includeDeleted,
    Integer limit,
    String cursor,
    String order
) {

  /**
   * Compact constructor with defensive copying.
   */
  public RelationshipSearchCriteria {
    types = types == null ? List.of() : List.copyOf(types);
  }

  /**
   * Effective type filter.
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
}
