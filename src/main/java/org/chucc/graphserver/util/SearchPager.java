package org.chucc.graphserver.util;

import java.util.Comparator;
import java.util.List;
import org.chucc.graphserver.config.GraphProperties;
import org.chucc.graphserver.domain.VersionedEntity;
import org.chucc.graphserver.dto.SearchResponse;
import org.chucc.graphserver.exception.LimitExceededException;
import org.chucc.graphserver.exception.ValidationException;

/**
 * Orders, pages and cursors search results by (created_at, id).
 */
public final class SearchPager {

  private SearchPager() {
    // Utility class
  }

  /**
   * Validates and defaults a page size.
   *
   * @param limit requested size, may be null
   * @param search search settings
   * @return the effective limit
   * @throws LimitExceededException if above the maximum
   * @throws ValidationException if not positive
   */
  public static int effectiveLimit(Integer limit, GraphProperties.Search search) {
    if (limit == null) {
      return search.getDefaultLimit();
    }
    if (limit < 1) {
      throw new ValidationException("limit must be at least 1");
    }
    if (limit > search.getMaxLimit()) {
      throw new LimitExceededException("limit", limit, search.getMaxLimit());
    }
    return limit;
  }

  /**
   * Sorts matches and cuts the page following the cursor.
   *
   * @param matches all matching entities
   * @param order "asc" or "desc" (default)
   * @param cursor cursor of the previous page, may be null
   * @param limit page size
   * @param <T> entity type
   * @return the page
   */
  public static <T extends VersionedEntity<T>> SearchResponse<T> page(List<T> matches,
      String order, String cursor, int limit) {
    boolean ascending = parseAscending(order);
    Comparator<T> byPosition = Comparator.comparing((T v) -> v.createdAt())
        .thenComparing(VersionedEntity::id);
    Comparator<T> comparator = ascending ? byPosition : byPosition.reversed();
    List<T> sorted = matches.stream().sorted(comparator).toList();

    int start = 0;
    if (cursor != null && !cursor.isBlank()) {
      CursorCodec.SearchPosition position = CursorCodec.decodeSearch(cursor);
      start = sorted.size();
      for (int i = 0; i < sorted.size(); i++) {
        T v = sorted.get(i);
        int cmp = v.createdAt().compareTo(position.createdAt());
        if (cmp == 0) {
          cmp = v.id().compareTo(position.id());
        }
        if (ascending ? cmp > 0 : cmp < 0) {
          start = i;
          break;
        }
      }
    }
    int end = Math.min(sorted.size(), start + limit);
    List<T> page = sorted.subList(start, end);
    String next = end < sorted.size() && !page.isEmpty()
        ? CursorCodec.encodeSearch(page.get(page.size() - 1).createdAt(),
            page.get(page.size() - 1).id())
        : null;
    return new SearchResponse<>(page, next, sorted.size());
  }

  private static boolean parseAscending(String order) {
    if (order == null || order.isBlank() || "desc".equalsIgnoreCase(order)) {
      return false;
    }
    if ("asc".equalsIgnoreCase(order)) {
      return true;
    }
    throw new ValidationException("order must be 'asc' or 'desc'");
  }
}
