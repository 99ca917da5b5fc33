package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One page of search results.
 *
 * @param items matching entities (resolved heads)
 * @param nextCursor cursor for the next page, absent on the last page
 * @param total number of matches across all pages
 * @param <T> entity type
 */
public record SearchResponse<T>(
    @JsonProperty("items") List<T> items,
    @JsonProperty("next_cursor") String nextCursor,
    @JsonProperty("total") int total
) {

  /**
   * Compact constructor with defensive copying.
   */
  public SearchResponse {
    items = items == null ? List.of() : List.copyOf(items);
  }
}
