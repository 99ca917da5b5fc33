package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for analytics listings.
 *
 * @param items listed objects
 * @param total number of listed objects
 * @param meta effective query parameters
 */
public record AnalyticsResponse(
    @JsonProperty("items") List<AnalyticsItem> items,
    @JsonProperty("total") int total,
    @JsonProperty("meta") Map<String, Object> meta
) {

  /**
   * Compact constructor with defensive copying.
   */
  public AnalyticsResponse {
    items = items == null ? List.of() : List.copyOf(items);
    meta = meta == null ? Map.of() : new LinkedHashMap<>(meta);
  }
}
