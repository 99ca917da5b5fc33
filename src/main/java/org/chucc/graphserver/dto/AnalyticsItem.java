package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * An object in an analytics listing.
 *
 * @param id head version id
 * @param canonicalId canonical id
 * @param type object type
 * @param key business key
 * @param properties properties
 * @param labels labels
 * @param lastAccessedAt last read, absent if never read
 * @param accessCount number of reads
 * @param daysSinceAccess whole days since the last read, absent if never read
 * @param createdAt creation time of the head version
 */
public record AnalyticsItem(
    @JsonProperty("id") UUID id,
    @JsonProperty("canonical_id") UUID canonicalId,
    @JsonProperty("type") String type,
    @JsonProperty("key") String key,
    @JsonProperty("properties") Map<String, Object> properties,
    @JsonProperty("labels") List<String> labels,
    @JsonProperty("last_accessed_at") Instant lastAccessedAt,
    @JsonProperty("access_count") long accessCount,
    @JsonProperty("days_since_access") Long daysSinceAccess,
    @JsonProperty("created_at") Instant createdAt
) {

  /**
   * Compact constructor with defensive copying.
   */
  public AnalyticsItem {
    labels = labels == null ? List.of() : List.copyOf(labels);
  }
}
