package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A node reached by expansion.
 *
 * @param id head version id
 * @param canonicalId canonical id
 * @param depth hops from the nearest root
 * @param type object type
 * @param key business key
 * @param labels labels
 * @param properties projected properties
 */
public record ExpandNode(
    @JsonProperty("id") UUID id,
    @JsonProperty("canonical_id") UUID canonicalId,
    @JsonProperty("depth") int depth,
    @JsonProperty("type") String type,
    @JsonProperty("key") String key,
    @JsonProperty("labels") List<String> labels,
    @JsonProperty("properties") Map<String, Object> properties
) {

  /**
   * Compact constructor with defensive copying.
   */
  public ExpandNode {
    labels = labels == null ? List.of() : List.copyOf(labels);
  }
}
