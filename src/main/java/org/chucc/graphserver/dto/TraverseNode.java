package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;

/**
 * A node reached by traversal.
 *
 * @param id head version id
 * @param canonicalId canonical id
 * @param depth hops from the nearest root, across phases
 * @param type object type
 * @param key business key
 * @param labels labels
 * @param phaseIndex phase that reached the node, absent for roots
 * @param paths root-to-node canonical id paths, when requested
 */
public record TraverseNode(
    @JsonProperty("id") UUID id,
    @JsonProperty("canonical_id") UUID canonicalId,
    @JsonProperty("depth") int depth,
    @JsonProperty("type") String type,
    @JsonProperty("key") String key,
    @JsonProperty("labels") List<String> labels,
    @JsonProperty("phaseIndex") Integer phaseIndex,
    @JsonProperty("paths") List<List<String>> paths
) {

  /**
   * Compact constructor with defensive copying.
   */
  public TraverseNode {
    labels = labels == null ? List.of() : List.copyOf(labels);
    paths = paths == null ? null : paths.stream().map(List::copyOf).toList();
  }
}
