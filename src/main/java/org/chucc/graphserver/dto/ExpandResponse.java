package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for expansion.
 *
 * @param roots canonical ids of the roots found
 * @param nodes reached nodes in breadth-first order, roots first
 * @param edges edges whose endpoints are both in {@code nodes}
 * @param truncated whether a bound cut the expansion short
 * @param maxDepthReached deepest hop reached
 * @param totalNodes number of nodes
 * @param meta bookkeeping
 */
public record ExpandResponse(
    @JsonProperty("roots") List<UUID> roots,
    @JsonProperty("nodes") List<ExpandNode> nodes,
    @JsonProperty("edges") List<TraversalEdge> edges,
    @JsonProperty("truncated") boolean truncated,
    @JsonProperty("max_depth_reached") int maxDepthReached,
    @JsonProperty("total_nodes") int totalNodes,
    @JsonProperty("meta") ExpandMeta meta
) {

  /**
   * Compact constructor with defensive copying.
   */
  public ExpandResponse {
    roots = roots == null ? List.of() : List.copyOf(roots);
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
    edges = edges == null ? List.of() : List.copyOf(edges);
  }
}
