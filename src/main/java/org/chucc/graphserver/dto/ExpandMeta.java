package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Bookkeeping for an expansion: effective bounds, counts and timing.
 *
 * @param requested effective bounds
 * @param nodeCount returned nodes
 * @param edgeCount returned edges
 * @param truncated whether a bound cut the expansion short
 * @param maxDepthReached deepest hop reached
 * @param elapsedMs wall time in milliseconds
 * @param filters filters in effect
 */
public record ExpandMeta(
    @JsonProperty("requested") Requested requested,
    @JsonProperty("node_count") int nodeCount,
    @JsonProperty("edge_count") int edgeCount,
    @JsonProperty("truncated") boolean truncated,
    @JsonProperty("max_depth_reached") int maxDepthReached,
    @JsonProperty("elapsed_ms") double elapsedMs,
    @JsonProperty("filters") Filters filters
) {

  /**
   * Effective bounds after defaults.
   *
   * @param maxDepth hop limit
   * @param maxNodes node limit
   * @param maxEdges edge limit
   * @param direction direction
   */
  public record Requested(
      @JsonProperty("max_depth") int maxDepth,
      @JsonProperty("max_nodes") int maxNodes,
      @JsonProperty("max_edges") int maxEdges,
      @JsonProperty("direction") String direction
  ) {
  }

  /**
   * Filters in effect.
   *
   * @param relationshipTypes followed relationship types
   * @param objectTypes reachable object types
   * @param labels reachable labels
   * @param projection property projection
   * @param includeRelationshipProperties whether edges carry properties
   */
  public record Filters(
      @JsonProperty("relationship_types") List<String> relationshipTypes,
      @JsonProperty("object_types") List<String> objectTypes,
      @JsonProperty("labels") List<String> labels,
      @JsonProperty("projection") Projection projection,
      @JsonProperty("include_relationship_properties") boolean includeRelationshipProperties
  ) {
  }
}
