package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for traversal: one page of the breadth-first node order.
 *
 * <p>Positions are 0-based offsets into the full node order; {@code approx_position_end} is
 * exclusive. Cursors are page boundaries: a forward page starts at its cursor, a backward page
 * ends at it.
 *
 * @param roots canonical ids of the roots found
 * @param nodes nodes on this page
 * @param edges edges touching this page whose endpoints are both in the result
 * @param truncated whether a bound cut the traversal short
 * @param maxDepthReached deepest hop reached
 * @param totalNodes nodes in the full result
 * @param hasNextPage whether nodes follow this page
 * @param hasPreviousPage whether nodes precede this page
 * @param nextCursor cursor for the following page (forward)
 * @param previousCursor cursor for the preceding page (backward)
 * @param approxPositionStart offset of the first node on this page
 * @param approxPositionEnd offset after the last node on this page
 * @param pageDirection direction used for this page
 * @param queryTimeMs wall time in milliseconds
 * @param resultCount nodes on this page
 */
public record TraverseResponse(
    @JsonProperty("roots") List<UUID> roots,
    @JsonProperty("nodes") List<TraverseNode> nodes,
    @JsonProperty("edges") List<TraversalEdge> edges,
    @JsonProperty("truncated") boolean truncated,
    @JsonProperty("max_depth_reached") int maxDepthReached,
    @JsonProperty("total_nodes") int totalNodes,
    @JsonProperty("has_next_page") boolean hasNextPage,
    @JsonProperty("has_previous_page") boolean hasPreviousPage,
    @JsonProperty("next_cursor") String nextCursor,
    @JsonProperty("previous_cursor") String previousCursor,
    @JsonProperty("approx_position_start") int approxPositionStart,
    @JsonProperty("approx_position_end") int approxPositionEnd,
    @JsonProperty("page_direction") String pageDirection,
    @JsonProperty("query_time_ms") double queryTimeMs,
    @JsonProperty("result_count") int resultCount
) {

  /**
   * Compact constructor with defensive copying.
   */
  public TraverseResponse {
    roots = roots == null ? List.of() : List.copyOf(roots);
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
    edges = edges == null ? List.of() : List.copyOf(edges);
  }
}
