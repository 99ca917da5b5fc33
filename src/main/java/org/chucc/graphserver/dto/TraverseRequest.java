package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;
import org.chucc.graphserver.exception.ValidationException;

/**
 * Request DTO for paginated, optionally multi-phase traversal.
 * Without {@code edgePhases} the top-level direction, depth and filters form a single phase.
 *
 * @param rootIds root object ids (version or canonical)
 * @param direction out, in or both (default both)
 * @param maxDepth hop limit for the single-phase form
 * @param maxNodes node limit, roots included
 * @param maxEdges edge limit
 * @param relationshipTypes relationship types to follow
 * @param objectTypes object types to reach
 * @param labels labels of reachable objects (any-of)
 * @param branchId branch to read, absent for main
 * @param limit page size
 * @param pageDirection forward (default) or backward
 * @param cursor page boundary from a previous response
 * @param edgePhases ordered phases
 * @param nodeFilter predicate on reached objects' properties
 * @param edgeFilter predicate on followed relationships' properties
 * @param returnPaths whether nodes carry root-to-node paths
 * @param maxPathsPerNode path cap per node
 */
public record TraverseRequest(
    @JsonProperty("root_ids") List<UUID> rootIds,
    @JsonProperty("direction") String direction,
    @JsonProperty("max_depth") Integer maxDepth,
    @JsonProperty("max_nodes") Integer maxNodes,
    @JsonProperty("max_edges") Integer maxEdges,
    @JsonProperty("relationship_types") List<String> relationshipTypes,
    @JsonProperty("object_types") List<String> objectTypes,
    @JsonProperty("labels") List<String> labels,
    @JsonProperty("branch_id") UUID branchId,
    @JsonProperty("limit") Integer limit,
    @JsonProperty("page_direction") String pageDirection,
    @JsonProperty("cursor") String cursor,
    @JsonProperty("edgePhases") List<EdgePhase> edgePhases,
    @JsonProperty("nodeFilter") PropertyPredicate nodeFilter,
    @JsonProperty("edgeFilter") PropertyPredicate edgeFilter,
    @JsonProperty("returnPaths") Boolean returnPaths,
    @JsonProperty("maxPathsPerNode") Integer maxPathsPerNode
) {

  /** Default path cap per node. */
  public static final int DEFAULT_PATHS_PER_NODE = 3;

  /** Maximum path cap per node. */
  public static final int MAX_PATHS_PER_NODE = 10;

  /**
   * Compact constructor with defensive copying.
   */
  public TraverseRequest {
    rootIds = rootIds == null ? List.of() : List.copyOf(rootIds);
    relationshipTypes = relationshipTypes == null ? List.of() : List.copyOf(relationshipTypes);
    objectTypes = objectTypes == null ? List.of() : List.copyOf(objectTypes);
    labels = labels == null ? List.of() : List.copyOf(labels);
    edgePhases = edgePhases == null ? List.of() : List.copyOf(edgePhases);
  }

  /**
   * Validates the request shape. Bounds are checked against configuration by the service.
   *
   * @throws ValidationException if validation fails
   */
  public void validate() {
    if (rootIds.isEmpty()) {
      throw new ValidationException("root_ids is required");
    }
    for (int i = 0; i < edgePhases.size(); i++) {
      if (edgePhases.get(i) == null) {
        throw new ValidationException("edgePhases[" + i + "] cannot be null");
      }
      edgePhases.get(i).validate(i);
    }
    if (nodeFilter != null) {
      nodeFilter.validate("nodeFilter");
    }
    if (edgeFilter != null) {
      edgeFilter.validate("edgeFilter");
    }
    if (maxPathsPerNode != null
        && (maxPathsPerNode < 1 || maxPathsPerNode > MAX_PATHS_PER_NODE)) {
      throw new ValidationException("maxPathsPerNode must be between 1 and "
          + MAX_PATHS_PER_NODE);
    }
    if (pageDirection != null && !"forward".equalsIgnoreCase(pageDirection)
        && !"backward".equalsIgnoreCase(pageDirection)) {
      throw new ValidationException("page_direction must be 'forward' or 'backward'");
    }
  }

  public boolean isReturnPaths() {
    return Boolean.TRUE.equals(returnPaths);
  }

  public boolean isBackward() {
    return "backward".equalsIgnoreCase(pageDirection);
  }

  /**
   * Returns the effective path cap.
   *
   * @return the cap
   */
  public int effectiveMaxPathsPerNode() {
    return maxPathsPerNode != null ? maxPathsPerNode : DEFAULT_PATHS_PER_NODE;
  }
}
