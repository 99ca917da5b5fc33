package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;
import org.chucc.graphserver.exception.ValidationException;

/**
 * Request DTO for bounded breadth-first expansion.
 * Numeric bounds that are absent or zero take the configured defaults.
 *
 * @param rootIds root object ids (version or canonical)
 * @param direction out, in or both (default both)
 * @param maxDepth hop limit
 * @param maxNodes node limit, roots included
 * @param maxEdges edge limit
 * @param relationshipTypes relationship types to follow, all when empty
 * @param objectTypes object types to reach, all when empty
 * @param labels labels of reachable objects (any-of), all when empty
 * @param branchId branch to read, absent for main
 * @param projection object property projection
 * @param includeRelationshipProperties whether edges carry their properties
 */
public record ExpandRequest(
    @JsonProperty("root_ids") List<UUID> rootIds,
    @JsonProperty("direction") String direction,
    @JsonProperty("max_depth") Integer maxDepth,
    @JsonProperty("max_nodes") Integer maxNodes,
    @JsonProperty("max_edges") Integer maxEdges,
    @JsonProperty("relationship_types") List<String> relationshipTypes,
    @JsonProperty("object_types") List<String> objectTypes,
    @JsonProperty("labels") List<String> labels,
    @JsonProperty("branch_id") UUID branchId,
    @JsonProperty("projection") Projection projection,
    @JsonProperty("include_relationship_properties") Boolean includeRelationshipProperties
) {

  /**
   * Compact constructor with defensive copying.
   */
  public ExpandRequest {
    rootIds = rootIds == null ? List.of() : List.copyOf(rootIds);
    relationshipTypes = relationshipTypes == null ? List.of() : List.copyOf(relationshipTypes);
    objectTypes = objectTypes == null ? List.of() : List.copyOf(objectTypes);
    labels = labels == null ? List.of() : List.copyOf(labels);
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
    if (projection != null) {
      projection.validate();
    }
  }

  public boolean isIncludeRelationshipProperties() {
    return Boolean.TRUE.equals(includeRelationshipProperties);
  }
}
