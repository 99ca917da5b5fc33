package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.chucc.graphserver.exception.ValidationException;

/**
 * One phase of a multi-phase traversal. Phase n starts from the nodes reached in phase n-1.
 *
 * @param relationshipTypes relationship types to follow, all when empty
 * @param direction out, in or both
 * @param maxDepth hops in this phase, 1 to 8
 * @param objectTypes object types to reach, all when empty
 * @param labels labels of reachable objects (any-of), all when empty
 */
public record EdgePhase(
    @JsonProperty("relationshipTypes") List<String> relationshipTypes,
    @JsonProperty("direction") String direction,
    @JsonProperty("maxDepth") Integer maxDepth,
    @JsonProperty("objectTypes") List<String> objectTypes,
    @JsonProperty("labels") List<String> labels
) {

  /** Deepest a single phase may go. */
  public static final int MAX_PHASE_DEPTH = 8;

  /**
   * Compact constructor with defensive copying.
   */
  public EdgePhase {
    relationshipTypes = relationshipTypes == null ? List.of() : List.copyOf(relationshipTypes);
    objectTypes = objectTypes == null ? List.of() : List.copyOf(objectTypes);
    labels = labels == null ? List.of() : List.copyOf(labels);
  }

  /**
   * Validates the phase.
   *
   * @param index phase position, for messages
   * @throws ValidationException if validation fails
   */
  public void validate(int index) {
    if (maxDepth == null || maxDepth < 1 || maxDepth > MAX_PHASE_DEPTH) {
      throw new ValidationException("edgePhases[" + index + "].maxDepth must be between 1 and "
          + MAX_PHASE_DEPTH);
    }
  }
}
