package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.chucc.graphserver.domain.GraphRelationship;

/**
 * Live relationships touching one object on a branch.
 *
 * @param outgoing relationships with the object as source
 * @param incoming relationships with the object as destination
 */
public record ObjectEdgesResponse(
    @JsonProperty("outgoing") List<GraphRelationship> outgoing,
    @JsonProperty("incoming") List<GraphRelationship> incoming
) {

  /**
   * Compact constructor with defensive copying.
   */
  public ObjectEdgesResponse {
    outgoing = outgoing == null ? List.of() : List.copyOf(outgoing);
    incoming = incoming == null ? List.of() : List.copyOf(incoming);
  }
}
