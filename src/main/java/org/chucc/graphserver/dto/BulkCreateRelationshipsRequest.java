package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request DTO for bulk relationship creation. Items are processed independently.
 *
 * @param items create requests
 */
public record BulkCreateRelationshipsRequest(
    @JsonProperty("items") List<CreateRelationshipRequest> items) {

  /**
   * Compact constructor with defensive copying for immutability.
   *
   * @param items create requests (defensively copied)
   */
  public BulkCreateRelationshipsRequest {
    items = items != null ? Collections.unmodifiableList(new ArrayList<>(items)) : List.of();
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns unmodifiable list created in constructor")
  @Override
  public List<CreateRelationshipRequest> items() {
    return items;
  }
}
