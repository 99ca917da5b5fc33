package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request DTO for bulk object creation. Items are processed independently.
 *
 * @param items create requests
 */
public record BulkCreateObjectsRequest(@JsonProperty("items") List<CreateObjectRequest> items) {

  /**
   * Compact constructor with defensive copying for immutability.
   *
   * @param items create requests (defensively copied)
   */
  public BulkCreateObjectsRequest {
    items = items != null ? Collections.unmodifiableList(new ArrayList<>(items)) : List.of();
  }

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Returns unmodifiable list created in constructor")
  @Override
  public List<CreateObjectRequest> items() {
    return items;
  }
}
