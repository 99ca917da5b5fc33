package org.chucc.graphserver.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

/**
 * Response DTO for listing branches in creation order.
 */
@Schema(description = "List of branches")
public record BranchListResponse(
    @Schema(description = "Branches in creation order")
    List<BranchResponse> branches,

    @Schema(description = "Number of branches")
    int total
) {
  /**
   * Compact constructor with defensive copying.
   *
   * @param branches branch entries
   * @param total number of branches
   */
  public BranchListResponse {
    branches = branches != null ? List.copyOf(branches) : List.of();
  }
}
