package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;
import java.util.UUID;
import org.chucc.graphserver.domain.Branch;

/**
 * Branch information DTO.
 */
@Schema(description = "A named isolation scope for graph writes")
public record BranchResponse(
    @JsonProperty("id") UUID id,
    @JsonProperty("name") String name,
    @Schema(description = "Base branch; absent when branched from main")
    @JsonProperty("parent_branch_id") UUID parentBranchId,
    @JsonProperty("created_at") Instant createdAt
) {

  /**
   * Maps a branch to its wire form.
   *
   * @param branch the branch
   * @return the response
   */
  public static BranchResponse from(Branch branch) {
    return new BranchResponse(branch.getId(), branch.getName(), branch.getParentBranchId(),
        branch.getCreatedAt());
  }
}
