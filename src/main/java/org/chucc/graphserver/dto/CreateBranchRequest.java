package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.UUID;
import org.chucc.graphserver.exception.ValidationException;

/**
 * Request DTO for creating a branch.
 *
 * @param name branch name
 * @param parentBranchId base branch, absent for main
 */
public record CreateBranchRequest(
    @JsonProperty("name") String name,
    @JsonProperty("parent_branch_id") UUID parentBranchId
) {

  /**
   * Validates the request fields.
   * Name pattern validation delegates to the Branch domain entity.
   *
   * @throws ValidationException if the name is missing
   */
  public void validate() {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Branch name is required");
    }
  }
}
