package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.chucc.graphserver.exception.ValidationException;

/**
 * Request DTO for a branch merge.
 *
 * @param sourceBranchId branch to merge from ("main" or a branch id)
 * @param execute whether to apply the merge; dry-run when absent or false
 * @param limit hard limit on reported and applied items; the configured default when absent,
 *     zero or negative
 */
public record MergeRequest(
    @JsonProperty("sourceBranchId") String sourceBranchId,
    @JsonProperty("execute") Boolean execute,
    @JsonProperty("limit") Integer limit
) {

  /**
   * Validates the merge request.
   *
   * @throws ValidationException if validation fails
   */
  public void validate() {
    if (sourceBranchId == null || sourceBranchId.isBlank()) {
      throw new ValidationException("sourceBranchId is required");
    }
  }

  public boolean isExecute() {
    return Boolean.TRUE.equals(execute);
  }
}
