package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.UUID;
import org.chucc.graphserver.exception.ValidationException;

/**
 * Request DTO for setting the status of many objects.
 *
 * @param ids object ids (version or canonical)
 * @param status the new status
 * @param branchId branch to write on, absent for main
 */
public record BulkUpdateStatusRequest(
    @JsonProperty("ids") List<UUID> ids,
    @JsonProperty("status") String status,
    @JsonProperty("branch_id") UUID branchId
) {

  /**
   * Compact constructor with defensive copying.
   */
  public BulkUpdateStatusRequest {
    ids = ids == null ? List.of() : List.copyOf(ids);
  }

  /**
   * Validates the request.
   *
   * @throws ValidationException if validation fails
   */
  public void validate() {
    if (status == null || status.isBlank()) {
      throw new ValidationException("status is required");
    }
    EntityValidation.maxLength("status", status, EntityValidation.MAX_STATUS_LENGTH);
  }
}
