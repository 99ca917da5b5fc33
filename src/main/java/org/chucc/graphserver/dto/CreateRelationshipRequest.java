package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import java.util.UUID;
import org.chucc.graphserver.exception.ValidationException;

/**
 * Request DTO for creating a relationship. Creation is an upsert on (type, src, dst, branch).
 *
 * @param type relationship type (required)
 * @param srcId source object, version id or canonical id
 * @param dstId destination object, version id or canonical id
 * @param properties optional properties
 * @param weight optional weight
 * @param branchId target branch, absent for main
 */
public record CreateRelationshipRequest(
    @JsonProperty("type") String type,
    @JsonProperty("src_id") UUID srcId,
    @JsonProperty("dst_id") UUID dstId,
    @JsonProperty("properties") Map<String, Object> properties,
    @JsonProperty("weight") Double weight,
    @JsonProperty("branch_id") UUID branchId
) {

  /**
   * Validates the request.
   *
   * @throws ValidationException if validation fails
   */
  public void validate() {
    EntityValidation.requireType(type);
    if (srcId == null || dstId == null) {
      throw new ValidationException("src_id and dst_id are required");
    }
    if (weight != null && (weight.isNaN() || weight.isInfinite())) {
      throw new ValidationException("weight must be a finite number");
    }
  }
}
