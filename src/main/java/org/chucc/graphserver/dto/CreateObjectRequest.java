package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.chucc.graphserver.exception.ValidationException;

/**
 * Request DTO for creating (or upserting) a graph object.
 *
 * @param type object type (required, at most 64 characters)
 * @param key optional business key, unique per (type, branch)
 * @param status optional status
 * @param properties optional property map
 * @param labels optional labels
 * @param branchId target branch, absent for main
 */
public record CreateObjectRequest(
    @JsonProperty("type") String type,
    @JsonProperty("key") String key,
    @JsonProperty("status") String status,
    @JsonProperty("properties") Map<String, Object> properties,
    @JsonProperty("labels") List<String> labels,
    @JsonProperty("branch_id") UUID branchId
) {

  /**
   * Returns the property map as sent.
   *
   * @return property map, may be null
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP",
      justification = "Request DTO; the domain record copies the map")
  @Override
  public Map<String, Object> properties() {
    return properties;
  }

  /**
   * Validates the request.
   *
   * @throws ValidationException if validation fails
   */
  public void validate() {
    EntityValidation.requireType(type);
    if (key != null && key.isBlank()) {
      throw new ValidationException("key cannot be blank");
    }
    EntityValidation.maxLength("key", key, EntityValidation.MAX_KEY_LENGTH);
    EntityValidation.maxLength("status", status, EntityValidation.MAX_STATUS_LENGTH);
    EntityValidation.labels(labels);
  }
}
