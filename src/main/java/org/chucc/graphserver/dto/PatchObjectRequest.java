package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for a partial object update.
 *
 * <p>Properties are merged into the current ones; a {@code null} value removes the property.
 * Labels are added to the current ones unless {@code replaceLabels} is set.
 *
 * @param properties properties to set or remove
 * @param labels labels to add (or the full label set with {@code replaceLabels})
 * @param replaceLabels whether labels replace instead of extend the current set
 * @param status new status
 */
public record PatchObjectRequest(
    @JsonProperty("properties") Map<String, Object> properties,
    @JsonProperty("labels") List<String> labels,
    @JsonProperty("replaceLabels") Boolean replaceLabels,
    @JsonProperty("status") String status
) {

  /**
   * Validates the request.
   *
   * @throws org.chucc.graphserver.exception.ValidationException if validation fails
   */
  public void validate() {
    EntityValidation.maxLength("status", status, EntityValidation.MAX_STATUS_LENGTH);
    EntityValidation.labels(labels);
  }

  public boolean isReplaceLabels() {
    return Boolean.TRUE.equals(replaceLabels);
  }
}
