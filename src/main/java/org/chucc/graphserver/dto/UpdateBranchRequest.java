package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.chucc.graphserver.exception.ValidationException;

/**
 * Request DTO for renaming a branch.
 *
 * @param name the new name
 */
public record UpdateBranchRequest(@JsonProperty("name") String name) {

  /**
   * Validates the request fields.
   *
   * @throws ValidationException if the name is missing
   */
  public void validate() {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Branch name is required");
    }
  }
}
