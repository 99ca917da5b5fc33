package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.chucc.graphserver.exception.ValidationException;

/**
 * Object property projection for expansion results.
 *
 * @param includeObjectProperties property names to keep; all others are dropped
 * @param excludeObjectProperties property names to drop
 */
public record Projection(
    @JsonProperty("include_object_properties") List<String> includeObjectProperties,
    @JsonProperty("exclude_object_properties") List<String> excludeObjectProperties
) {

  /**
   * Compact constructor with defensive copying.
   */
  public Projection {
    includeObjectProperties = includeObjectProperties == null
        ? List.of() : List.copyOf(includeObjectProperties);
    excludeObjectProperties = excludeObjectProperties == null
        ? List.of() : List.copyOf(excludeObjectProperties);
  }

  /**
   * Validates the projection.
   *
   * @throws ValidationException if both include and exclude lists are given
   */
  public void validate() {
    if (!includeObjectProperties.isEmpty() && !excludeObjectProperties.isEmpty()) {
      throw new ValidationException(
          "projection accepts include_object_properties or exclude_object_properties, not both");
    }
  }

  /**
   * Applies the projection to top-level properties.
   *
   * @param properties object properties
   * @return the projected copy
   */
  public Map<String, Object> apply(Map<String, Object> properties) {
    Map<String, Object> projected = new LinkedHashMap<>(properties);
    if (!includeObjectProperties.isEmpty()) {
      Set<String> keep = new HashSet<>(includeObjectProperties);
      projected.keySet().retainAll(keep);
    } else {
      excludeObjectProperties.forEach(projected::remove);
    }
    return projected;
  }
}
