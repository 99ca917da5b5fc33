package org.chucc.graphserver.dto;

import java.util.List;
import org.chucc.graphserver.exception.ValidationException;

/**
 * Field limits shared by object and relationship requests.
 */
final class EntityValidation {

  static final int MAX_TYPE_LENGTH = 64;
  static final int MAX_KEY_LENGTH = 128;
  static final int MAX_STATUS_LENGTH = 64;
  static final int MAX_LABELS = 32;
  static final int MAX_LABEL_LENGTH = 64;

  private EntityValidation() {
    // Utility class
  }

  static void requireType(String type) {
    if (type == null || type.isBlank()) {
      throw new ValidationException("type is required");
    }
    maxLength("type", type, MAX_TYPE_LENGTH);
  }

  static void maxLength(String field, String value, int max) {
    if (value != null && value.length() > max) {
      throw new ValidationException(field + " cannot exceed " + max + " characters");
    }
  }

  static void labels(List<String> labels) {
    if (labels == null) {
      return;
    }
    if (labels.size() > MAX_LABELS) {
      throw new ValidationException("labels cannot contain more than " + MAX_LABELS + " entries");
    }
    for (String label : labels) {
      if (label == null || label.isBlank()) {
        throw new ValidationException("labels cannot contain blank entries");
      }
      maxLength("label", label, MAX_LABEL_LENGTH);
    }
  }
}
