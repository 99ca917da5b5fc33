package org.chucc.graphserver.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collection;
import java.util.Set;
import org.chucc.graphserver.exception.ValidationException;

/**
 * Filter condition on a property value addressed by a JSON Pointer path.
 *
 * @param path JSON Pointer into the entity's properties (e.g. {@code /year})
 * @param operator comparison operator
 * @param value comparison operand; unused for exists/notExists
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PropertyPredicate(String path, String operator, Object value) {

  /** Supported operators. */
  public static final Set<String> OPERATORS = Set.of(
      "equals", "notEquals", "contains", "greaterThan", "lessThan", "greaterThanOrEqual",
      "lessThanOrEqual", "in", "notIn", "matches", "exists", "notExists");

  /**
   * Validates the predicate.
   *
   * @param field request field name for error messages
   * @throws ValidationException if path or operator are invalid
   */
  public void validate(String field) {
    if (path == null || !path.startsWith("/")) {
      throw new ValidationException(field + ".path must be a JSON Pointer starting with '/'");
    }
    if (operator == null || !OPERATORS.contains(operator)) {
      throw new ValidationException(field + ".operator must be one of " + OPERATORS);
    }
    if (("in".equals(operator) || "notIn".equals(operator))
        && !(value instanceof Collection<?>)) {
      throw new ValidationException(field + ".value must be an array for '" + operator + "'");
    }
  }
}
