package org.chucc.graphserver.util;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.chucc.graphserver.dto.PropertyPredicate;

/**
 * Evaluates {@link PropertyPredicate} filters against entity properties.
 *
 * <p>Numbers are compared by value regardless of their Java type; strings compare
 * lexicographically. A missing value only satisfies {@code notExists}, {@code notEquals}
 * and {@code notIn}.
 */
public final class PredicateEvaluator {

  private static final Object MISSING = new Object();

  private PredicateEvaluator() {
    // Utility class
  }

  /**
   * Evaluates a predicate; a null predicate matches everything.
   *
   * @param predicate the predicate
   * @param properties property map
   * @return true if the properties satisfy the predicate
   */
  public static boolean matches(PropertyPredicate predicate, Map<String, Object> properties) {
    if (predicate == null) {
      return true;
    }
    Object actual = resolve(predicate.path(), properties);
    boolean present = actual != MISSING && actual != null;
    Object expected = predicate.value();
    return switch (predicate.operator()) {
      case "exists" -> present;
      case "notExists" -> !present;
      case "equals" -> present && valueEquals(actual, expected);
      case "notEquals" -> !present || !valueEquals(actual, expected);
      case "contains" -> present && contains(actual, expected);
      case "greaterThan" -> present && compare(actual, expected).map(c -> c > 0).orElse(false);
      case "lessThan" -> present && compare(actual, expected).map(c -> c < 0).orElse(false);
      case "greaterThanOrEqual" ->
          present && compare(actual, expected).map(c -> c >= 0).orElse(false);
      case "lessThanOrEqual" ->
          present && compare(actual, expected).map(c -> c <= 0).orElse(false);
      case "in" -> present && inCollection(actual, expected);
      case "notIn" -> !present || !inCollection(actual, expected);
      case "matches" -> present && regexMatches(actual, expected);
      default -> throw new IllegalArgumentException("Unknown operator: " + predicate.operator());
    };
  }

  /**
   * Resolves a JSON Pointer against a property map.
   *
   * @param pointer JSON Pointer, e.g. {@code /address/city} or {@code /tags/0}
   * @param properties property map
   * @return the value, or a sentinel when the path does not exist
   */
  static Object resolve(String pointer, Map<String, Object> properties) {
    Object current = properties;
    for (String raw : pointer.substring(1).split("/", -1)) {
      String token = raw.replace("~1", "/").replace("~0", "~");
      if (current instanceof Map<?, ?> map) {
        if (!map.containsKey(token)) {
          return MISSING;
        }
        current = map.get(token);
      } else if (current instanceof List<?> list) {
        try {
          int index = Integer.parseInt(token);
          if (index < 0 || index >= list.size()) {
            return MISSING;
          }
          current = list.get(index);
        } catch (NumberFormatException e) {
          return MISSING;
        }
      } else {
        return MISSING;
      }
    }
    return current;
  }

  private static boolean valueEquals(Object actual, Object expected) {
    if (actual instanceof Number a && expected instanceof Number e) {
      return toDecimal(a).compareTo(toDecimal(e)) == 0;
    }
    return Objects.equals(actual, expected);
  }

  private static boolean contains(Object actual, Object expected) {
    if (actual instanceof String s && expected != null) {
      return s.contains(expected.toString());
    }
    if (actual instanceof Collection<?> c) {
      return c.stream().anyMatch(item -> valueEquals(item, expected));
    }
    return false;
  }

  private static boolean inCollection(Object actual, Object expected) {
    if (!(expected instanceof Collection<?> candidates)) {
      return false;
    }
    return candidates.stream().anyMatch(candidate -> valueEquals(actual, candidate));
  }

  private static Optional<Integer> compare(Object actual, Object expected) {
    if (actual instanceof Number a && expected instanceof Number e) {
      return Optional.of(toDecimal(a).compareTo(toDecimal(e)));
    }
    if (actual instanceof String a && expected instanceof String e) {
      return Optional.of(a.compareTo(e));
    }
    return Optional.empty();
  }

  private static boolean regexMatches(Object actual, Object expected) {
    if (!(actual instanceof String s) || expected == null) {
      return false;
    }
    try {
      return Pattern.compile(expected.toString()).matcher(s).find();
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("Invalid regular expression: " + expected, e);
    }
  }

  private static BigDecimal toDecimal(Number n) {
    return n instanceof BigDecimal bd ? bd : new BigDecimal(n.toString());
  }
}
