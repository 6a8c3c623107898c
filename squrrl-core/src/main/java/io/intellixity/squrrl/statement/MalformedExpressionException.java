package io.intellixity.squrrl.statement;

import java.util.List;

/**
 * Raised when a condition, clause, window spec or frame lacks a required field or combines
 * fields that cannot appear together.
 */
public final class MalformedExpressionException extends StatementException {
  public MalformedExpressionException(String message) {
    super(message);
  }

  /** Null check used by the model's compact constructors. */
  public static <T> T require(T value, String message) {
    if (value == null) throw new MalformedExpressionException(message);
    return value;
  }

  /** Non-blank check for names, aliases and literal text. */
  public static String requireText(String value, String message) {
    if (value == null || value.isBlank()) throw new MalformedExpressionException(message);
    return value;
  }

  /** Non-empty, null-free copy of a list. */
  public static <T> List<T> requireNonEmpty(List<T> values, String message) {
    if (values == null || values.isEmpty()) throw new MalformedExpressionException(message);
    for (T v : values) {
      if (v == null) throw new MalformedExpressionException(message + " (null element)");
    }
    return List.copyOf(values);
  }

  /** Absent list becomes empty; null elements are still rejected. */
  public static <T> List<T> copyOrEmpty(List<T> values, String message) {
    if (values == null || values.isEmpty()) return List.of();
    return requireNonEmpty(values, message);
  }
}
