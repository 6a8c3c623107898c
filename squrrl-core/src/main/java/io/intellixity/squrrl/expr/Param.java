package io.intellixity.squrrl.expr;

import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.regex.Pattern;

/**
 * A place holder for a value bound at execution time.
 * <p>
 * Named parameters render as {@code :name}; unnamed ones render the positional marker of the
 * rendering session. An explicit {@code placeholder} replaces both, for drivers with their own
 * convention.
 */
public record Param(String name, String placeholder) implements ValueExpression {
  private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  public Param {
    if (name != null && !NAME.matcher(name).matches()) {
      throw new MalformedExpressionException("Invalid parameter name: '" + name + "'");
    }
    if (placeholder != null && placeholder.isBlank()) {
      throw new MalformedExpressionException("Parameter placeholder must not be blank");
    }
  }

  public static Param named(String name) {
    MalformedExpressionException.requireText(name, "Named parameter requires a name");
    return new Param(name, null);
  }

  public static Param positional() { return new Param(null, null); }

  public static Param withPlaceholder(String name, String placeholder) {
    MalformedExpressionException.requireText(placeholder, "Parameter placeholder must not be blank");
    return new Param(name, placeholder);
  }

  public boolean isNamed() { return name != null; }

  /** Placeholder text given the session's positional marker (e.g. {@code %s}). */
  public String placeholder(String positionalMarker) {
    if (placeholder != null) return placeholder;
    if (name != null) return ":" + name;
    return positionalMarker;
  }
}
