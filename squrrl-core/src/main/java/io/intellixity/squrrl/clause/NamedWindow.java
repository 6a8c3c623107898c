package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.statement.MalformedExpressionException;

/** {@code name AS (spec)} inside a WINDOW clause. */
public record NamedWindow(String name, WindowSpec spec) {
  public NamedWindow {
    MalformedExpressionException.requireText(name, "Window definition requires a name");
    spec = spec == null ? WindowSpec.EMPTY : spec;
  }
}
