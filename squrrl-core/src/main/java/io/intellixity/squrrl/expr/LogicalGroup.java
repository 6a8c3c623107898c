package io.intellixity.squrrl.expr;

import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.List;

/** Boolean expressions combined with a single connector, e.g. {@code a AND (b OR c) AND d}. */
public record LogicalGroup(Connector connector, List<BooleanExpression> elements) implements BooleanExpression {
  public LogicalGroup {
    MalformedExpressionException.require(connector, "Logical group requires a connector");
    elements = MalformedExpressionException.requireNonEmpty(elements, "Logical group requires at least one operand");
  }

  public static LogicalGroup and(BooleanExpression... elements) {
    return new LogicalGroup(Connector.AND, List.of(elements));
  }

  public static LogicalGroup or(BooleanExpression... elements) {
    return new LogicalGroup(Connector.OR, List.of(elements));
  }
}
