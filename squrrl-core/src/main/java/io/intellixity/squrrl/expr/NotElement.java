package io.intellixity.squrrl.expr;

import io.intellixity.squrrl.statement.MalformedExpressionException;

/** Unary NOT for a boolean subtree (can wrap a {@link Condition} chain or a {@link LogicalGroup}). */
public record NotElement(BooleanExpression element) implements BooleanExpression {
  public NotElement {
    MalformedExpressionException.require(element, "NOT requires an operand");
  }
}
