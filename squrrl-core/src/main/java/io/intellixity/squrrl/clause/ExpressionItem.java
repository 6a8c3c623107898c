package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.Expression;
import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.statement.MalformedExpressionException;

public record ExpressionItem(Expression expression) implements SelectItem {
  public ExpressionItem {
    MalformedExpressionException.require(expression, "Select item requires an expression");
  }

  public static ExpressionItem of(String text) { return new ExpressionItem(Literal.of(text)); }
}
