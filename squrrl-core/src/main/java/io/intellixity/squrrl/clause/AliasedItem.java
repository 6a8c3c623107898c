package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.Expression;
import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.statement.MalformedExpressionException;

/** {@code expression AS alias}. */
public record AliasedItem(Expression expression, String alias) implements SelectItem {
  public AliasedItem {
    MalformedExpressionException.require(expression, "Aliased item requires an expression");
    MalformedExpressionException.requireText(alias, "Aliased item requires an alias");
  }

  public static AliasedItem of(String expression, String alias) {
    return new AliasedItem(Literal.of(expression), alias);
  }
}
