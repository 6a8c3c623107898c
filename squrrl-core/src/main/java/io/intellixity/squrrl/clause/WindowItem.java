package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.Expression;
import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.statement.MalformedExpressionException;

/**
 * {@code aggregate OVER (window) AS alias}. A window that only names an existing WINDOW definition
 * renders as {@code OVER name}.
 */
public record WindowItem(Expression aggregate, WindowSpec over, String alias) implements SelectItem {
  public WindowItem {
    MalformedExpressionException.require(aggregate, "Window item requires an aggregate");
    over = over == null ? WindowSpec.EMPTY : over;
    MalformedExpressionException.requireText(alias, "Window item requires an alias");
  }

  public static WindowItem of(String aggregate, WindowSpec over, String alias) {
    return new WindowItem(Literal.of(aggregate), over, alias);
  }
}
