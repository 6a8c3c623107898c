package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.BooleanExpression;
import io.intellixity.squrrl.statement.MalformedExpressionException;

public record HavingClause(BooleanExpression condition) implements Clause {
  public HavingClause {
    MalformedExpressionException.require(condition, "HAVING requires a condition");
  }

  @Override
  public ClauseKey key() { return ClauseKey.HAVING; }
}
