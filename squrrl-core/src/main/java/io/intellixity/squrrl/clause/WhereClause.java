package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.BooleanExpression;
import io.intellixity.squrrl.statement.MalformedExpressionException;

public record WhereClause(BooleanExpression condition) implements Clause {
  public WhereClause {
    MalformedExpressionException.require(condition, "WHERE requires a condition");
  }

  @Override
  public ClauseKey key() { return ClauseKey.WHERE; }
}
