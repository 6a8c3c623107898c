package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.ValueExpression;
import io.intellixity.squrrl.statement.MalformedExpressionException;

/**
 * {@code FETCH FIRST|NEXT [count] ROWS ONLY|WITH TIES}. This is the only form rendered: without
 * {@code WITH TIES} the clause always ends in {@code ROWS ONLY}, never in a bare {@code ROWS}.
 */
public record FetchClause(Position position, ValueExpression count, boolean withTies) implements Clause {
  public enum Position { FIRST, NEXT }

  public FetchClause {
    MalformedExpressionException.require(position, "FETCH requires FIRST or NEXT");
  }

  @Override
  public ClauseKey key() { return ClauseKey.FETCH; }

  public static FetchClause first(ValueExpression count) { return new FetchClause(Position.FIRST, count, false); }

  public static FetchClause next(ValueExpression count) { return new FetchClause(Position.NEXT, count, false); }

  public FetchClause includingTies() { return new FetchClause(position, count, true); }
}
