package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.expr.ValueExpression;
import io.intellixity.squrrl.statement.MalformedExpressionException;

/** {@code LIMIT count} or {@code LIMIT ALL} (null count, see {@link #ALL}). */
public record LimitClause(ValueExpression count) implements Clause {
  public static final LimitClause ALL = new LimitClause(null);

  @Override
  public ClauseKey key() { return ClauseKey.LIMIT; }

  public boolean all() { return count == null; }

  public static LimitClause of(ValueExpression count) {
    return new LimitClause(MalformedExpressionException.require(count, "LIMIT requires a count"));
  }

  public static LimitClause of(long count) {
    if (count < 0) throw new MalformedExpressionException("LIMIT must be >= 0");
    return new LimitClause(Literal.of(count));
  }
}
