package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.expr.ValueExpression;
import io.intellixity.squrrl.statement.MalformedExpressionException;

public record OffsetClause(ValueExpression count) implements Clause {
  public OffsetClause {
    MalformedExpressionException.require(count, "OFFSET requires a count");
  }

  @Override
  public ClauseKey key() { return ClauseKey.OFFSET; }

  public static OffsetClause of(long count) {
    if (count < 0) throw new MalformedExpressionException("OFFSET must be >= 0");
    return new OffsetClause(Literal.of(count));
  }
}
