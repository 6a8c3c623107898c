package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.ArrayList;
import java.util.List;

/** {@code WITH [RECURSIVE] q1 AS (..), q2 AS (..)}; entries keep their declaration order. */
public record WithClause(boolean recursive, List<CommonTableExpression> queries) implements Clause {
  public WithClause {
    queries = MalformedExpressionException.requireNonEmpty(queries, "WITH requires at least one named query");
  }

  @Override
  public ClauseKey key() { return ClauseKey.WITH; }

  public static WithClause of(CommonTableExpression... queries) {
    return new WithClause(false, List.of(queries));
  }

  public static WithClause recursive(CommonTableExpression... queries) {
    return new WithClause(true, List.of(queries));
  }

  public WithClause plus(CommonTableExpression query) {
    List<CommonTableExpression> out = new ArrayList<>(queries);
    out.add(query);
    return new WithClause(recursive, out);
  }

  public WithClause asRecursive() {
    return new WithClause(true, queries);
  }
}
