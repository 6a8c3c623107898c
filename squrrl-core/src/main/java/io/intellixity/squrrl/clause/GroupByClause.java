package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.Expression;
import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.ArrayList;
import java.util.List;

/** {@code GROUP BY [ALL | DISTINCT] e1, e2}; a null quantifier renders nothing. */
public record GroupByClause(SetQuantifier quantifier, List<Expression> elements) implements Clause {
  public GroupByClause {
    elements = MalformedExpressionException.requireNonEmpty(elements, "GROUP BY requires at least one element");
  }

  @Override
  public ClauseKey key() { return ClauseKey.GROUP_BY; }

  public static GroupByClause of(String... columns) {
    List<Expression> out = new ArrayList<>();
    for (String c : columns) out.add(Literal.of(c));
    return new GroupByClause(null, out);
  }
}
