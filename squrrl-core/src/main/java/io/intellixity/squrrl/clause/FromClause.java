package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.ArrayList;
import java.util.List;

/** {@code FROM t1, t2 JOIN ..}: comma-separated table expressions followed by ordered joins. */
public record FromClause(List<TableExpression> tables, List<Join> joins) implements Clause {
  public FromClause {
    tables = MalformedExpressionException.requireNonEmpty(tables, "FROM requires at least one table expression");
    joins = MalformedExpressionException.copyOrEmpty(joins, "FROM joins");
  }

  @Override
  public ClauseKey key() { return ClauseKey.FROM; }

  public static FromClause of(String table) { return of(Literal.of(table)); }

  public static FromClause of(TableExpression table, Join... joins) {
    return new FromClause(List.of(table), List.of(joins));
  }

  public FromClause plus(Join join) {
    List<Join> out = new ArrayList<>(joins);
    out.add(join);
    return new FromClause(tables, out);
  }
}
