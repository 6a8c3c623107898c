package io.intellixity.squrrl.builder;

import io.intellixity.squrrl.clause.*;
import io.intellixity.squrrl.expr.Expression;

import java.util.List;

/**
 * Entry points of the fluent API.
 *
 * <pre>
 * SqlQuery.select("*").from("employees").where(Predicates.eq("id", Predicates.param("id"))).sql();
 * </pre>
 */
public final class SqlQuery {
  private SqlQuery() {}

  public static SelectQuery select(String... items) {
    return SelectQuery.start(SelectClause.of(items));
  }

  public static SelectQuery select(SelectItem... items) {
    return SelectQuery.start(SelectClause.of(items));
  }

  public static SelectQuery selectDistinct(String... items) {
    return SelectQuery.start(new SelectClause(SetQuantifier.DISTINCT, List.of(), SelectClause.of(items).items()));
  }

  public static SelectQuery selectDistinct(SelectItem... items) {
    return SelectQuery.start(SelectClause.distinct(items));
  }

  public static SelectQuery selectDistinctOn(List<Expression> on, SelectItem... items) {
    return SelectQuery.start(SelectClause.distinctOn(on, items));
  }

  public static WithQuery with(String name, SelectQuery query) {
    return new WithQuery(WithClause.of(CommonTableExpression.of(name, query.statement())));
  }

  public static WithQuery withRecursive(String name, SelectQuery query) {
    return new WithQuery(WithClause.recursive(CommonTableExpression.of(name, query.statement())));
  }

  /** Named query with an explicit column list, or a literal body. */
  public static WithQuery with(CommonTableExpression query) {
    return new WithQuery(WithClause.of(query));
  }
}
