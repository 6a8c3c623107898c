package io.intellixity.squrrl.builder;

import io.intellixity.squrrl.clause.CommonTableExpression;
import io.intellixity.squrrl.clause.SelectClause;
import io.intellixity.squrrl.clause.SelectItem;
import io.intellixity.squrrl.clause.WithClause;

/** A WITH prefix waiting for the SELECT it scopes. */
public final class WithQuery {
  private final WithClause with;

  WithQuery(WithClause with) {
    this.with = with;
  }

  public WithQuery with(String name, SelectQuery query) {
    return new WithQuery(with.plus(CommonTableExpression.of(name, query.statement())));
  }

  public WithQuery with(CommonTableExpression query) {
    return new WithQuery(with.plus(query));
  }

  public WithQuery recursive() {
    return new WithQuery(with.asRecursive());
  }

  public SelectQuery select(String... items) {
    return SelectQuery.start(SelectClause.of(items)).with(with);
  }

  public SelectQuery select(SelectItem... items) {
    return SelectQuery.start(SelectClause.of(items)).with(with);
  }

  public WithClause clause() { return with; }
}
