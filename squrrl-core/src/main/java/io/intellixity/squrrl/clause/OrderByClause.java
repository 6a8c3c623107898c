package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.List;

public record OrderByClause(List<OrderByItem> items) implements Clause {
  public OrderByClause {
    items = MalformedExpressionException.requireNonEmpty(items, "ORDER BY requires at least one item");
  }

  @Override
  public ClauseKey key() { return ClauseKey.ORDER_BY; }

  public static OrderByClause of(OrderByItem... items) { return new OrderByClause(List.of(items)); }
}
