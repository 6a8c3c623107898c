package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.Expression;
import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.statement.MalformedExpressionException;

/**
 * {@code expression [ASC | DESC | USING op] [NULLS FIRST | LAST]}.
 * <p>
 * A null direction leaves the database default; {@code usingOperator} replaces the direction.
 */
public record OrderByItem(Expression expression, SortDirection direction, String usingOperator, NullOrdering nulls) {
  public OrderByItem {
    MalformedExpressionException.require(expression, "ORDER BY item requires an expression");
    if (usingOperator != null) {
      if (usingOperator.isBlank()) throw new MalformedExpressionException("ORDER BY USING requires an operator");
      if (direction != null) throw new MalformedExpressionException("ORDER BY item takes a direction or USING, not both");
    }
  }

  public static OrderByItem of(String column) { return new OrderByItem(Literal.of(column), null, null, null); }

  public static OrderByItem asc(String column) { return new OrderByItem(Literal.of(column), SortDirection.ASC, null, null); }

  public static OrderByItem desc(String column) { return new OrderByItem(Literal.of(column), SortDirection.DESC, null, null); }

  public static OrderByItem using(String column, String operator) {
    return new OrderByItem(Literal.of(column), null, operator, null);
  }

  public OrderByItem nulls(NullOrdering nulls) {
    return new OrderByItem(expression, direction, usingOperator, nulls);
  }

  public OrderByItem nullsFirst() { return nulls(NullOrdering.FIRST); }

  public OrderByItem nullsLast() { return nulls(NullOrdering.LAST); }
}
