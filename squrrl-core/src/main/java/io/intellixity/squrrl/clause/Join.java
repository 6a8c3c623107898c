package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.BooleanExpression;
import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.List;

/**
 * One join of a FROM clause. INNER/LEFT/RIGHT/FULL joins take exactly one of {@code on} or
 * {@code using}; NATURAL and CROSS joins take neither.
 */
public record Join(JoinType type, TableExpression table, BooleanExpression on, List<String> using) {
  public Join {
    MalformedExpressionException.require(type, "Join requires a type");
    MalformedExpressionException.require(table, type + " requires a table");
    using = MalformedExpressionException.copyOrEmpty(using, "USING columns");
    boolean hasCondition = on != null || !using.isEmpty();
    if (type.unconditional() && hasCondition) {
      throw new MalformedExpressionException(type.keyword() + " does not take an ON or USING condition");
    }
    if (!type.unconditional()) {
      if (!hasCondition) throw new MalformedExpressionException(type.keyword() + " requires an ON or USING condition");
      if (on != null && !using.isEmpty()) throw new MalformedExpressionException(type.keyword() + " takes ON or USING, not both");
    }
  }

  public static Join on(JoinType type, TableExpression table, BooleanExpression on) {
    return new Join(type, table, on, List.of());
  }

  public static Join using(JoinType type, TableExpression table, String... columns) {
    return new Join(type, table, null, List.of(columns));
  }

  public static Join inner(String table, BooleanExpression on) { return on(JoinType.INNER, Literal.of(table), on); }

  public static Join left(String table, BooleanExpression on) { return on(JoinType.LEFT, Literal.of(table), on); }

  public static Join natural(JoinType type, TableExpression table) { return new Join(type, table, null, List.of()); }

  public static Join cross(TableExpression table) { return new Join(JoinType.CROSS, table, null, List.of()); }
}
