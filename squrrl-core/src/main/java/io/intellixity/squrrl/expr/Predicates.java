package io.intellixity.squrrl.expr;

import io.intellixity.squrrl.statement.MalformedExpressionException;
import io.intellixity.squrrl.statement.SelectStatement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class Predicates {
  private Predicates() {}

  public static Literal lit(String text) { return Literal.of(text); }

  public static Param param(String name) { return Param.named(name); }

  public static Param param() { return Param.positional(); }

  public static Condition eq(String column, Expression value) { return Condition.of(lit(column), Operator.EQ, value); }
  public static Condition ne(String column, Expression value) { return Condition.of(lit(column), Operator.NE, value); }
  public static Condition gt(String column, Expression value) { return Condition.of(lit(column), Operator.GT, value); }
  public static Condition ge(String column, Expression value) { return Condition.of(lit(column), Operator.GE, value); }
  public static Condition lt(String column, Expression value) { return Condition.of(lit(column), Operator.LT, value); }
  public static Condition le(String column, Expression value) { return Condition.of(lit(column), Operator.LE, value); }

  public static Condition eq(Expression left, Expression right) { return Condition.of(left, Operator.EQ, right); }

  public static Condition like(String column, Expression pattern) { return Condition.of(lit(column), Operator.LIKE, pattern); }

  public static Condition isNull(String column) { return Condition.of(lit(column), Operator.IS, lit("NULL")); }

  public static Condition isNotNull(String column) { return Condition.of(lit(column), Operator.IS_NOT, lit("NULL")); }

  /** {@code column IN (v1, v2, ...)} over literal values. */
  public static Condition in(String column, Collection<String> values) {
    List<String> vals = new ArrayList<>(values == null ? List.of() : values);
    if (vals.isEmpty()) throw new MalformedExpressionException("IN requires at least one value for column '" + column + "'");
    return Condition.of(lit(column), Operator.IN, lit("(" + String.join(", ", vals) + ")"));
  }

  /** {@code column IN (SELECT ...)}. */
  public static Condition in(String column, SelectStatement subquery) {
    return Condition.of(lit(column), Operator.IN, subquery);
  }

  public static LogicalGroup and(BooleanExpression... elements) { return LogicalGroup.and(elements); }

  public static LogicalGroup or(BooleanExpression... elements) { return LogicalGroup.or(elements); }

  public static NotElement not(BooleanExpression element) { return new NotElement(element); }
}
