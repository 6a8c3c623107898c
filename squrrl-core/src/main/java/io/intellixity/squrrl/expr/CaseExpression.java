package io.intellixity.squrrl.expr;

import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.List;

/**
 * {@code CASE [operand] WHEN .. THEN .. [ELSE ..] END}.
 * <p>
 * With an operand the WHEN values are compared against it (simple CASE); without one each WHEN is
 * a boolean expression (searched CASE).
 */
public record CaseExpression(Expression operand, List<When> whens, Expression otherwise) implements Expression {
  public record When(Expression condition, Expression result) {
    public When {
      MalformedExpressionException.require(condition, "WHEN requires a condition");
      MalformedExpressionException.require(result, "WHEN requires a THEN result");
    }
  }

  public CaseExpression {
    whens = MalformedExpressionException.requireNonEmpty(whens, "CASE requires at least one WHEN");
  }

  public static CaseExpression searched(List<When> whens, Expression otherwise) {
    return new CaseExpression(null, whens, otherwise);
  }

  public static When when(Expression condition, Expression result) {
    return new When(condition, result);
  }
}
