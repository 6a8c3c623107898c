package io.intellixity.squrrl.expr;

import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.Objects;

/**
 * A binary condition {@code left operator right}, optionally negated.
 * <p>
 * Conditions chain left to right: {@code a.and(b).or(c)} returns {@code c} linked to {@code b},
 * which is linked to {@code a}. The links are fixed at construction, so a chain is always a finite,
 * acyclic list that renders as {@code a AND b OR c}.
 */
public record Condition(Expression left, String operator, Expression right, boolean negated, Link previous)
    implements BooleanExpression {

  /** Connection from a condition to the one before it in a chain. */
  public record Link(Connector connector, Condition condition) {
    public Link {
      MalformedExpressionException.require(connector, "Condition link requires a connector");
      MalformedExpressionException.require(condition, "Condition link requires a condition");
    }
  }

  public Condition {
    MalformedExpressionException.require(left, "Condition requires a left operand");
    MalformedExpressionException.requireText(operator, "Condition requires an operator");
    MalformedExpressionException.require(right, "Condition requires a right operand");
  }

  public static Condition of(Expression left, String operator, Expression right) {
    return new Condition(left, operator, right, false, null);
  }

  public static Condition of(Expression left, Operator operator, Expression right) {
    Objects.requireNonNull(operator, "operator");
    return of(left, operator.symbol(), right);
  }

  /** Literal operands, e.g. {@code Condition.of("1", "=", "1")}. */
  public static Condition of(String left, String operator, String right) {
    return of(Literal.of(left), operator, Literal.of(right));
  }

  public static Condition not(Expression left, String operator, Expression right) {
    return new Condition(left, operator, right, true, null);
  }

  public Condition and(Condition next) { return link(Connector.AND, next); }

  public Condition or(Condition next) { return link(Connector.OR, next); }

  public Condition negate() {
    return new Condition(left, operator, right, !negated, previous);
  }

  public boolean chained() { return previous != null; }

  /** Number of conditions in the chain ending at this one. */
  public int chainLength() {
    int n = 1;
    for (Link l = previous; l != null; l = l.condition().previous()) n++;
    return n;
  }

  private Condition link(Connector connector, Condition next) {
    MalformedExpressionException.require(next, "Cannot chain a missing condition");
    if (next.previous != null) {
      throw new MalformedExpressionException(
          "Condition is already part of a chain; wrap it in a LogicalGroup before chaining it with " + connector);
    }
    return new Condition(next.left, next.operator, next.right, next.negated, new Link(connector, this));
  }
}
