package io.intellixity.squrrl.expr;

import io.intellixity.squrrl.clause.TableExpression;
import io.intellixity.squrrl.statement.MalformedExpressionException;

/** SQL text rendered verbatim. */
public record Literal(String text) implements BooleanExpression, ValueExpression, TableExpression {
  public static final Literal STAR = new Literal("*");

  public Literal {
    MalformedExpressionException.requireText(text, "Literal requires non-blank text");
  }

  public static Literal of(String text) { return new Literal(text); }

  public static Literal of(long number) { return new Literal(Long.toString(number)); }
}
