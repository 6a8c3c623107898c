package io.intellixity.squrrl.expr;

/** Expressions allowed in WHERE, HAVING and join ON positions. */
public interface BooleanExpression extends Expression {
}
