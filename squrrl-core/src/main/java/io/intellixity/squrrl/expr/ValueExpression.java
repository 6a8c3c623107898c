package io.intellixity.squrrl.expr;

/** Scalar values allowed in LIMIT, OFFSET, FETCH and frame offsets: a literal or a parameter. */
public interface ValueExpression extends Expression {
}
