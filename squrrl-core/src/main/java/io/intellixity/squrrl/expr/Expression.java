package io.intellixity.squrrl.expr;

/**
 * Any operand of a statement: literal text, a parameter, a column, a condition, a CASE or a nested
 * SELECT statement.
 */
public interface Expression {
}
