package io.intellixity.squrrl.clause;

/** Anything that can appear after FROM or JOIN. */
public interface TableExpression {
}
