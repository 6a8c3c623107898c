package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.List;

/** A table with its own joins, used as one entry of a FROM list. */
public record JoinedTable(TableExpression base, List<Join> joins) implements TableExpression {
  public JoinedTable {
    MalformedExpressionException.require(base, "Join graph requires a base table");
    joins = MalformedExpressionException.requireNonEmpty(joins, "Join graph requires at least one join");
  }
}
