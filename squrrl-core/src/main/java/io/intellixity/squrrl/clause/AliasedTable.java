package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.statement.MalformedExpressionException;

/** {@code table AS alias}. */
public record AliasedTable(TableExpression table, String alias) implements TableExpression {
  public AliasedTable {
    MalformedExpressionException.require(table, "Aliased table requires a table");
    MalformedExpressionException.requireText(alias, "Aliased table requires an alias");
  }
}
