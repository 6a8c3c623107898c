package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.statement.MalformedExpressionException;
import io.intellixity.squrrl.statement.SelectStatement;

/** A derived table: {@code (SELECT ..) AS alias}. */
public record AliasedSelect(SelectStatement select, String alias) implements TableExpression {
  public AliasedSelect {
    MalformedExpressionException.require(select, "Derived table requires a SELECT statement");
    MalformedExpressionException.requireText(alias, "Derived table requires an alias");
  }
}
