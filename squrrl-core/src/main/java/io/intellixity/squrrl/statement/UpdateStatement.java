package io.intellixity.squrrl.statement;

import io.intellixity.squrrl.clause.WhereClause;
import io.intellixity.squrrl.clause.WithClause;

public record UpdateStatement(String table, WithClause with, WhereClause where) implements Statement {
  public UpdateStatement {
    MalformedExpressionException.requireText(table, "UPDATE requires a target table");
  }

  @Override
  public StatementKind kind() { return StatementKind.UPDATE; }
}
