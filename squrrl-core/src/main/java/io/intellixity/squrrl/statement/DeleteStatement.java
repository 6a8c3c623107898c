package io.intellixity.squrrl.statement;

import io.intellixity.squrrl.clause.WhereClause;
import io.intellixity.squrrl.clause.WithClause;

public record DeleteStatement(String table, WithClause with, WhereClause where) implements Statement {
  public DeleteStatement {
    MalformedExpressionException.requireText(table, "DELETE requires a target table");
  }

  @Override
  public StatementKind kind() { return StatementKind.DELETE; }
}
