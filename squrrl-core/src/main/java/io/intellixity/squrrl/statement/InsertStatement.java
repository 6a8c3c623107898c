package io.intellixity.squrrl.statement;

import io.intellixity.squrrl.clause.WithClause;

public record InsertStatement(String table, WithClause with) implements Statement {
  public InsertStatement {
    MalformedExpressionException.requireText(table, "INSERT requires a target table");
  }

  @Override
  public StatementKind kind() { return StatementKind.INSERT; }
}
