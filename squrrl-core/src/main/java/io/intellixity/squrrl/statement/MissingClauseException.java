package io.intellixity.squrrl.statement;

import io.intellixity.squrrl.clause.ClauseKey;

/** Raised when a clause required by the statement kind is absent (e.g. the SELECT projection). */
public final class MissingClauseException extends StatementException {
  private final ClauseKey key;

  public MissingClauseException(StatementKind kind, ClauseKey key) {
    super(kind + " statement is missing its required " + key + " clause");
    this.key = key;
  }

  public ClauseKey key() { return key; }
}
