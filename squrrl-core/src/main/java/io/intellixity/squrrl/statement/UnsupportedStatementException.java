package io.intellixity.squrrl.statement;

/** Raised when a renderer is handed a statement kind it does not implement. */
public final class UnsupportedStatementException extends StatementException {
  private final StatementKind kind;

  public UnsupportedStatementException(StatementKind kind) {
    super("Rendering is not supported for " + kind + " statements");
    this.kind = kind;
  }

  public StatementKind kind() { return kind; }
}
