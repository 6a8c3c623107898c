package io.intellixity.squrrl.statement;

/**
 * Base for structural failures of a statement tree.
 * <p>
 * Raised while constructing model values or while rendering them. A failing render produces no output.
 */
public class StatementException extends RuntimeException {
  public StatementException(String message) {
    super(message);
  }

  public StatementException(String message, Throwable cause) {
    super(message, cause);
  }
}
