package io.intellixity.squrrl.statement;

public enum StatementKind {
  SELECT,
  INSERT,
  UPDATE,
  DELETE
}
