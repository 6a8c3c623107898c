package io.intellixity.squrrl.expr;

public enum Connector {
  AND,
  OR
}
