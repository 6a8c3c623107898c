package io.intellixity.squrrl.clause;

public enum SetQuantifier {
  ALL,
  DISTINCT
}
