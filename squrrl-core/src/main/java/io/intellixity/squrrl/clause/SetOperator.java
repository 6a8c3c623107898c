package io.intellixity.squrrl.clause;

public enum SetOperator {
  UNION,
  INTERSECT,
  EXCEPT
}
