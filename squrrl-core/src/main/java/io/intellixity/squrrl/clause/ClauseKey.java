package io.intellixity.squrrl.clause;

/** SELECT clause keys in canonical render order; rendering follows {@link #values()}. */
public enum ClauseKey {
  WITH,
  SELECT,
  FROM,
  WHERE,
  GROUP_BY,
  HAVING,
  WINDOW,
  SET_OPERATIONS,
  ORDER_BY,
  LIMIT,
  OFFSET,
  FETCH
}
