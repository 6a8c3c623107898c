package io.intellixity.squrrl.clause;

/** One clause of a SELECT statement, stored under its {@link #key()}. */
public interface Clause {
  ClauseKey key();
}
