package io.intellixity.squrrl.statement;

import io.intellixity.squrrl.clause.*;
import io.intellixity.squrrl.expr.Expression;

import java.util.*;

/**
 * An immutable SELECT statement: a mapping from {@link ClauseKey} to {@link Clause}.
 * <p>
 * Present keys are the clauses that render; an absent key is omitted, never rendered empty.
 * {@link #set(Clause)} and {@link #without(ClauseKey)} return new statements and leave the
 * receiver untouched, so a statement can be shared as the prefix of several derived ones.
 * A SELECT statement is also an {@link Expression} and can be nested as a sub-select.
 */
public final class SelectStatement implements Statement, Expression {
  private static final SelectStatement EMPTY = new SelectStatement(new EnumMap<>(ClauseKey.class));

  private final Map<ClauseKey, Clause> clauses;

  private SelectStatement(EnumMap<ClauseKey, Clause> clauses) {
    this.clauses = Collections.unmodifiableMap(clauses);
  }

  public static SelectStatement empty() { return EMPTY; }

  /** {@code SELECT *}. */
  public static SelectStatement star() { return EMPTY.set(SelectClause.star()); }

  public static SelectStatement of(Clause... clauses) {
    SelectStatement s = EMPTY;
    for (Clause c : clauses) s = s.set(c);
    return s;
  }

  @Override
  public StatementKind kind() { return StatementKind.SELECT; }

  /** Copy with {@code clause} stored under its key, replacing any previous value. */
  public SelectStatement set(Clause clause) {
    MalformedExpressionException.require(clause, "Cannot set a missing clause");
    EnumMap<ClauseKey, Clause> copy = copyClauses();
    copy.put(MalformedExpressionException.require(clause.key(), "Clause has no key"), clause);
    return new SelectStatement(copy);
  }

  public SelectStatement without(ClauseKey key) {
    if (!clauses.containsKey(key)) return this;
    EnumMap<ClauseKey, Clause> copy = copyClauses();
    copy.remove(key);
    return new SelectStatement(copy);
  }

  public boolean has(ClauseKey key) { return clauses.containsKey(key); }

  public Clause clause(ClauseKey key) { return clauses.get(key); }

  /** Present keys in canonical order. */
  public Set<ClauseKey> clauses() { return clauses.keySet(); }

  @Override
  public WithClause with() { return (WithClause) clauses.get(ClauseKey.WITH); }
  public SelectClause select() { return (SelectClause) clauses.get(ClauseKey.SELECT); }
  public FromClause from() { return (FromClause) clauses.get(ClauseKey.FROM); }
  public WhereClause where() { return (WhereClause) clauses.get(ClauseKey.WHERE); }
  public GroupByClause groupBy() { return (GroupByClause) clauses.get(ClauseKey.GROUP_BY); }
  public HavingClause having() { return (HavingClause) clauses.get(ClauseKey.HAVING); }
  public WindowClause window() { return (WindowClause) clauses.get(ClauseKey.WINDOW); }
  public SetOperationsClause setOperations() { return (SetOperationsClause) clauses.get(ClauseKey.SET_OPERATIONS); }
  public OrderByClause orderBy() { return (OrderByClause) clauses.get(ClauseKey.ORDER_BY); }
  public LimitClause limit() { return (LimitClause) clauses.get(ClauseKey.LIMIT); }
  public OffsetClause offset() { return (OffsetClause) clauses.get(ClauseKey.OFFSET); }
  public FetchClause fetch() { return (FetchClause) clauses.get(ClauseKey.FETCH); }

  private EnumMap<ClauseKey, Clause> copyClauses() {
    EnumMap<ClauseKey, Clause> copy = new EnumMap<>(ClauseKey.class);
    copy.putAll(clauses);
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof SelectStatement other && clauses.equals(other.clauses);
  }

  @Override
  public int hashCode() { return clauses.hashCode(); }

  @Override
  public String toString() { return "SelectStatement" + clauses; }
}
