package io.intellixity.squrrl.builder;

import io.intellixity.squrrl.clause.*;
import io.intellixity.squrrl.expr.BooleanExpression;
import io.intellixity.squrrl.expr.Expression;
import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.expr.ValueExpression;
import io.intellixity.squrrl.render.RenderedStatement;
import io.intellixity.squrrl.render.SqlRenderer;
import io.intellixity.squrrl.render.StatementRenderer;
import io.intellixity.squrrl.statement.MissingClauseException;
import io.intellixity.squrrl.statement.SelectStatement;
import io.intellixity.squrrl.statement.StatementKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable SELECT under construction. Every call returns a new query over a new statement, so a
 * query can serve as the shared prefix of several others.
 * <p>
 * Windows and set operations append; every other clause replaces the previous value.
 */
public final class SelectQuery {
  private static final StatementRenderer DEFAULT_RENDERER = new SqlRenderer();

  private final SelectStatement statement;
  private final StatementRenderer renderer;

  private SelectQuery(SelectStatement statement, StatementRenderer renderer) {
    this.statement = statement;
    this.renderer = renderer;
  }

  static SelectQuery start(SelectClause select) {
    return new SelectQuery(SelectStatement.empty().set(select), DEFAULT_RENDERER);
  }

  /** Continues from an existing statement. */
  public static SelectQuery of(SelectStatement statement) {
    return new SelectQuery(Objects.requireNonNull(statement, "statement"), DEFAULT_RENDERER);
  }

  public SelectQuery renderedBy(StatementRenderer renderer) {
    return new SelectQuery(statement, Objects.requireNonNull(renderer, "renderer"));
  }

  public SelectQuery with(WithClause with) { return set(with); }

  public SelectQuery from(String table) { return set(FromClause.of(table)); }

  public SelectQuery from(TableExpression... tables) {
    return set(new FromClause(List.of(tables), List.of()));
  }

  public SelectQuery join(Join join) {
    FromClause from = statement.from();
    if (from == null) throw new MissingClauseException(StatementKind.SELECT, ClauseKey.FROM);
    return set(from.plus(join));
  }

  public SelectQuery join(JoinType type, String table, BooleanExpression on) {
    return join(Join.on(type, Literal.of(table), on));
  }

  public SelectQuery innerJoin(String table, BooleanExpression on) { return join(Join.inner(table, on)); }

  public SelectQuery leftJoin(String table, BooleanExpression on) { return join(Join.left(table, on)); }

  public SelectQuery where(BooleanExpression condition) { return set(new WhereClause(condition)); }

  /** Literal predicate text, e.g. {@code where("1 = 1")}. */
  public SelectQuery where(String condition) { return where(Literal.of(condition)); }

  public SelectQuery groupBy(String... columns) { return set(GroupByClause.of(columns)); }

  public SelectQuery groupBy(SetQuantifier quantifier, Expression... elements) {
    return set(new GroupByClause(quantifier, List.of(elements)));
  }

  public SelectQuery having(BooleanExpression condition) { return set(new HavingClause(condition)); }

  public SelectQuery window(String name, WindowSpec spec) {
    NamedWindow w = new NamedWindow(name, spec);
    WindowClause existing = statement.window();
    return set(existing == null ? WindowClause.of(w) : existing.plus(List.of(w)));
  }

  public SelectQuery union(SelectQuery other) { return setOp(SetOperation.of(SetOperator.UNION, other.statement)); }

  public SelectQuery unionAll(SelectQuery other) { return setOp(SetOperation.all(SetOperator.UNION, other.statement)); }

  public SelectQuery intersect(SelectQuery other) { return setOp(SetOperation.of(SetOperator.INTERSECT, other.statement)); }

  public SelectQuery intersectAll(SelectQuery other) { return setOp(SetOperation.all(SetOperator.INTERSECT, other.statement)); }

  public SelectQuery except(SelectQuery other) { return setOp(SetOperation.of(SetOperator.EXCEPT, other.statement)); }

  public SelectQuery exceptAll(SelectQuery other) { return setOp(SetOperation.all(SetOperator.EXCEPT, other.statement)); }

  public SelectQuery orderBy(OrderByItem... items) { return set(OrderByClause.of(items)); }

  public SelectQuery orderBy(String... columns) {
    List<OrderByItem> items = new ArrayList<>();
    for (String c : columns) items.add(OrderByItem.of(c));
    return set(new OrderByClause(items));
  }

  public SelectQuery limit(long count) { return set(LimitClause.of(count)); }

  public SelectQuery limit(ValueExpression count) { return set(LimitClause.of(count)); }

  public SelectQuery limitAll() { return set(LimitClause.ALL); }

  public SelectQuery offset(long count) { return set(OffsetClause.of(count)); }

  public SelectQuery offset(ValueExpression count) { return set(new OffsetClause(count)); }

  public SelectQuery fetchFirst(long count) { return set(FetchClause.first(Literal.of(count))); }

  public SelectQuery fetchFirst(ValueExpression count, boolean withTies) {
    return set(new FetchClause(FetchClause.Position.FIRST, count, withTies));
  }

  public SelectQuery fetchNext(long count) { return set(FetchClause.next(Literal.of(count))); }

  public SelectQuery fetchNext(ValueExpression count, boolean withTies) {
    return set(new FetchClause(FetchClause.Position.NEXT, count, withTies));
  }

  /** Drops a clause, e.g. to reuse a query without its ORDER BY. */
  public SelectQuery without(ClauseKey key) {
    return new SelectQuery(statement.without(key), renderer);
  }

  public SelectStatement statement() { return statement; }

  public String sql() { return renderer.render(statement); }

  public String sql(int indent) { return renderer.render(statement, indent); }

  public RenderedStatement render() { return renderer.renderStatement(statement, null); }

  public RenderedStatement render(int indent) { return renderer.renderStatement(statement, indent); }

  private SelectQuery setOp(SetOperation op) {
    SetOperationsClause existing = statement.setOperations();
    return set(existing == null ? SetOperationsClause.of(op) : existing.plus(op));
  }

  private SelectQuery set(Clause clause) {
    return new SelectQuery(statement.set(clause), renderer);
  }

  @Override
  public String toString() { return sql(); }
}
