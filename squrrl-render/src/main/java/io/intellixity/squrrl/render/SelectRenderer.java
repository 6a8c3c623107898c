package io.intellixity.squrrl.render;

import io.intellixity.squrrl.clause.*;
import io.intellixity.squrrl.expr.Expression;
import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.schema.TableDef;
import io.intellixity.squrrl.statement.MalformedExpressionException;
import io.intellixity.squrrl.statement.MissingClauseException;
import io.intellixity.squrrl.statement.SelectStatement;
import io.intellixity.squrrl.statement.StatementKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a SELECT statement in {@link ClauseKey} order. Each clause emits its keyword line followed
 * by its body indented one step.
 */
final class SelectRenderer {
  /** A set-operation branch carrying any of these renders in parentheses. */
  private static final Set<ClauseKey> PARENTHESIZED_BRANCH = EnumSet.of(
      ClauseKey.WITH, ClauseKey.SET_OPERATIONS, ClauseKey.ORDER_BY,
      ClauseKey.LIMIT, ClauseKey.OFFSET, ClauseKey.FETCH);

  private final ExpressionRenderer expressions = new ExpressionRenderer(this);

  List<String> lines(SelectStatement s, RenderContext ctx) {
    if (!s.has(ClauseKey.SELECT)) throw new MissingClauseException(StatementKind.SELECT, ClauseKey.SELECT);

    List<String> out = new ArrayList<>();
    for (ClauseKey key : ClauseKey.values()) {
      Clause c = s.clause(key);
      if (c == null) continue;
      out.addAll(switch (key) {
        case WITH -> with((WithClause) c, ctx);
        case SELECT -> select((SelectClause) c, ctx);
        case FROM -> from((FromClause) c, ctx);
        case WHERE -> block("WHERE", expressions.predicate(((WhereClause) c).condition(), ctx), ctx);
        case GROUP_BY -> groupBy((GroupByClause) c, ctx);
        case HAVING -> block("HAVING", expressions.predicate(((HavingClause) c).condition(), ctx), ctx);
        case WINDOW -> window((WindowClause) c, ctx);
        case SET_OPERATIONS -> setOperations((SetOperationsClause) c, ctx);
        case ORDER_BY -> orderBy((OrderByClause) c, ctx);
        case LIMIT -> limit((LimitClause) c, ctx);
        case OFFSET -> Lines.prefixFirst("OFFSET ", expressions.value(((OffsetClause) c).count(), ctx));
        case FETCH -> fetch((FetchClause) c, ctx);
      });
    }
    return out;
  }

  private static List<String> block(String keyword, List<String> body, RenderContext ctx) {
    List<String> out = Lines.one(keyword);
    out.addAll(Lines.indent(body, ctx.step()));
    return out;
  }

  private List<String> with(WithClause w, RenderContext ctx) {
    List<List<String>> entries = new ArrayList<>();
    for (CommonTableExpression q : w.queries()) {
      String head = q.columns().isEmpty() ? q.name() : q.name() + " (" + String.join(", ", q.columns()) + ")";
      if (q.body() instanceof Literal l) {
        entries.add(Lines.one(head + " AS (" + l.text() + ")"));
        continue;
      }
      List<String> entry = Lines.one(head + " AS (");
      entry.addAll(Lines.indent(lines((SelectStatement) q.body(), ctx), ctx.step()));
      entry.add(")");
      entries.add(entry);
    }
    return block(w.recursive() ? "WITH RECURSIVE" : "WITH", Lines.commaSeparated(entries), ctx);
  }

  private List<String> select(SelectClause sc, RenderContext ctx) {
    StringBuilder head = new StringBuilder("SELECT");
    if (sc.quantifier() == SetQuantifier.DISTINCT) {
      head.append(" DISTINCT");
      if (!sc.distinctOn().isEmpty()) {
        List<String> on = new ArrayList<>();
        for (Expression e : sc.distinctOn()) on.add(expressions.flatValue(e, ctx));
        head.append(" ON (").append(String.join(", ", on)).append(')');
      }
    }
    List<List<String>> items = new ArrayList<>();
    for (SelectItem item : sc.items()) items.add(item(item, ctx));
    return block(head.toString(), Lines.commaSeparated(items), ctx);
  }

  private List<String> item(SelectItem item, RenderContext ctx) {
    if (item instanceof ExpressionItem e) return expressions.value(e.expression(), ctx);
    if (item instanceof AliasedItem a) return Lines.appendLast(expressions.value(a.expression(), ctx), " AS " + a.alias());
    if (item instanceof WindowItem w) {
      List<String> agg = expressions.value(w.aggregate(), ctx);
      return Lines.appendLast(agg, " " + expressions.over(w.over(), ctx) + " AS " + w.alias());
    }
    throw new MalformedExpressionException("Unsupported select item: " + item.getClass().getName());
  }

  private List<String> from(FromClause f, RenderContext ctx) {
    List<List<String>> tables = new ArrayList<>();
    for (TableExpression t : f.tables()) tables.add(table(t, ctx));
    List<String> body = Lines.commaSeparated(tables);
    for (Join j : f.joins()) body.addAll(join(j, ctx));
    return block("FROM", body, ctx);
  }

  private List<String> table(TableExpression t, RenderContext ctx) {
    if (t instanceof Literal l) return Lines.one(l.text());
    if (t instanceof TableDef td) return Lines.one(td.path());
    if (t instanceof AliasedTable a) return Lines.appendLast(table(a.table(), ctx), " AS " + a.alias());
    if (t instanceof AliasedSelect a) {
      return Lines.appendLast(Lines.paren(lines(a.select(), ctx), ctx), " AS " + a.alias());
    }
    if (t instanceof JoinedTable jt) {
      List<String> out = new ArrayList<>(table(jt.base(), ctx));
      for (Join j : jt.joins()) out.addAll(join(j, ctx));
      return out;
    }
    throw new MalformedExpressionException("Unsupported table expression: " + t.getClass().getName());
  }

  private List<String> join(Join j, RenderContext ctx) {
    List<String> head = Lines.prefixFirst(j.type().keyword() + " ", table(j.table(), ctx));
    if (j.on() != null) return Lines.infix(head, "ON", expressions.predicate(j.on(), ctx));
    if (!j.using().isEmpty()) return Lines.appendLast(head, " USING (" + String.join(", ", j.using()) + ")");
    return head;
  }

  private List<String> groupBy(GroupByClause gb, RenderContext ctx) {
    String head = gb.quantifier() == null ? "GROUP BY" : "GROUP BY " + gb.quantifier().name();
    List<List<String>> elements = new ArrayList<>();
    for (Expression e : gb.elements()) elements.add(expressions.value(e, ctx));
    return block(head, Lines.commaSeparated(elements), ctx);
  }

  private List<String> window(WindowClause wc, RenderContext ctx) {
    List<List<String>> defs = new ArrayList<>();
    for (NamedWindow w : wc.windows()) {
      defs.add(Lines.one(w.name() + " AS (" + expressions.windowSpec(w.spec(), ctx) + ")"));
    }
    return block("WINDOW", Lines.commaSeparated(defs), ctx);
  }

  private List<String> setOperations(SetOperationsClause so, RenderContext ctx) {
    List<String> out = new ArrayList<>();
    for (SetOperation op : so.operations()) {
      String head = op.quantifier() == null ? op.operator().name() : op.operator().name() + " " + op.quantifier().name();
      List<String> branch = lines(op.select(), ctx);
      if (needsParens(op.select())) branch = Lines.paren(branch, ctx);
      out.addAll(block(head, branch, ctx));
    }
    return out;
  }

  private static boolean needsParens(SelectStatement branch) {
    for (ClauseKey k : branch.clauses()) {
      if (PARENTHESIZED_BRANCH.contains(k)) return true;
    }
    return false;
  }

  private List<String> orderBy(OrderByClause ob, RenderContext ctx) {
    List<List<String>> items = new ArrayList<>();
    for (OrderByItem it : ob.items()) items.add(expressions.orderItem(it, ctx));
    return block("ORDER BY", Lines.commaSeparated(items), ctx);
  }

  private List<String> limit(LimitClause l, RenderContext ctx) {
    if (l.all()) return Lines.one("LIMIT ALL");
    return Lines.prefixFirst("LIMIT ", expressions.value(l.count(), ctx));
  }

  private List<String> fetch(FetchClause f, RenderContext ctx) {
    StringBuilder sb = new StringBuilder("FETCH ").append(f.position().name());
    if (f.count() != null) sb.append(' ').append(expressions.flatValue(f.count(), ctx));
    sb.append(f.withTies() ? " ROWS WITH TIES" : " ROWS ONLY");
    return Lines.one(sb.toString());
  }
}
