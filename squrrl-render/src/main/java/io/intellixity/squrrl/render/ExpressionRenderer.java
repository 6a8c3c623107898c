package io.intellixity.squrrl.render;

import io.intellixity.squrrl.clause.FrameBound;
import io.intellixity.squrrl.clause.FrameClause;
import io.intellixity.squrrl.clause.OrderByItem;
import io.intellixity.squrrl.clause.WindowSpec;
import io.intellixity.squrrl.expr.*;
import io.intellixity.squrrl.schema.ColumnRef;
import io.intellixity.squrrl.statement.MalformedExpressionException;
import io.intellixity.squrrl.statement.SelectStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders operands and boolean expressions.
 * <p>
 * Condition chains render flat at the top of WHERE, HAVING and ON. Anything boolean used as an
 * operand of another condition is parenthesized.
 */
final class ExpressionRenderer {
  private final SelectRenderer selects;

  ExpressionRenderer(SelectRenderer selects) {
    this.selects = selects;
  }

  List<String> predicate(BooleanExpression e, RenderContext ctx) {
    if (e instanceof Literal l) return Lines.one(l.text());
    if (e instanceof Condition c) return chain(c, ctx);
    if (e instanceof LogicalGroup g) return group(g, ctx);
    if (e instanceof NotElement n) return not(n, ctx);
    throw new MalformedExpressionException("Unsupported boolean expression: " + describe(e));
  }

  List<String> value(Expression e, RenderContext ctx) {
    if (e instanceof Literal l) return Lines.one(l.text());
    if (e instanceof ColumnRef c) return Lines.one(c.path());
    if (e instanceof Param p) return Lines.one(ctx.placeholder(p));
    if (e instanceof CaseExpression ce) return caseLines(ce, ctx);
    if (e instanceof SelectStatement s) return Lines.paren(selects.lines(s, ctx), ctx);
    if (e instanceof BooleanExpression b) return Lines.paren(predicate(b, ctx), ctx);
    throw new MalformedExpressionException("Unsupported expression: " + describe(e));
  }

  String flatValue(Expression e, RenderContext ctx) {
    return Lines.flat(value(e, ctx));
  }

  // Predecessors first, so chains read left to right with no parentheses.
  private List<String> chain(Condition c, RenderContext ctx) {
    if (c.previous() == null) return body(c, ctx);
    List<String> out = new ArrayList<>(chain(c.previous().condition(), ctx));
    out.addAll(Lines.prefixFirst(c.previous().connector().name() + " ", body(c, ctx)));
    return out;
  }

  private List<String> body(Condition c, RenderContext ctx) {
    List<String> lines = Lines.infix(value(c.left(), ctx), c.operator(), value(c.right(), ctx));
    return c.negated() ? Lines.prefixFirst("NOT ", lines) : lines;
  }

  private List<String> group(LogicalGroup g, RenderContext ctx) {
    List<String> out = new ArrayList<>();
    List<BooleanExpression> elements = g.elements();
    for (int i = 0; i < elements.size(); i++) {
      List<String> operand = operand(elements.get(i), ctx);
      out.addAll(i == 0 ? operand : Lines.prefixFirst(g.connector().name() + " ", operand));
    }
    return out;
  }

  private List<String> not(NotElement n, RenderContext ctx) {
    return Lines.prefixFirst("NOT ", operand(n.element(), ctx));
  }

  private List<String> operand(BooleanExpression e, RenderContext ctx) {
    List<String> lines = predicate(e, ctx);
    return compound(e) ? Lines.paren(lines, ctx) : lines;
  }

  /** True when the expression renders as more than one connected term. */
  private static boolean compound(BooleanExpression e) {
    if (e instanceof Condition c) return c.chained();
    if (e instanceof LogicalGroup g) return g.elements().size() > 1 || compound(g.elements().get(0));
    return false;
  }

  private List<String> caseLines(CaseExpression ce, RenderContext ctx) {
    List<String> out = new ArrayList<>(ce.operand() == null
        ? Lines.one("CASE")
        : Lines.prefixFirst("CASE ", value(ce.operand(), ctx)));
    for (CaseExpression.When w : ce.whens()) {
      List<String> cond = (ce.operand() == null && w.condition() instanceof BooleanExpression b)
          ? predicate(b, ctx)
          : value(w.condition(), ctx);
      List<String> when = Lines.prefixFirst("WHEN ", Lines.infix(cond, "THEN", value(w.result(), ctx)));
      out.addAll(Lines.indent(when, ctx.step()));
    }
    if (ce.otherwise() != null) {
      out.addAll(Lines.indent(Lines.prefixFirst("ELSE ", value(ce.otherwise(), ctx)), ctx.step()));
    }
    out.add("END");
    return out;
  }

  /** {@code expr [ASC|DESC|USING op] [NULLS FIRST|LAST]}. */
  List<String> orderItem(OrderByItem item, RenderContext ctx) {
    StringBuilder suffix = new StringBuilder();
    if (item.usingOperator() != null) suffix.append(" USING ").append(item.usingOperator());
    else if (item.direction() != null) suffix.append(' ').append(item.direction().name());
    if (item.nulls() != null) suffix.append(" NULLS ").append(item.nulls().name());
    return Lines.appendLast(value(item.expression(), ctx), suffix.toString());
  }

  /** Window body without the surrounding parentheses. */
  String windowSpec(WindowSpec spec, RenderContext ctx) {
    List<String> parts = new ArrayList<>();
    if (spec.existingWindow() != null) parts.add(spec.existingWindow());
    if (!spec.partitionBy().isEmpty()) {
      List<String> cols = new ArrayList<>();
      for (Expression e : spec.partitionBy()) cols.add(flatValue(e, ctx));
      parts.add("PARTITION BY " + String.join(", ", cols));
    }
    if (!spec.orderBy().isEmpty()) {
      List<String> items = new ArrayList<>();
      for (OrderByItem it : spec.orderBy()) items.add(Lines.flat(orderItem(it, ctx)));
      parts.add("ORDER BY " + String.join(", ", items));
    }
    if (spec.frame() != null) parts.add(frame(spec.frame(), ctx));
    return String.join(" ", parts);
  }

  /** {@code OVER name} for a bare reference, else {@code OVER (spec)}. */
  String over(WindowSpec spec, RenderContext ctx) {
    if (spec.referenceOnly()) return "OVER " + spec.existingWindow();
    return "OVER (" + windowSpec(spec, ctx) + ")";
  }

  private String frame(FrameClause f, RenderContext ctx) {
    StringBuilder sb = new StringBuilder(f.mode().name());
    if (f.end() == null) {
      sb.append(' ').append(bound(f.start(), ctx));
    } else {
      sb.append(" BETWEEN ").append(bound(f.start(), ctx)).append(" AND ").append(bound(f.end(), ctx));
    }
    if (f.exclusion() != null) sb.append(' ').append(f.exclusion().sql());
    return sb.toString();
  }

  private String bound(FrameBound b, RenderContext ctx) {
    if (b.offset() == null) return b.kind().sql();
    return flatValue(b.offset(), ctx) + " " + b.kind().sql();
  }

  private static String describe(Object o) {
    return o == null ? "null" : o.getClass().getName();
  }
}
