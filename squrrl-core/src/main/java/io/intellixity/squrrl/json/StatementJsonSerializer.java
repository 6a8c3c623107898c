package io.intellixity.squrrl.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.squrrl.clause.*;
import io.intellixity.squrrl.expr.*;
import io.intellixity.squrrl.schema.ColumnRef;
import io.intellixity.squrrl.schema.TableDef;
import io.intellixity.squrrl.statement.*;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Canonical JSON serializer for {@link Statement}.
 * <p>
 * A SELECT statement is an object keyed by clause name ({@code "type": "SELECT", "FROM": ..}).
 * Literal text is a plain string; every other node is an object whose keys identify its type.
 */
public final class StatementJsonSerializer extends JsonSerializer<Statement> {
  @Override
  public void serialize(Statement s, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (s == null) {
      g.writeNull();
      return;
    }
    writeStatement(s, g);
  }

  private static void writeStatement(Statement s, JsonGenerator g) throws IOException {
    g.writeStartObject();
    g.writeStringField("type", s.kind().name());

    if (s instanceof SelectStatement sel) {
      for (ClauseKey key : sel.clauses()) {
        g.writeFieldName(key.name());
        writeClause(sel.clause(key), g);
      }
    } else if (s instanceof InsertStatement ins) {
      g.writeStringField("table", ins.table());
      if (ins.with() != null) {
        g.writeFieldName(ClauseKey.WITH.name());
        writeClause(ins.with(), g);
      }
    } else if (s instanceof UpdateStatement upd) {
      g.writeStringField("table", upd.table());
      writeOptionalClause(ClauseKey.WITH, upd.with(), g);
      writeOptionalClause(ClauseKey.WHERE, upd.where(), g);
    } else if (s instanceof DeleteStatement del) {
      g.writeStringField("table", del.table());
      writeOptionalClause(ClauseKey.WITH, del.with(), g);
      writeOptionalClause(ClauseKey.WHERE, del.where(), g);
    } else {
      throw new IllegalArgumentException("Unsupported statement type: " + s.getClass().getName());
    }

    g.writeEndObject();
  }

  private static void writeOptionalClause(ClauseKey key, Clause c, JsonGenerator g) throws IOException {
    if (c == null) return;
    g.writeFieldName(key.name());
    writeClause(c, g);
  }

  private static void writeClause(Clause c, JsonGenerator g) throws IOException {
    if (c instanceof WithClause w) {
      g.writeStartObject();
      if (w.recursive()) g.writeBooleanField("recursive", true);
      g.writeArrayFieldStart("queries");
      for (CommonTableExpression q : w.queries()) {
        g.writeStartObject();
        g.writeStringField("name", q.name());
        writeStrings("columns", q.columns(), g);
        g.writeFieldName("body");
        writeExpression(q.body(), g);
        g.writeEndObject();
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (c instanceof SelectClause sc) {
      g.writeStartObject();
      g.writeStringField("quantifier", sc.quantifier().name());
      if (!sc.distinctOn().isEmpty()) {
        g.writeArrayFieldStart("distinct_on");
        for (Expression e : sc.distinctOn()) writeExpression(e, g);
        g.writeEndArray();
      }
      g.writeArrayFieldStart("items");
      for (SelectItem item : sc.items()) writeItem(item, g);
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (c instanceof FromClause f) {
      g.writeStartObject();
      g.writeArrayFieldStart("tables");
      for (TableExpression t : f.tables()) writeTable(t, g);
      g.writeEndArray();
      writeJoins(f.joins(), g);
      g.writeEndObject();
      return;
    }

    if (c instanceof WhereClause w) {
      writeExpression(w.condition(), g);
      return;
    }

    if (c instanceof HavingClause h) {
      writeExpression(h.condition(), g);
      return;
    }

    if (c instanceof GroupByClause gb) {
      g.writeStartObject();
      if (gb.quantifier() != null) g.writeStringField("quantifier", gb.quantifier().name());
      g.writeArrayFieldStart("elements");
      for (Expression e : gb.elements()) writeExpression(e, g);
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (c instanceof WindowClause wc) {
      g.writeStartArray();
      for (NamedWindow w : wc.windows()) {
        g.writeStartObject();
        g.writeStringField("name", w.name());
        g.writeFieldName("spec");
        writeWindowSpec(w.spec(), g);
        g.writeEndObject();
      }
      g.writeEndArray();
      return;
    }

    if (c instanceof SetOperationsClause so) {
      g.writeStartArray();
      for (SetOperation op : so.operations()) {
        g.writeStartObject();
        g.writeStringField("operator", op.operator().name());
        if (op.quantifier() != null) g.writeStringField("quantifier", op.quantifier().name());
        g.writeFieldName("select");
        writeStatement(op.select(), g);
        g.writeEndObject();
      }
      g.writeEndArray();
      return;
    }

    if (c instanceof OrderByClause ob) {
      writeOrderItems(ob.items(), g);
      return;
    }

    if (c instanceof LimitClause l) {
      if (l.all()) g.writeString("ALL");
      else writeExpression(l.count(), g);
      return;
    }

    if (c instanceof OffsetClause o) {
      writeExpression(o.count(), g);
      return;
    }

    if (c instanceof FetchClause f) {
      g.writeStartObject();
      g.writeFieldName(f.position() == FetchClause.Position.NEXT ? "next" : "first");
      if (f.count() == null) g.writeNull();
      else writeExpression(f.count(), g);
      if (f.withTies()) g.writeBooleanField("with_ties", true);
      g.writeEndObject();
      return;
    }

    throw new IllegalArgumentException("Unsupported clause type: " + c.getClass().getName());
  }

  private static void writeItem(SelectItem item, JsonGenerator g) throws IOException {
    if (item instanceof ExpressionItem e) {
      writeExpression(e.expression(), g);
    } else if (item instanceof AliasedItem a) {
      g.writeStartObject();
      g.writeFieldName("expr");
      writeExpression(a.expression(), g);
      g.writeStringField("as", a.alias());
      g.writeEndObject();
    } else if (item instanceof WindowItem w) {
      g.writeStartObject();
      g.writeFieldName("agg");
      writeExpression(w.aggregate(), g);
      g.writeFieldName("over");
      writeWindowSpec(w.over(), g);
      g.writeStringField("as", w.alias());
      g.writeEndObject();
    } else {
      throw new IllegalArgumentException("Unsupported select item: " + item.getClass().getName());
    }
  }

  private static void writeTable(TableExpression t, JsonGenerator g) throws IOException {
    if (t instanceof Literal l) {
      g.writeString(l.text());
    } else if (t instanceof AliasedTable a) {
      g.writeStartObject();
      g.writeFieldName("source");
      writeTable(a.table(), g);
      g.writeStringField("as", a.alias());
      g.writeEndObject();
    } else if (t instanceof AliasedSelect a) {
      g.writeStartObject();
      g.writeFieldName("source");
      writeStatement(a.select(), g);
      g.writeStringField("as", a.alias());
      g.writeEndObject();
    } else if (t instanceof JoinedTable j) {
      g.writeStartObject();
      g.writeFieldName("base");
      writeTable(j.base(), g);
      writeJoins(j.joins(), g);
      g.writeEndObject();
    } else if (t instanceof TableDef td) {
      g.writeStartObject();
      g.writeStringField("table_def", td.name());
      if (td.schema() != null) g.writeStringField("schema", td.schema());
      g.writeObjectFieldStart("columns");
      for (Map.Entry<String, String> e : td.columns().entrySet()) g.writeStringField(e.getKey(), e.getValue());
      g.writeEndObject();
      g.writeEndObject();
    } else {
      throw new IllegalArgumentException("Unsupported table expression: " + t.getClass().getName());
    }
  }

  private static void writeJoins(List<Join> joins, JsonGenerator g) throws IOException {
    if (joins.isEmpty()) return;
    g.writeArrayFieldStart("joins");
    for (Join j : joins) {
      g.writeStartObject();
      g.writeStringField("type", j.type().name());
      g.writeFieldName("table");
      writeTable(j.table(), g);
      if (j.on() != null) {
        g.writeFieldName("on");
        writeExpression(j.on(), g);
      }
      writeStrings("using", j.using(), g);
      g.writeEndObject();
    }
    g.writeEndArray();
  }

  private static void writeWindowSpec(WindowSpec spec, JsonGenerator g) throws IOException {
    g.writeStartObject();
    if (spec.existingWindow() != null) g.writeStringField("existing", spec.existingWindow());
    if (!spec.partitionBy().isEmpty()) {
      g.writeArrayFieldStart("partition_by");
      for (Expression e : spec.partitionBy()) writeExpression(e, g);
      g.writeEndArray();
    }
    if (!spec.orderBy().isEmpty()) {
      g.writeFieldName("order_by");
      writeOrderItems(spec.orderBy(), g);
    }
    FrameClause frame = spec.frame();
    if (frame != null) {
      g.writeObjectFieldStart("frame_clause");
      g.writeStringField("mode", frame.mode().name());
      g.writeFieldName("start");
      writeBound(frame.start(), g);
      if (frame.end() != null) {
        g.writeFieldName("end");
        writeBound(frame.end(), g);
      }
      if (frame.exclusion() != null) g.writeStringField("exclusion", frame.exclusion().name());
      g.writeEndObject();
    }
    g.writeEndObject();
  }

  private static void writeBound(FrameBound b, JsonGenerator g) throws IOException {
    g.writeStartObject();
    g.writeStringField("kind", b.kind().name());
    if (b.offset() != null) {
      g.writeFieldName("offset");
      writeExpression(b.offset(), g);
    }
    g.writeEndObject();
  }

  private static void writeOrderItems(List<OrderByItem> items, JsonGenerator g) throws IOException {
    g.writeStartArray();
    for (OrderByItem it : items) {
      g.writeStartObject();
      g.writeFieldName("expr");
      writeExpression(it.expression(), g);
      if (it.direction() != null) g.writeStringField("dir", it.direction().name());
      if (it.usingOperator() != null) g.writeStringField("using", it.usingOperator());
      if (it.nulls() != null) g.writeStringField("nulls", it.nulls().name());
      g.writeEndObject();
    }
    g.writeEndArray();
  }

  private static void writeExpression(Expression e, JsonGenerator g) throws IOException {
    if (e == null) {
      g.writeNull();
      return;
    }

    if (e instanceof Literal l) {
      g.writeString(l.text());
      return;
    }

    if (e instanceof Param p) {
      g.writeStartObject();
      if (p.name() == null) g.writeNullField("param");
      else g.writeStringField("param", p.name());
      if (p.placeholder() != null) g.writeStringField("placeholder", p.placeholder());
      g.writeEndObject();
      return;
    }

    if (e instanceof Condition c) {
      g.writeStartObject();
      g.writeFieldName("le");
      writeExpression(c.left(), g);
      g.writeStringField("op", c.operator());
      g.writeFieldName("ri");
      writeExpression(c.right(), g);
      if (c.negated()) g.writeBooleanField("neg", true);
      if (c.previous() != null) {
        g.writeObjectFieldStart("prev");
        g.writeStringField("connector", c.previous().connector().name());
        g.writeFieldName("condition");
        writeExpression(c.previous().condition(), g);
        g.writeEndObject();
      }
      g.writeEndObject();
      return;
    }

    if (e instanceof LogicalGroup lg) {
      g.writeStartObject();
      g.writeStringField("logic", lg.connector().name());
      g.writeArrayFieldStart("operands");
      for (BooleanExpression child : lg.elements()) writeExpression(child, g);
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (e instanceof NotElement n) {
      g.writeStartObject();
      g.writeFieldName("not");
      writeExpression(n.element(), g);
      g.writeEndObject();
      return;
    }

    if (e instanceof CaseExpression ce) {
      g.writeStartObject();
      g.writeFieldName("case");
      writeExpression(ce.operand(), g);
      g.writeArrayFieldStart("whens");
      for (CaseExpression.When w : ce.whens()) {
        g.writeStartArray();
        writeExpression(w.condition(), g);
        writeExpression(w.result(), g);
        g.writeEndArray();
      }
      g.writeEndArray();
      if (ce.otherwise() != null) {
        g.writeFieldName("else");
        writeExpression(ce.otherwise(), g);
      }
      g.writeEndObject();
      return;
    }

    if (e instanceof ColumnRef col) {
      g.writeStartObject();
      g.writeStringField("column", col.name());
      if (col.tablePath() != null) g.writeStringField("table", col.tablePath());
      g.writeEndObject();
      return;
    }

    if (e instanceof SelectStatement s) {
      writeStatement(s, g);
      return;
    }

    throw new IllegalArgumentException("Unsupported expression type: " + e.getClass().getName());
  }

  private static void writeStrings(String field, List<String> values, JsonGenerator g) throws IOException {
    if (values.isEmpty()) return;
    g.writeArrayFieldStart(field);
    for (String v : values) g.writeString(v);
    g.writeEndArray();
  }
}
