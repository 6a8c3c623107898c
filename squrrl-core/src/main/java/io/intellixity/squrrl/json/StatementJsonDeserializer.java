package io.intellixity.squrrl.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.squrrl.clause.*;
import io.intellixity.squrrl.expr.*;
import io.intellixity.squrrl.schema.ColumnRef;
import io.intellixity.squrrl.schema.TableDef;
import io.intellixity.squrrl.statement.*;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link Statement}; reads what {@link StatementJsonSerializer}
 * writes. Model validation still applies, so a structurally valid document describing a malformed
 * node fails with {@link MalformedExpressionException}.
 */
public final class StatementJsonDeserializer extends JsonDeserializer<Statement> {
  @Override
  public Statement deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    return parseStatement(root);
  }

  static Statement parseStatement(JsonNode n) {
    if (!n.isObject()) throw new IllegalArgumentException("Statement JSON must be an object");
    String type = textOrNull(n.get("type"));
    if (type == null) throw new IllegalArgumentException("Statement JSON requires a type");

    StatementKind kind = parseEnum(StatementKind.class, type, "statement type");
    switch (kind) {
      case SELECT:
        return parseSelect(n);
      case INSERT:
        return new InsertStatement(textOrNull(n.get("table")), parseWith(n.get(ClauseKey.WITH.name())));
      case UPDATE:
        return new UpdateStatement(textOrNull(n.get("table")),
            parseWith(n.get(ClauseKey.WITH.name())), parseWhere(n.get(ClauseKey.WHERE.name())));
      case DELETE:
        return new DeleteStatement(textOrNull(n.get("table")),
            parseWith(n.get(ClauseKey.WITH.name())), parseWhere(n.get(ClauseKey.WHERE.name())));
      default:
        throw new IllegalArgumentException("Unsupported statement type: " + type);
    }
  }

  private static SelectStatement parseSelect(JsonNode n) {
    SelectStatement s = SelectStatement.empty();
    Iterator<String> it = n.fieldNames();
    while (it.hasNext()) {
      String field = it.next();
      if (field.equals("type")) continue;
      ClauseKey key = parseEnum(ClauseKey.class, field, "clause key");
      s = s.set(parseClause(key, n.get(field)));
    }
    return s;
  }

  private static Clause parseClause(ClauseKey key, JsonNode n) {
    switch (key) {
      case WITH:
        return parseWith(n);
      case SELECT:
        return parseSelectClause(n);
      case FROM:
        return new FromClause(parseTables(n.get("tables")), parseJoins(n.get("joins")));
      case WHERE:
        return parseWhere(n);
      case GROUP_BY: {
        SetQuantifier q = optionalEnum(SetQuantifier.class, n.get("quantifier"), "GROUP BY quantifier");
        return new GroupByClause(q, parseExpressions(n.get("elements")));
      }
      case HAVING:
        return new HavingClause(parseBoolean(n));
      case WINDOW: {
        List<NamedWindow> out = new ArrayList<>();
        for (JsonNode w : array(n, "WINDOW")) {
          out.add(new NamedWindow(textOrNull(w.get("name")), parseWindowSpec(w.get("spec"))));
        }
        return new WindowClause(out);
      }
      case SET_OPERATIONS: {
        List<SetOperation> out = new ArrayList<>();
        for (JsonNode op : array(n, "SET_OPERATIONS")) {
          out.add(new SetOperation(
              parseEnum(SetOperator.class, textOrNull(op.get("operator")), "set operator"),
              optionalEnum(SetQuantifier.class, op.get("quantifier"), "set quantifier"),
              parseNestedSelect(op.get("select"))));
        }
        return new SetOperationsClause(out);
      }
      case ORDER_BY:
        return new OrderByClause(parseOrderItems(n));
      case LIMIT:
        if (n.isTextual() && n.asText().equalsIgnoreCase("ALL")) return LimitClause.ALL;
        return LimitClause.of(parseValue(n));
      case OFFSET:
        return new OffsetClause(parseValue(n));
      case FETCH: {
        boolean next = n.has("next");
        JsonNode count = next ? n.get("next") : n.get("first");
        ValueExpression c = (count == null || count.isNull()) ? null : parseValue(count);
        return new FetchClause(next ? FetchClause.Position.NEXT : FetchClause.Position.FIRST, c,
            boolOrDefault(n.get("with_ties"), false));
      }
      default:
        throw new IllegalArgumentException("Unsupported clause key: " + key);
    }
  }

  private static WithClause parseWith(JsonNode n) {
    if (n == null || n.isNull()) return null;
    List<CommonTableExpression> out = new ArrayList<>();
    for (JsonNode q : array(n.get("queries"), "WITH queries")) {
      out.add(new CommonTableExpression(textOrNull(q.get("name")), strings(q.get("columns")), parseExpression(q.get("body"))));
    }
    return new WithClause(boolOrDefault(n.get("recursive"), false), out);
  }

  private static WhereClause parseWhere(JsonNode n) {
    if (n == null || n.isNull()) return null;
    return new WhereClause(parseBoolean(n));
  }

  private static SelectClause parseSelectClause(JsonNode n) {
    if (n.isTextual()) return SelectClause.of(n.asText());
    SetQuantifier q = optionalEnum(SetQuantifier.class, n.get("quantifier"), "SELECT quantifier");
    List<SelectItem> items = new ArrayList<>();
    for (JsonNode x : array(n.get("items"), "SELECT items")) items.add(parseItem(x));
    return new SelectClause(q, parseExpressions(n.get("distinct_on")), items);
  }

  private static SelectItem parseItem(JsonNode n) {
    if (n.isObject() && n.has("agg")) {
      return new WindowItem(parseExpression(n.get("agg")), parseWindowSpec(n.get("over")), textOrNull(n.get("as")));
    }
    if (n.isObject() && n.has("expr") && n.has("as")) {
      return new AliasedItem(parseExpression(n.get("expr")), textOrNull(n.get("as")));
    }
    return new ExpressionItem(parseExpression(n));
  }

  private static List<TableExpression> parseTables(JsonNode arr) {
    List<TableExpression> out = new ArrayList<>();
    for (JsonNode t : array(arr, "FROM tables")) out.add(parseTable(t));
    return out;
  }

  private static TableExpression parseTable(JsonNode n) {
    if (n == null || n.isNull()) throw new IllegalArgumentException("Table expression must not be null");
    if (n.isTextual()) return Literal.of(n.asText());
    if (n.has("source")) {
      JsonNode source = n.get("source");
      String alias = textOrNull(n.get("as"));
      if (source.isObject() && source.has("type")) return new AliasedSelect(parseNestedSelect(source), alias);
      return new AliasedTable(parseTable(source), alias);
    }
    if (n.has("base")) return new JoinedTable(parseTable(n.get("base")), parseJoins(n.get("joins")));
    if (n.has("table_def")) {
      Map<String, String> columns = new LinkedHashMap<>();
      JsonNode cols = n.get("columns");
      if (cols != null && cols.isObject()) {
        Iterator<Map.Entry<String, JsonNode>> it = cols.fields();
        while (it.hasNext()) {
          Map.Entry<String, JsonNode> e = it.next();
          columns.put(e.getKey(), e.getValue().asText());
        }
      }
      return new TableDef(textOrNull(n.get("schema")), textOrNull(n.get("table_def")), columns);
    }
    throw new IllegalArgumentException("Unsupported table expression: " + n);
  }

  private static List<Join> parseJoins(JsonNode arr) {
    if (arr == null || arr.isNull()) return List.of();
    List<Join> out = new ArrayList<>();
    for (JsonNode j : array(arr, "joins")) {
      JsonNode on = j.get("on");
      out.add(new Join(
          parseEnum(JoinType.class, textOrNull(j.get("type")), "join type"),
          parseTable(j.get("table")),
          (on == null || on.isNull()) ? null : parseBoolean(on),
          strings(j.get("using"))));
    }
    return out;
  }

  private static WindowSpec parseWindowSpec(JsonNode n) {
    if (n == null || n.isNull()) return WindowSpec.EMPTY;
    if (n.isTextual()) return WindowSpec.named(n.asText());
    JsonNode order = n.get("order_by");
    return new WindowSpec(
        textOrNull(n.get("existing")),
        parseExpressions(n.get("partition_by")),
        (order == null || order.isNull()) ? List.of() : parseOrderItems(order),
        parseFrame(n.get("frame_clause")));
  }

  private static FrameClause parseFrame(JsonNode n) {
    if (n == null || n.isNull()) return null;
    JsonNode end = n.get("end");
    return new FrameClause(
        parseEnum(FrameMode.class, textOrNull(n.get("mode")), "frame mode"),
        parseBound(n.get("start")),
        (end == null || end.isNull()) ? null : parseBound(end),
        optionalEnum(FrameExclusion.class, n.get("exclusion"), "frame exclusion"));
  }

  private static FrameBound parseBound(JsonNode n) {
    if (n == null || !n.isObject()) throw new IllegalArgumentException("Frame bound must be an object");
    JsonNode offset = n.get("offset");
    return new FrameBound(
        parseEnum(FrameBound.Kind.class, textOrNull(n.get("kind")), "frame bound kind"),
        (offset == null || offset.isNull()) ? null : parseValue(offset));
  }

  private static List<OrderByItem> parseOrderItems(JsonNode arr) {
    List<OrderByItem> out = new ArrayList<>();
    for (JsonNode x : array(arr, "ORDER BY items")) {
      if (x.isTextual()) {
        out.add(OrderByItem.of(x.asText()));
        continue;
      }
      out.add(new OrderByItem(
          parseExpression(x.get("expr")),
          optionalEnum(SortDirection.class, x.get("dir"), "sort direction"),
          textOrNull(x.get("using")),
          optionalEnum(NullOrdering.class, x.get("nulls"), "null ordering")));
    }
    return out;
  }

  private static SelectStatement parseNestedSelect(JsonNode n) {
    Statement s = parseStatement(n);
    if (!(s instanceof SelectStatement sel)) {
      throw new IllegalArgumentException("Nested statement must be a SELECT, got " + s.kind());
    }
    return sel;
  }

  private static List<Expression> parseExpressions(JsonNode arr) {
    if (arr == null || arr.isNull()) return List.of();
    List<Expression> out = new ArrayList<>();
    for (JsonNode x : array(arr, "expressions")) out.add(parseExpression(x));
    return out;
  }

  private static BooleanExpression parseBoolean(JsonNode n) {
    Expression e = parseExpression(n);
    if (!(e instanceof BooleanExpression b)) {
      throw new IllegalArgumentException("Expected a boolean expression: " + n);
    }
    return b;
  }

  private static ValueExpression parseValue(JsonNode n) {
    Expression e = parseExpression(n);
    if (!(e instanceof ValueExpression v)) {
      throw new IllegalArgumentException("Expected a literal or parameter: " + n);
    }
    return v;
  }

  private static Expression parseExpression(JsonNode n) {
    if (n == null || n.isNull()) return null;
    if (n.isValueNode()) return Literal.of(n.asText());
    if (!n.isObject()) throw new IllegalArgumentException("Unsupported expression: " + n);

    if (n.has("param")) {
      String name = textOrNull(n.get("param"));
      String placeholder = textOrNull(n.get("placeholder"));
      return new Param(name, placeholder);
    }

    if (n.has("le")) {
      Condition.Link prev = null;
      JsonNode p = n.get("prev");
      if (p != null && !p.isNull()) {
        Expression pc = parseExpression(p.get("condition"));
        if (!(pc instanceof Condition c)) throw new IllegalArgumentException("prev must hold a condition: " + p);
        prev = new Condition.Link(parseEnum(Connector.class, textOrNull(p.get("connector")), "connector"), c);
      }
      return new Condition(parseExpression(n.get("le")), textOrNull(n.get("op")), parseExpression(n.get("ri")),
          boolOrDefault(n.get("neg"), false), prev);
    }

    if (n.has("logic")) {
      List<BooleanExpression> operands = new ArrayList<>();
      for (JsonNode x : array(n.get("operands"), "logic operands")) operands.add(parseBoolean(x));
      return new LogicalGroup(parseEnum(Connector.class, textOrNull(n.get("logic")), "connector"), operands);
    }

    if (n.has("not")) {
      return new NotElement(parseBoolean(n.get("not")));
    }

    if (n.has("whens")) {
      List<CaseExpression.When> whens = new ArrayList<>();
      for (JsonNode w : array(n.get("whens"), "CASE whens")) {
        if (!w.isArray() || w.size() != 2) throw new IllegalArgumentException("WHEN must be a [condition, result] pair: " + w);
        whens.add(new CaseExpression.When(parseExpression(w.get(0)), parseExpression(w.get(1))));
      }
      return new CaseExpression(parseExpression(n.get("case")), whens, parseExpression(n.get("else")));
    }

    if (n.has("column")) {
      return new ColumnRef(textOrNull(n.get("column")), textOrNull(n.get("table")));
    }

    if (n.has("type")) {
      return parseNestedSelect(n);
    }

    throw new IllegalArgumentException("Unsupported expression: " + n);
  }

  private static Iterable<JsonNode> array(JsonNode n, String what) {
    if (n == null || !n.isArray()) throw new IllegalArgumentException(what + " must be an array");
    return n;
  }

  private static List<String> strings(JsonNode arr) {
    if (arr == null || arr.isNull()) return List.of();
    List<String> out = new ArrayList<>();
    for (JsonNode x : array(arr, "string list")) out.add(x.asText());
    return out;
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String what) {
    if (value == null) throw new IllegalArgumentException("Missing " + what);
    try {
      return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown " + what + ": " + value, e);
    }
  }

  private static <E extends Enum<E>> E optionalEnum(Class<E> type, JsonNode n, String what) {
    String v = textOrNull(n);
    return v == null ? null : parseEnum(type, v, what);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    return (n == null || n.isNull()) ? def : n.asBoolean(def);
  }
}
