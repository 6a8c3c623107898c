package io.intellixity.squrrl.render;

import io.intellixity.squrrl.clause.*;
import io.intellixity.squrrl.expr.*;
import io.intellixity.squrrl.schema.SchemaDef;
import io.intellixity.squrrl.schema.TableDef;
import io.intellixity.squrrl.statement.SelectStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ClauseRenderingTest {
  private static final SqlRenderer R = new SqlRenderer();

  private static final SelectStatement SUB = SelectStatement.of(SelectClause.of("id"), FromClause.of("t"));

  private static SelectStatement star(Clause... clauses) {
    return SelectStatement.of(clauses).set(SelectClause.star());
  }

  @Test
  void distinctProjections() {
    assertEquals("SELECT DISTINCT a", R.render(SelectStatement.of(SelectClause.distinct(ExpressionItem.of("a")))));
    assertEquals("SELECT DISTINCT ON (a) a, b", R.render(SelectStatement.of(
        SelectClause.distinctOn(List.of(Literal.of("a")), ExpressionItem.of("a"), ExpressionItem.of("b")))));
  }

  @Test
  void joinsFollowTables() {
    FromClause from = FromClause.of(new AliasedTable(Literal.of("employees"), "e"),
        Join.inner("departments d", Condition.of("d.id", "=", "e.dept_id")),
        Join.using(JoinType.LEFT, Literal.of("badges b"), "id", "site"),
        Join.cross(Literal.of("regions")),
        Join.natural(JoinType.NATURAL_FULL, Literal.of("x")));

    assertEquals("SELECT * FROM employees AS e"
            + " INNER JOIN departments d ON d.id = e.dept_id"
            + " LEFT JOIN badges b USING (id, site)"
            + " CROSS JOIN regions"
            + " NATURAL FULL JOIN x",
        R.render(star(from)));
  }

  @Test
  void joinsInMultiLineMode() {
    FromClause from = FromClause.of(Literal.of("a"), Join.left("b", Condition.of("b.id", "=", "a.id")));
    assertEquals("""
        SELECT
          *
        FROM
          a
          LEFT JOIN b ON b.id = a.id""", R.render(star(from), 2));
  }

  @Test
  void severalTablesAreCommaSeparated() {
    FromClause from = new FromClause(List.of(Literal.of("a"), Literal.of("b")), List.of());
    assertEquals("SELECT * FROM a, b", R.render(star(from)));
    assertEquals("SELECT\n  *\nFROM\n  a,\n  b", R.render(star(from), 2));
  }

  @Test
  void joinedTableNestsItsJoins() {
    JoinedTable jt = new JoinedTable(Literal.of("a"), List.of(Join.inner("b", Condition.of("b.id", "=", "a.id"))));
    assertEquals("SELECT * FROM a INNER JOIN b ON b.id = a.id, c",
        R.render(star(new FromClause(List.of(jt, Literal.of("c")), List.of()))));
  }

  @Test
  void aliasedSubSelectInFrom() {
    SelectStatement s = star(FromClause.of(new AliasedSelect(SUB, "s")));
    assertEquals("SELECT * FROM ( SELECT id FROM t ) AS s", R.render(s));
    assertEquals("""
        SELECT
          *
        FROM
          (
            SELECT
              id
            FROM
              t
          ) AS s""", R.render(s, 2));
  }

  @Test
  void withEntriesKeepDeclarationOrder() {
    WithClause with = WithClause.of(
        CommonTableExpression.of("a", Literal.of("SELECT 1")),
        new CommonTableExpression("b", List.of("x", "y"), SUB));
    SelectStatement s = SelectStatement.of(with, SelectClause.star(), FromClause.of("b"));

    assertEquals("WITH a AS (SELECT 1), b (x, y) AS ( SELECT id FROM t ) SELECT * FROM b", R.render(s));
    assertEquals("""
        WITH
          a AS (SELECT 1),
          b (x, y) AS (
            SELECT
              id
            FROM
              t
          )
        SELECT
          *
        FROM
          b""", R.render(s, 2));
  }

  @Test
  void groupByAndHaving() {
    SelectStatement s = SelectStatement.of(
        SelectClause.of("dept", "count(*)"), FromClause.of("t"),
        new GroupByClause(SetQuantifier.ALL, List.of(Literal.of("dept"))),
        new HavingClause(Condition.of("count(*)", ">", "1")));
    assertEquals("SELECT dept, count(*) FROM t GROUP BY ALL dept HAVING count(*) > 1", R.render(s));
  }

  @Test
  void windowItemsAndDefinitions() {
    SelectClause select = SelectClause.of(
        ExpressionItem.of("name"),
        WindowItem.of("rank()", WindowSpec.named("w"), "r"),
        WindowItem.of("sum(x)", WindowSpec.partitionBy("dept").orderedBy(OrderByItem.desc("x")), "s"),
        WindowItem.of("count(*)", null, "n"),
        WindowItem.of("max(x)", new WindowSpec("w", List.of(), List.of(OrderByItem.of("x")), null), "m"));
    WindowClause window = WindowClause.of(new NamedWindow("w", WindowSpec.partitionBy("dept", "site")
        .orderedBy(OrderByItem.asc("salary"))
        .framed(FrameClause.between(FrameMode.ROWS, FrameBound.preceding(Literal.of(2)), FrameBound.CURRENT_ROW)
            .excluding(FrameExclusion.TIES))));

    assertEquals("SELECT name, rank() OVER w AS r, sum(x) OVER (PARTITION BY dept ORDER BY x DESC) AS s,"
            + " count(*) OVER () AS n, max(x) OVER (w ORDER BY x) AS m FROM t"
            + " WINDOW w AS (PARTITION BY dept, site ORDER BY salary ASC ROWS BETWEEN 2 PRECEDING AND CURRENT ROW EXCLUDE TIES)",
        R.render(SelectStatement.of(select, FromClause.of("t"), window)));
  }

  @Test
  void frameWithoutEndOmitsBetween() {
    WindowClause window = WindowClause.of(new NamedWindow("w",
        WindowSpec.EMPTY.framed(FrameClause.of(FrameMode.RANGE, FrameBound.UNBOUNDED_PRECEDING))));
    assertEquals("SELECT * WINDOW w AS (RANGE UNBOUNDED PRECEDING)", R.render(star(window)));
  }

  @Test
  void frameOffsetsCanBeParams() {
    WindowClause window = WindowClause.of(new NamedWindow("w", WindowSpec.EMPTY.framed(
        FrameClause.between(FrameMode.GROUPS, FrameBound.preceding(Param.named("lo")), FrameBound.following(Param.named("hi"))))));
    RenderedStatement out = R.renderStatement(star(window), null);
    assertEquals("SELECT * WINDOW w AS (GROUPS BETWEEN :lo PRECEDING AND :hi FOLLOWING)", out.sql());
    assertEquals(2, out.params().size());
  }

  @Test
  void setOperationsRenderEachOperatorAndQuantifier() {
    SelectStatement b2 = SelectStatement.of(SelectClause.of("a"), FromClause.of("t2"));
    SelectStatement b3 = SelectStatement.of(SelectClause.of("a"), FromClause.of("t3"),
        OrderByClause.of(OrderByItem.of("a")), LimitClause.of(1));
    SelectStatement s = SelectStatement.of(SelectClause.of("a"), FromClause.of("t1"),
        SetOperationsClause.of(
            SetOperation.of(SetOperator.UNION, b2),
            SetOperation.all(SetOperator.INTERSECT, b2),
            new SetOperation(SetOperator.EXCEPT, SetQuantifier.DISTINCT, b3)));

    assertEquals("SELECT a FROM t1"
            + " UNION SELECT a FROM t2"
            + " INTERSECT ALL SELECT a FROM t2"
            + " EXCEPT DISTINCT ( SELECT a FROM t3 ORDER BY a LIMIT 1 )",
        R.render(s));
  }

  @Test
  void setOperationBranchIsIndented() {
    SelectStatement s = SelectStatement.of(SelectClause.of("a"), FromClause.of("t1"),
        SetOperationsClause.of(SetOperation.all(SetOperator.UNION, SelectStatement.of(SelectClause.of("a"), FromClause.of("t2")))),
        OrderByClause.of(OrderByItem.of("a")));
    assertEquals("""
        SELECT
          a
        FROM
          t1
        UNION ALL
          SELECT
            a
          FROM
            t2
        ORDER BY
          a""", R.render(s, 2));
  }

  @Test
  void orderByTokens() {
    SelectStatement s = star(FromClause.of("t"), OrderByClause.of(
        OrderByItem.using("name", "<").nullsFirst(), OrderByItem.of("x"), OrderByItem.asc("y").nullsLast()));
    assertEquals("SELECT * FROM t ORDER BY name USING < NULLS FIRST, x, y ASC NULLS LAST", R.render(s));
  }

  @Test
  void paging() {
    assertEquals("SELECT * FROM t LIMIT ALL OFFSET 5", R.render(star(FromClause.of("t"), LimitClause.ALL, OffsetClause.of(5))));
    assertEquals("SELECT * FROM t OFFSET 5 FETCH FIRST 3 ROWS ONLY",
        R.render(star(FromClause.of("t"), OffsetClause.of(5), FetchClause.first(Literal.of(3)))));
    assertEquals("SELECT * FROM t FETCH NEXT ROWS WITH TIES",
        R.render(star(FromClause.of("t"), FetchClause.next(null).includingTies())));
  }

  @Test
  void searchedCase() {
    CaseExpression size = CaseExpression.searched(
        List.of(CaseExpression.when(Condition.of("x", ">", "1"), Literal.of("'big'"))), Literal.of("'small'"));
    SelectStatement s = SelectStatement.of(SelectClause.of(new AliasedItem(size, "size")), FromClause.of("t"));

    assertEquals("SELECT CASE WHEN x > 1 THEN 'big' ELSE 'small' END AS size FROM t", R.render(s));
    assertEquals("""
        SELECT
          CASE
            WHEN x > 1 THEN 'big'
            ELSE 'small'
          END AS size
        FROM
          t""", R.render(s, 2));
  }

  @Test
  void simpleCase() {
    CaseExpression grade = new CaseExpression(Literal.of("grade"),
        List.of(CaseExpression.when(Literal.of("'A'"), Literal.of("4")), CaseExpression.when(Literal.of("'B'"), Literal.of("3"))), null);
    assertEquals("SELECT CASE grade WHEN 'A' THEN 4 WHEN 'B' THEN 3 END",
        R.render(SelectStatement.of(SelectClause.of(new ExpressionItem(grade)))));
  }

  @Test
  void schemaColumnsRenderQualified() {
    SchemaDef company = SchemaDef.builder("company")
        .table("employees", TableDef.builder("employees").column("id").column("name").build())
        .build();
    TableDef employees = company.table("employees");

    SelectStatement s = SelectStatement.of(
        SelectClause.of(employees.column("id").as("eid"), new ExpressionItem(employees.column("name"))),
        FromClause.of(employees),
        new WhereClause(Predicates.eq(employees.column("id"), Param.named("id"))));

    assertEquals("SELECT company.employees.id AS eid, company.employees.name"
        + " FROM company.employees WHERE company.employees.id = :id", R.render(s));
  }
}
