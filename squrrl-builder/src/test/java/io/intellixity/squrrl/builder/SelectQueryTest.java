package io.intellixity.squrrl.builder;

import io.intellixity.squrrl.clause.*;
import io.intellixity.squrrl.expr.Condition;
import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.expr.Param;
import io.intellixity.squrrl.render.RenderOptions;
import io.intellixity.squrrl.render.RenderedStatement;
import io.intellixity.squrrl.render.SqlRenderer;
import io.intellixity.squrrl.statement.MissingClauseException;
import io.intellixity.squrrl.statement.SelectStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.squrrl.expr.Predicates.*;
import static org.junit.jupiter.api.Assertions.*;

final class SelectQueryTest {
  @Test
  void selectFrom() {
    assertEquals("SELECT * FROM employees", SqlQuery.select("*").from("employees").sql());
  }

  @Test
  void fluentChainRendersInCanonicalOrder() {
    SelectQuery q = SqlQuery.select("dept", "count(*)")
        .limit(10)
        .orderBy(OrderByItem.desc("count(*)"))
        .having(Condition.of("count(*)", ">", "5"))
        .groupBy("dept")
        .where(eq("active", lit("true")))
        .from("employees");

    assertEquals("SELECT dept, count(*) FROM employees WHERE active = true GROUP BY dept"
        + " HAVING count(*) > 5 ORDER BY count(*) DESC LIMIT 10", q.sql());
  }

  @Test
  void prefixIsReusable() {
    SelectQuery base = SqlQuery.select("*").from("employees");
    SelectQuery active = base.where("active");
    SelectQuery limited = base.limit(5);

    assertEquals("SELECT * FROM employees", base.sql());
    assertEquals("SELECT * FROM employees WHERE active", active.sql());
    assertEquals("SELECT * FROM employees LIMIT 5", limited.sql());
    assertFalse(base.statement().has(ClauseKey.WHERE));
  }

  @Test
  void laterCallsReplaceEarlierClauses() {
    SelectQuery q = SqlQuery.select("*").from("a").from("b").limit(1).limit(2);
    assertEquals("SELECT * FROM b LIMIT 2", q.sql());
  }

  @Test
  void joinsAppendToFrom() {
    SelectQuery q = SqlQuery.select("*").from("employees e")
        .innerJoin("departments d", Condition.of("d.id", "=", "e.dept_id"))
        .leftJoin("badges b", Condition.of("b.emp_id", "=", "e.id"));
    assertEquals("SELECT * FROM employees e INNER JOIN departments d ON d.id = e.dept_id"
        + " LEFT JOIN badges b ON b.emp_id = e.id", q.sql());
  }

  @Test
  void joinWithoutFromIsRejected() {
    assertThrows(MissingClauseException.class, () ->
        SqlQuery.select("*").innerJoin("d", Condition.of("a", "=", "b")));
  }

  @Test
  void setOperationsAndWindowsAppend() {
    SelectQuery q = SqlQuery.select("a").from("t1")
        .union(SqlQuery.select("a").from("t2"))
        .exceptAll(SqlQuery.select("a").from("t3"))
        .intersect(SqlQuery.select("a").from("t4"));
    assertEquals("SELECT a FROM t1 UNION SELECT a FROM t2 EXCEPT ALL SELECT a FROM t3"
        + " INTERSECT SELECT a FROM t4", q.sql());

    SelectQuery w = SqlQuery.select("*").from("t")
        .window("w1", WindowSpec.partitionBy("a"))
        .window("w2", WindowSpec.named("w1").orderedBy(OrderByItem.of("b")));
    assertEquals("SELECT * FROM t WINDOW w1 AS (PARTITION BY a), w2 AS (w1 ORDER BY b)", w.sql());
  }

  @Test
  void withPrefix() {
    SelectQuery q = SqlQuery.withRecursive("tree", SqlQuery.select("id").from("nodes"))
        .with("leaves", SqlQuery.select("id").from("tree"))
        .select("*")
        .from("leaves");
    assertEquals("WITH RECURSIVE tree AS ( SELECT id FROM nodes ), leaves AS ( SELECT id FROM tree )"
        + " SELECT * FROM leaves", q.sql());
    assertEquals("""
        WITH RECURSIVE
          tree AS (
            SELECT
              id
            FROM
              nodes
          ),
          leaves AS (
            SELECT
              id
            FROM
              tree
          )
        SELECT
          *
        FROM
          leaves""", q.sql(2));
  }

  @Test
  void pagingVariants() {
    assertEquals("SELECT * FROM t LIMIT ALL OFFSET 20", SqlQuery.select("*").from("t").limitAll().offset(20).sql());
    assertEquals("SELECT * FROM t OFFSET 20 FETCH NEXT 10 ROWS ONLY",
        SqlQuery.select("*").from("t").offset(20).fetchNext(10).sql());
    assertEquals("SELECT * FROM t FETCH FIRST :n ROWS WITH TIES",
        SqlQuery.select("*").from("t").fetchFirst(Param.named("n"), true).sql());
  }

  @Test
  void distinctSelect() {
    assertEquals("SELECT DISTINCT dept FROM t", SqlQuery.selectDistinct("dept").from("t").sql());
    assertEquals("SELECT DISTINCT ON (dept) dept, name FROM t",
        SqlQuery.selectDistinctOn(List.of(Literal.of("dept")), ExpressionItem.of("dept"), ExpressionItem.of("name"))
            .from("t").sql());
  }

  @Test
  void renderCollectsParams() {
    RenderedStatement out = SqlQuery.select("*").from("t")
        .where(eq("id", param("id")).and(eq("tenant", param())))
        .renderedBy(new SqlRenderer(new RenderOptions("?")))
        .render();
    assertEquals("SELECT * FROM t WHERE id = :id AND tenant = ?", out.sql());
    assertEquals(List.of(Param.named("id"), Param.positional()), out.params());
  }

  @Test
  void withoutDropsAClause() {
    SelectQuery q = SqlQuery.select("*").from("t").orderBy("a", "b");
    assertEquals("SELECT * FROM t ORDER BY a, b", q.sql());
    assertEquals("SELECT * FROM t", q.without(ClauseKey.ORDER_BY).sql());
  }

  @Test
  void continuesFromAnExistingStatement() {
    SelectStatement s = SelectStatement.of(SelectClause.star(), FromClause.of("t"));
    assertEquals("SELECT * FROM t WHERE x", SelectQuery.of(s).where("x").sql());
    assertSame(s, SelectQuery.of(s).statement());
  }
}
