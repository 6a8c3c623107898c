package io.intellixity.squrrl.render;

import io.intellixity.squrrl.clause.*;
import io.intellixity.squrrl.expr.*;
import io.intellixity.squrrl.statement.SelectStatement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.squrrl.expr.Predicates.*;
import static org.junit.jupiter.api.Assertions.*;

final class ConditionRenderingTest {
  private static final SqlRenderer R = new SqlRenderer();

  private static final Condition A = Condition.of("a", "=", "1");
  private static final Condition B = Condition.of("b", "=", "2");
  private static final Condition C = Condition.of("c", "=", "3");

  private static String where(BooleanExpression e) {
    String sql = R.render(SelectStatement.of(SelectClause.star(), FromClause.of("t"), new WhereClause(e)));
    return sql.substring("SELECT * FROM t WHERE ".length());
  }

  @Test
  void chainRendersFlatAtTopLevel() {
    assertEquals("a = 1 AND b = 2 OR c = 3", where(A.and(B).or(C)));
  }

  @Test
  void chainAsOperandIsWrappedInOneParenthesisPair() {
    Condition outer = Condition.of(Literal.of("flag"), "=", A.and(B).or(C));
    assertEquals("flag = ( a = 1 AND b = 2 OR c = 3 )", where(outer));
  }

  @Test
  void chainAsOperandInMultiLineMode() {
    Condition outer = Condition.of(Literal.of("flag"), "=", A.and(B).or(C));
    SelectStatement s = SelectStatement.of(SelectClause.star(), new WhereClause(outer));
    assertEquals("""
        SELECT
          *
        WHERE
          flag = (
            a = 1
            AND b = 2
            OR c = 3
          )""", R.render(s, 2));
  }

  @Test
  void singleConditionOperandStaysOnOneLine() {
    Condition outer = Condition.of(Literal.of("flag"), "=", A);
    SelectStatement s = SelectStatement.of(SelectClause.star(), new WhereClause(outer));
    assertEquals("flag = (a = 1)", where(outer));
    assertEquals("SELECT\n  *\nWHERE\n  flag = (a = 1)", R.render(s, 2));
  }

  @Test
  void negatedConditionPrefixesNot() {
    assertEquals("NOT a = 1", where(Condition.not(Literal.of("a"), "=", Literal.of("1"))));
    assertEquals("a = 1 AND NOT b = 2", where(A.and(B.negate())));
  }

  @Test
  void groupParenthesizesCompoundOperands() {
    LogicalGroup g = LogicalGroup.and(A, LogicalGroup.or(B, C), Condition.of("d", "=", "4").and(Condition.of("e", "=", "5")));
    assertEquals("a = 1 AND ( b = 2 OR c = 3 ) AND ( d = 4 AND e = 5 )", where(g));
  }

  @Test
  void singleElementGroupRendersItsElement() {
    assertEquals("a = 1", where(LogicalGroup.or(A)));
    assertEquals("a = 1 OR b = 2", where(LogicalGroup.or(LogicalGroup.and(A), B)));
  }

  @Test
  void notWrapsCompoundOperands() {
    assertEquals("NOT ( b = 2 OR c = 3 )", where(not(LogicalGroup.or(B, C))));
    assertEquals("NOT ( a = 1 AND b = 2 )", where(not(A.and(B))));
    assertEquals("NOT ( a = 1 AND b = 2 )", where(not(LogicalGroup.or(A.and(B)))));
    assertEquals("NOT a = 1", where(not(A)));
  }

  @Test
  void nullChecksAndLike() {
    assertEquals("deleted_at IS NULL AND name LIKE 'a%'",
        where(isNull("deleted_at").and(like("name", lit("'a%'")))));
    assertEquals("manager_id IS NOT NULL", where(isNotNull("manager_id")));
  }

  @Test
  void inOverLiteralsAndSubSelect() {
    SelectStatement sub = SelectStatement.of(SelectClause.of("id"), FromClause.of("managers"));
    assertEquals("id IN (1, 2, 3)", where(in("id", List.of("1", "2", "3"))));
    assertEquals("id IN ( SELECT id FROM managers )", where(in("id", sub)));
  }

  @Test
  void subSelectOperandInMultiLineMode() {
    SelectStatement sub = SelectStatement.of(SelectClause.of("id"), FromClause.of("managers"));
    SelectStatement s = SelectStatement.of(SelectClause.star(), new WhereClause(in("id", sub)));
    assertEquals("""
        SELECT
          *
        WHERE
          id IN (
            SELECT
              id
            FROM
              managers
          )""", R.render(s, 2));
  }

  @Test
  void paramsAreCollectedInPlaceholderOrder() {
    SelectStatement s = SelectStatement.of(SelectClause.star(), FromClause.of("t"),
        new WhereClause(eq("a", param("x")).and(Condition.of(Literal.of("b"), Operator.EQ, param()))),
        LimitClause.of(param("lim")));

    RenderedStatement out = R.renderStatement(s, null);

    assertEquals("SELECT * FROM t WHERE a = :x AND b = %s LIMIT :lim", out.sql());
    assertEquals(List.of(Param.named("x"), Param.positional(), Param.named("lim")), out.params());
  }

  @Test
  void positionalMarkerComesFromOptions() {
    SqlRenderer r = new SqlRenderer(new RenderOptions("?"));
    SelectStatement s = SelectStatement.of(SelectClause.star(), FromClause.of("t"),
        new WhereClause(Condition.of(Literal.of("a"), "=", param()).and(Condition.of(Literal.of("b"), "=", Param.withPlaceholder(null, "$2")))));
    assertEquals("SELECT * FROM t WHERE a = ? AND b = $2", r.render(s));
  }

  @Test
  void chainPredecessorParamsComeFirst() {
    Condition chain = eq("a", param("first")).or(eq("b", param("second")));
    RenderedStatement out = R.renderStatement(
        SelectStatement.of(SelectClause.star(), new WhereClause(chain)), 2);
    assertEquals(List.of(Param.named("first"), Param.named("second")), out.params());
  }
}
