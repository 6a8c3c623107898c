package io.intellixity.squrrl.expr;

import io.intellixity.squrrl.statement.MalformedExpressionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ConditionTest {
  @Test
  void chainingLinksPredecessorsLeftToRight() {
    Condition a = Condition.of("a", "=", "1");
    Condition b = Condition.of("b", "=", "2");
    Condition c = Condition.of("c", "=", "3");

    Condition chain = a.and(b).or(c);

    assertEquals(3, chain.chainLength());
    assertEquals(Literal.of("c"), chain.left());
    assertEquals(Connector.OR, chain.previous().connector());
    Condition middle = chain.previous().condition();
    assertEquals(Literal.of("b"), middle.left());
    assertEquals(Connector.AND, middle.previous().connector());
    assertEquals(a, middle.previous().condition());
    assertNull(a.previous());
  }

  @Test
  void chainingLeavesOperandsUntouched() {
    Condition a = Condition.of("a", "=", "1");
    Condition b = Condition.of("b", "=", "2");

    a.and(b);

    assertFalse(a.chained());
    assertFalse(b.chained());
  }

  @Test
  void chainingAnAlreadyChainedConditionIsRejected() {
    Condition a = Condition.of("a", "=", "1");
    Condition bc = Condition.of("b", "=", "2").and(Condition.of("c", "=", "3"));

    assertThrows(MalformedExpressionException.class, () -> a.or(bc));
  }

  @Test
  void missingOperandsAreRejected() {
    assertThrows(MalformedExpressionException.class, () -> Condition.of(null, "=", Literal.of("1")));
    assertThrows(MalformedExpressionException.class, () -> Condition.of(Literal.of("a"), " ", Literal.of("1")));
    assertThrows(MalformedExpressionException.class, () -> Condition.of(Literal.of("a"), "=", null));
    assertThrows(MalformedExpressionException.class, () -> Literal.of(" "));
  }

  @Test
  void negateTogglesAndKeepsChain() {
    Condition c = Condition.of("a", "=", "1").and(Condition.of("b", "=", "2"));
    Condition n = c.negate();

    assertTrue(n.negated());
    assertEquals(c.previous(), n.previous());
    assertFalse(n.negate().negated());
  }

  @Test
  void operatorEnumRendersItsSymbol() {
    Condition c = Condition.of(Literal.of("name"), Operator.NOT_LIKE, Literal.of("'x%'"));
    assertEquals("NOT LIKE", c.operator());
  }

  @Test
  void groupsRequireOperands() {
    assertThrows(MalformedExpressionException.class, () -> new LogicalGroup(Connector.AND, List.of()));
    assertThrows(MalformedExpressionException.class, () -> new LogicalGroup(null, List.of(Literal.of("x"))));
    assertThrows(MalformedExpressionException.class, () -> new NotElement(null));
  }

  @Test
  void inOverEmptyValuesIsRejected() {
    assertThrows(MalformedExpressionException.class, () -> Predicates.in("id", List.of()));
    assertEquals(Literal.of("(1, 2)"), Predicates.in("id", List.of("1", "2")).right());
  }

  @Test
  void caseRequiresAWhen() {
    assertThrows(MalformedExpressionException.class, () -> CaseExpression.searched(List.of(), null));
  }
}
