package io.intellixity.squrrl.expr;

import io.intellixity.squrrl.statement.MalformedExpressionException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ParamTest {
  @Test
  void namedParamUsesColonPrefix() {
    assertEquals(":tenant_id", Param.named("tenant_id").placeholder("%s"));
  }

  @Test
  void positionalParamUsesSessionMarker() {
    assertEquals("%s", Param.positional().placeholder("%s"));
    assertEquals("?", Param.positional().placeholder("?"));
  }

  @Test
  void explicitPlaceholderWins() {
    assertEquals("$1", Param.withPlaceholder("id", "$1").placeholder("?"));
  }

  @Test
  void equalityIsByValue() {
    assertEquals(Param.named("a"), Param.named("a"));
    assertNotEquals(Param.named("a"), Param.positional());
  }

  @Test
  void invalidNamesAreRejected() {
    assertThrows(MalformedExpressionException.class, () -> Param.named("1abc"));
    assertThrows(MalformedExpressionException.class, () -> Param.named("a-b"));
    assertThrows(MalformedExpressionException.class, () -> Param.named(""));
  }
}
