package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.Expression;
import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.statement.MalformedExpressionException;
import io.intellixity.squrrl.statement.SelectStatement;

import java.util.List;

/** {@code name [(columns)] AS (body)} where the body is literal text or a nested SELECT. */
public record CommonTableExpression(String name, List<String> columns, Expression body) {
  public CommonTableExpression {
    MalformedExpressionException.requireText(name, "WITH query requires a name");
    columns = MalformedExpressionException.copyOrEmpty(columns, "WITH query columns");
    MalformedExpressionException.require(body, "WITH query '" + name + "' requires a body");
    if (!(body instanceof Literal) && !(body instanceof SelectStatement)) {
      throw new MalformedExpressionException(
          "WITH query '" + name + "' body must be literal text or a SELECT statement, got " + body.getClass().getSimpleName());
    }
  }

  public static CommonTableExpression of(String name, Expression body) {
    return new CommonTableExpression(name, List.of(), body);
  }
}
