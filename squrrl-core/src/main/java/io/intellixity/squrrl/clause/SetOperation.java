package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.statement.MalformedExpressionException;
import io.intellixity.squrrl.statement.SelectStatement;

/** {@code UNION|INTERSECT|EXCEPT [ALL|DISTINCT] select}; a null quantifier means the SQL default (DISTINCT). */
public record SetOperation(SetOperator operator, SetQuantifier quantifier, SelectStatement select) {
  public SetOperation {
    MalformedExpressionException.require(operator, "Set operation requires an operator");
    MalformedExpressionException.require(select, operator + " requires a SELECT statement");
  }

  public static SetOperation of(SetOperator operator, SelectStatement select) {
    return new SetOperation(operator, null, select);
  }

  public static SetOperation all(SetOperator operator, SelectStatement select) {
    return new SetOperation(operator, SetQuantifier.ALL, select);
  }
}
