package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.ArrayList;
import java.util.List;

/** Set operations applied left to right against the accumulated left-hand statement. */
public record SetOperationsClause(List<SetOperation> operations) implements Clause {
  public SetOperationsClause {
    operations = MalformedExpressionException.requireNonEmpty(operations, "Set operations clause requires at least one operation");
  }

  @Override
  public ClauseKey key() { return ClauseKey.SET_OPERATIONS; }

  public static SetOperationsClause of(SetOperation... operations) { return new SetOperationsClause(List.of(operations)); }

  public SetOperationsClause plus(SetOperation operation) {
    List<SetOperation> out = new ArrayList<>(operations);
    out.add(operation);
    return new SetOperationsClause(out);
  }
}
