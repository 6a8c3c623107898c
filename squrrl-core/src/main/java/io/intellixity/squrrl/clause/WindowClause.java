package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.ArrayList;
import java.util.List;

public record WindowClause(List<NamedWindow> windows) implements Clause {
  public WindowClause {
    windows = MalformedExpressionException.requireNonEmpty(windows, "WINDOW requires at least one definition");
  }

  @Override
  public ClauseKey key() { return ClauseKey.WINDOW; }

  public static WindowClause of(NamedWindow... windows) { return new WindowClause(List.of(windows)); }

  public WindowClause plus(List<NamedWindow> more) {
    List<NamedWindow> out = new ArrayList<>(windows);
    out.addAll(more);
    return new WindowClause(out);
  }
}
