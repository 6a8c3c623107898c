package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.Expression;
import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.ArrayList;
import java.util.List;

/** Body of a window: {@code [existing] [PARTITION BY ..] [ORDER BY ..] [frame]}. All parts optional. */
public record WindowSpec(String existingWindow, List<Expression> partitionBy, List<OrderByItem> orderBy, FrameClause frame) {
  public static final WindowSpec EMPTY = new WindowSpec(null, List.of(), List.of(), null);

  public WindowSpec {
    if (existingWindow != null && existingWindow.isBlank()) {
      throw new MalformedExpressionException("Existing window name must not be blank");
    }
    partitionBy = MalformedExpressionException.copyOrEmpty(partitionBy, "PARTITION BY expressions");
    orderBy = MalformedExpressionException.copyOrEmpty(orderBy, "Window ORDER BY items");
  }

  public static WindowSpec named(String existingWindow) {
    return new WindowSpec(existingWindow, List.of(), List.of(), null);
  }

  public static WindowSpec partitionBy(String... columns) {
    List<Expression> out = new ArrayList<>();
    for (String c : columns) out.add(Literal.of(c));
    return new WindowSpec(null, out, List.of(), null);
  }

  public WindowSpec orderedBy(OrderByItem... items) {
    return new WindowSpec(existingWindow, partitionBy, List.of(items), frame);
  }

  public WindowSpec framed(FrameClause frame) {
    return new WindowSpec(existingWindow, partitionBy, orderBy, frame);
  }

  /** True when the spec only references a named window (rendered as {@code OVER name}). */
  public boolean referenceOnly() {
    return existingWindow != null && partitionBy.isEmpty() && orderBy.isEmpty() && frame == null;
  }
}
