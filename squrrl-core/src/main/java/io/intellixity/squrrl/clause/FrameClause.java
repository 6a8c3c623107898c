package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.statement.MalformedExpressionException;

/** {@code mode [BETWEEN] start [AND end] [EXCLUDE ..]}; BETWEEN/AND appear only with an end bound. */
public record FrameClause(FrameMode mode, FrameBound start, FrameBound end, FrameExclusion exclusion) {
  public FrameClause {
    MalformedExpressionException.require(mode, "Frame clause requires a mode");
    MalformedExpressionException.require(start, "Frame clause requires a start bound");
  }

  public static FrameClause of(FrameMode mode, FrameBound start) {
    return new FrameClause(mode, start, null, null);
  }

  public static FrameClause between(FrameMode mode, FrameBound start, FrameBound end) {
    return new FrameClause(mode, start, MalformedExpressionException.require(end, "BETWEEN requires an end bound"), null);
  }

  public FrameClause excluding(FrameExclusion exclusion) {
    return new FrameClause(mode, start, end, exclusion);
  }
}
