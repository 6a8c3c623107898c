package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.ValueExpression;
import io.intellixity.squrrl.statement.MalformedExpressionException;

/**
 * A frame start or end: one of the fixed keywords, or {@code offset PRECEDING|FOLLOWING} where the
 * offset is a literal or a parameter.
 */
public record FrameBound(Kind kind, ValueExpression offset) {
  public enum Kind {
    UNBOUNDED_PRECEDING("UNBOUNDED PRECEDING", false),
    PRECEDING("PRECEDING", true),
    CURRENT_ROW("CURRENT ROW", false),
    FOLLOWING("FOLLOWING", true),
    UNBOUNDED_FOLLOWING("UNBOUNDED FOLLOWING", false);

    private final String sql;
    private final boolean needsOffset;

    Kind(String sql, boolean needsOffset) {
      this.sql = sql;
      this.needsOffset = needsOffset;
    }

    public String sql() { return sql; }

    public boolean needsOffset() { return needsOffset; }
  }

  public static final FrameBound UNBOUNDED_PRECEDING = new FrameBound(Kind.UNBOUNDED_PRECEDING, null);
  public static final FrameBound CURRENT_ROW = new FrameBound(Kind.CURRENT_ROW, null);
  public static final FrameBound UNBOUNDED_FOLLOWING = new FrameBound(Kind.UNBOUNDED_FOLLOWING, null);

  public FrameBound {
    MalformedExpressionException.require(kind, "Frame bound requires a kind");
    if (kind.needsOffset() && offset == null) {
      throw new MalformedExpressionException("Frame bound " + kind.sql() + " requires an offset");
    }
    if (!kind.needsOffset() && offset != null) {
      throw new MalformedExpressionException("Frame bound " + kind.sql() + " does not take an offset");
    }
  }

  public static FrameBound preceding(ValueExpression offset) { return new FrameBound(Kind.PRECEDING, offset); }

  public static FrameBound following(ValueExpression offset) { return new FrameBound(Kind.FOLLOWING, offset); }
}
