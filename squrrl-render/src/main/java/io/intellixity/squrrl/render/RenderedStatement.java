package io.intellixity.squrrl.render;

import io.intellixity.squrrl.expr.Param;

import java.util.List;

/** Rendered SQL text plus its parameters, in the order their placeholders appear. */
public record RenderedStatement(String sql, List<Param> params) {
  public RenderedStatement {
    params = params == null ? List.of() : List.copyOf(params);
  }
}
