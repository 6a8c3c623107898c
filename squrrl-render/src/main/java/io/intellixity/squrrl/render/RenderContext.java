package io.intellixity.squrrl.render;

import io.intellixity.squrrl.expr.Param;

import java.util.ArrayList;
import java.util.List;

/** Per-render state: the indentation step and the parameters in placeholder order. */
final class RenderContext {
  private final int step;
  private final RenderOptions options;
  private final List<Param> params = new ArrayList<>();

  RenderContext(Integer indent, RenderOptions options) {
    this.step = indent == null ? 0 : indent;
    this.options = options;
  }

  int step() { return step; }

  String placeholder(Param p) {
    params.add(p);
    return p.placeholder(options.positionalPlaceholder());
  }

  List<Param> params() { return List.copyOf(params); }
}
