package io.intellixity.squrrl.render;

import io.intellixity.squrrl.statement.SelectStatement;
import io.intellixity.squrrl.statement.Statement;
import io.intellixity.squrrl.statement.UnsupportedStatementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Default {@link StatementRenderer}: renders SELECT statements in canonical clause order.
 * <p>
 * Instances hold only their {@link RenderOptions} and are safe to share between threads.
 */
public final class SqlRenderer implements StatementRenderer {
  private static final Logger log = LoggerFactory.getLogger(SqlRenderer.class);

  private final RenderOptions options;
  private final SelectRenderer selects = new SelectRenderer();

  public SqlRenderer() {
    this(RenderOptions.defaults());
  }

  public SqlRenderer(RenderOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /** Renderer using the options found on the class path, see {@link RenderOptions#load()}. */
  public static SqlRenderer configured() {
    return new SqlRenderer(RenderOptions.load());
  }

  public RenderOptions options() { return options; }

  @Override
  public RenderedStatement renderStatement(Statement statement, Integer indent) {
    Objects.requireNonNull(statement, "statement");
    if (indent != null && indent < 0) {
      throw new IllegalArgumentException("indent must be >= 0, got " + indent);
    }
    if (!(statement instanceof SelectStatement select)) {
      throw new UnsupportedStatementException(statement.kind());
    }

    RenderContext ctx = new RenderContext(indent, options);
    List<String> lines = selects.lines(select, ctx);
    RenderedStatement out = new RenderedStatement(String.join(indent == null ? " " : "\n", lines), ctx.params());
    debugRender(select, indent, out);
    return out;
  }

  private static void debugRender(SelectStatement s, Integer indent, RenderedStatement out) {
    if (!log.isDebugEnabled()) return;
    log.debug("squrrl.render kind={} mode={} clauses={} params={} length={}",
        s.kind(), indent == null ? "single-line" : "multi-line:" + indent,
        s.clauses(), out.params().size(), out.sql().length());
    if (log.isTraceEnabled()) {
      log.trace("squrrl.render sql={}", out.sql());
    }
  }
}
