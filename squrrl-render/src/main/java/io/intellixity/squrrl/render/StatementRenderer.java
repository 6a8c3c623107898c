package io.intellixity.squrrl.render;

import io.intellixity.squrrl.statement.Statement;

/**
 * Turns a statement tree into SQL text.
 * <p>
 * A null indent renders on a single line with fragments joined by one space. A non-negative
 * indent renders one fragment per line, each nested block indented by that many more spaces.
 */
public interface StatementRenderer {
  RenderedStatement renderStatement(Statement statement, Integer indent);

  default String render(Statement statement) {
    return renderStatement(statement, null).sql();
  }

  default String render(Statement statement, int indent) {
    return renderStatement(statement, indent).sql();
  }
}
