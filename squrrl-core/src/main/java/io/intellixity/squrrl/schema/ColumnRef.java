package io.intellixity.squrrl.schema;

import io.intellixity.squrrl.clause.AliasedItem;
import io.intellixity.squrrl.expr.Expression;
import io.intellixity.squrrl.statement.MalformedExpressionException;

/** A column, optionally qualified by the path of its table ({@code schema.table}). */
public record ColumnRef(String name, String tablePath) implements Expression {
  public ColumnRef {
    MalformedExpressionException.requireText(name, "Column requires a name");
    if (tablePath != null && tablePath.isBlank()) tablePath = null;
  }

  public static ColumnRef of(String name) { return new ColumnRef(name, null); }

  /** Dotted path: {@code table.column}, or the bare name when unqualified. */
  public String path() {
    return tablePath == null ? name : tablePath + "." + name;
  }

  public ColumnRef qualify(String tablePath) { return new ColumnRef(name, tablePath); }

  public AliasedItem as(String alias) { return new AliasedItem(this, alias); }
}
