package io.intellixity.squrrl.schema;

import io.intellixity.squrrl.clause.AliasedTable;
import io.intellixity.squrrl.clause.TableExpression;
import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Table metadata registered by hand: a name, an optional schema and a mapping from field names to
 * column names. Columns come back as {@link ColumnRef}s qualified with the table's path.
 */
public record TableDef(String schema, String name, Map<String, String> columns) implements TableExpression {
  public TableDef {
    MalformedExpressionException.requireText(name, "Table requires a name");
    if (schema != null && schema.isBlank()) schema = null;
    columns = columns == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
  }

  public static Builder builder(String name) { return new Builder(name); }

  public String path() {
    return schema == null ? name : schema + "." + name;
  }

  public ColumnRef column(String field) {
    String column = columns.get(field);
    if (column == null) {
      throw new IllegalArgumentException("Unknown column '" + field + "' on table " + path());
    }
    return new ColumnRef(column, path());
  }

  /** {@code path.*}. */
  public ColumnRef all() { return new ColumnRef("*", path()); }

  public AliasedTable as(String alias) { return new AliasedTable(this, alias); }

  public TableDef inSchema(String schema) { return new TableDef(schema, name, columns); }

  public static final class Builder {
    private final String name;
    private String schema;
    private final Map<String, String> columns = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder schema(String schema) {
      this.schema = schema;
      return this;
    }

    /** Field whose column name is the field name lower-cased. */
    public Builder column(String field) {
      MalformedExpressionException.requireText(field, "Column field requires a name");
      return column(field, field.toLowerCase(Locale.ROOT));
    }

    public Builder column(String field, String columnName) {
      MalformedExpressionException.requireText(field, "Column field requires a name");
      MalformedExpressionException.requireText(columnName, "Column requires a name");
      columns.put(field, columnName);
      return this;
    }

    public TableDef build() { return new TableDef(schema, name, columns); }
  }
}
