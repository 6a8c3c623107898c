package io.intellixity.squrrl.schema;

import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A named group of tables; each registered table is qualified with the schema name. */
public record SchemaDef(String name, Map<String, TableDef> tables) {
  public SchemaDef {
    MalformedExpressionException.requireText(name, "Schema requires a name");
    Map<String, TableDef> qualified = new LinkedHashMap<>();
    if (tables != null) {
      for (Map.Entry<String, TableDef> e : tables.entrySet()) {
        qualified.put(e.getKey(), e.getValue().inSchema(name));
      }
    }
    tables = Collections.unmodifiableMap(qualified);
  }

  public static Builder builder(String name) { return new Builder(name); }

  public TableDef table(String field) {
    TableDef t = tables.get(field);
    if (t == null) throw new IllegalArgumentException("Unknown table '" + field + "' in schema " + name);
    return t;
  }

  public static final class Builder {
    private final String name;
    private final Map<String, TableDef> tables = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder table(String field, TableDef table) {
      MalformedExpressionException.require(table, "Schema table requires a definition");
      tables.put(field, table);
      return this;
    }

    public SchemaDef build() { return new SchemaDef(name, tables); }
  }
}
