package io.intellixity.squrrl.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.squrrl.statement.SelectStatement;
import io.intellixity.squrrl.statement.Statement;

/** Text form of statements over a shared {@link ObjectMapper}. */
public final class StatementJson {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private StatementJson() {}

  public static ObjectMapper mapper() { return MAPPER; }

  public static String toJson(Statement statement) {
    try {
      return MAPPER.writerFor(Statement.class).writeValueAsString(statement);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot serialize statement " + statement.kind(), e);
    }
  }

  public static Statement fromJson(String json) {
    try {
      return MAPPER.readerFor(Statement.class).readValue(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid statement JSON", e);
    }
  }

  /** Decodes a document that must describe a SELECT statement. */
  public static SelectStatement selectFromJson(String json) {
    Statement s = fromJson(json);
    if (!(s instanceof SelectStatement sel)) {
      throw new IllegalArgumentException("Expected a SELECT statement, got " + (s == null ? "null" : s.kind()));
    }
    return sel;
  }
}
