package io.intellixity.squrrl.statement;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.squrrl.clause.WithClause;
import io.intellixity.squrrl.json.StatementJsonDeserializer;
import io.intellixity.squrrl.json.StatementJsonSerializer;

/** Root of a statement tree. Only {@link SelectStatement} carries the full clause set. */
@JsonSerialize(using = StatementJsonSerializer.class)
@JsonDeserialize(using = StatementJsonDeserializer.class)
public interface Statement {
  StatementKind kind();

  /** Optional WITH clause; null when absent. */
  WithClause with();
}
