package io.intellixity.recordql.persistence.jdbc.postgres;

import io.intellixity.recordql.persistence.schema.RecordSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Complete SELECT with positional args and the schema of the rows it returns. */
public record SelectStatement(String sql, List<Object> args, RecordSchema schema) {
  public SelectStatement {
    args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    schema = schema == null ? RecordSchema.empty() : schema;
  }
}
