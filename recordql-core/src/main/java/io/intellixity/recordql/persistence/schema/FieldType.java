package io.intellixity.recordql.persistence.schema;

import io.intellixity.recordql.persistence.query.Expression;

import java.util.Objects;

/**
 * Column descriptor. A non-null {@code expression} marks a computed column whose value is produced
 * by the expression instead of being read from storage.
 */
public record FieldType(DataType type, Expression expression) {
  public FieldType {
    Objects.requireNonNull(type, "type");
  }

  public static FieldType of(DataType type) { return new FieldType(type, null); }

  public static FieldType computed(DataType type, Expression expression) {
    return new FieldType(type, Objects.requireNonNull(expression, "expression"));
  }

  public boolean isComputed() { return expression != null; }
}
