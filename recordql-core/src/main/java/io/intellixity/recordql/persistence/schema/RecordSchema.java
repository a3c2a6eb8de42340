package io.intellixity.recordql.persistence.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Ordered, immutable column name to {@link FieldType} mapping. */
public final class RecordSchema {
  private static final RecordSchema EMPTY = new RecordSchema(Map.of());

  private final Map<String, FieldType> fields;

  public RecordSchema(Map<String, FieldType> fields) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
  }

  public static RecordSchema empty() { return EMPTY; }

  public static Builder builder() { return new Builder(); }

  public Map<String, FieldType> fields() { return fields; }

  /** Returns the field type, or null if the column is unknown. */
  public FieldType get(String column) { return fields.get(column); }

  public boolean contains(String column) { return fields.containsKey(column); }

  public int size() { return fields.size(); }

  /**
   * Returns a schema with {@code extra} appended. Columns already present keep their
   * existing descriptor.
   */
  public RecordSchema extend(Map<String, FieldType> extra) {
    if (extra == null || extra.isEmpty()) return this;
    Map<String, FieldType> out = new LinkedHashMap<>(fields);
    for (var e : extra.entrySet()) {
      out.putIfAbsent(e.getKey(), e.getValue());
    }
    return new RecordSchema(out);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof RecordSchema other && fields.equals(other.fields);
  }

  @Override
  public int hashCode() { return fields.hashCode(); }

  @Override
  public String toString() { return "RecordSchema" + fields; }

  public static final class Builder {
    private final Map<String, FieldType> fields = new LinkedHashMap<>();

    private Builder() {}

    public Builder field(String column, DataType type) {
      fields.put(Objects.requireNonNull(column, "column"), FieldType.of(type));
      return this;
    }

    public Builder field(String column, FieldType type) {
      fields.put(Objects.requireNonNull(column, "column"), Objects.requireNonNull(type, "type"));
      return this;
    }

    public RecordSchema build() { return new RecordSchema(fields); }
  }
}
