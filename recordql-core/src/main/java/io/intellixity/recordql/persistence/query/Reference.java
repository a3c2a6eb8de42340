package io.intellixity.recordql.persistence.query;

import java.util.Objects;

/** Reference to another record; binds as its key. */
public record Reference(String recordType, String key) {
  public Reference {
    Objects.requireNonNull(recordType, "recordType");
    Objects.requireNonNull(key, "key");
  }
}
