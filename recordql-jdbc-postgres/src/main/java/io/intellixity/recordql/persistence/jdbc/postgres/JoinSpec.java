package io.intellixity.recordql.persistence.jdbc.postgres;

import java.util.Objects;

/** {@code LEFT JOIN secondaryTable ON primary.primaryColumn = secondary.secondaryColumn}. */
public record JoinSpec(String secondaryTable, String primaryColumn, String secondaryColumn) {
  public JoinSpec {
    Objects.requireNonNull(secondaryTable, "secondaryTable");
    Objects.requireNonNull(primaryColumn, "primaryColumn");
    Objects.requireNonNull(secondaryColumn, "secondaryColumn");
  }
}
