package io.intellixity.recordql.persistence.jdbc.postgres;

import java.util.List;

/** Rendered {@code LEFT JOIN} clauses; joins can fan out rows, so any join requires DISTINCT. */
public record JoinClauses(List<String> clauses, boolean requiresDistinct) {
  public JoinClauses {
    clauses = clauses == null ? List.of() : List.copyOf(clauses);
  }
}
