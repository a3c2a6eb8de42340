package io.intellixity.recordql.persistence.query;

/**
 * Boolean condition node of a record query.
 * <p>
 * The set of node shapes is closed; backends compile a tree through {@link PredicateVisitor}.
 */
public sealed interface Predicate permits CompoundPredicate, ComparisonPredicate, FunctionalPredicate {
  Operator operator();

  /** An empty predicate carries no condition and cannot be compiled. */
  boolean isEmpty();

  <R> R accept(PredicateVisitor<R> visitor);
}
