package io.intellixity.recordql.persistence.query;

public interface PredicateVisitor<R> {
  R visit(CompoundPredicate compound);
  R visit(ComparisonPredicate comparison);
  R visit(FunctionalPredicate functional);
}
