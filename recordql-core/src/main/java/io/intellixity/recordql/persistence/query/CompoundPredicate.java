package io.intellixity.recordql.persistence.query;

import java.util.List;
import java.util.Objects;

/** AND / OR over child predicates, or NOT over a single child. */
public final class CompoundPredicate implements Predicate {
  private final Operator operator;
  private final List<Predicate> children;

  public CompoundPredicate(Operator operator, List<Predicate> children) {
    this.operator = Objects.requireNonNull(operator, "operator");
    this.children = List.copyOf(children == null ? List.of() : children);
  }

  @Override public Operator operator() { return operator; }
  public List<Predicate> children() { return children; }

  @Override
  public boolean isEmpty() { return children.isEmpty(); }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CompoundPredicate other)) return false;
    return operator == other.operator && children.equals(other.children);
  }

  @Override
  public int hashCode() { return Objects.hash(operator, children); }

  @Override
  public String toString() { return operator + children.toString(); }
}
