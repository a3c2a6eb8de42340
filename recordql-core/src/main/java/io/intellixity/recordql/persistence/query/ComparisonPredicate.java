package io.intellixity.recordql.persistence.query;

import java.util.Objects;

/** Binary comparison (including IN) between two expressions. */
public final class ComparisonPredicate implements Predicate {
  private final Operator operator;
  private final Expression left;
  private final Expression right;

  public ComparisonPredicate(Operator operator, Expression left, Expression right) {
    this.operator = Objects.requireNonNull(operator, "operator");
    this.left = Objects.requireNonNull(left, "left");
    this.right = Objects.requireNonNull(right, "right");
  }

  @Override public Operator operator() { return operator; }
  public Expression left() { return left; }
  public Expression right() { return right; }

  @Override
  public boolean isEmpty() { return false; }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ComparisonPredicate other)) return false;
    return operator == other.operator && left.equals(other.left) && right.equals(other.right);
  }

  @Override
  public int hashCode() { return Objects.hash(operator, left, right); }

  @Override
  public String toString() { return operator + "[" + left + ", " + right + "]"; }
}
