package io.intellixity.recordql.persistence.query;

import java.util.Objects;

/**
 * Predicate whose truth is computed by a function (user relation, user discovery).
 * <p>
 * The wrapped expression is expected to be a {@link FunctionCall}; renderers reject anything else.
 */
public final class FunctionalPredicate implements Predicate {
  private final Expression expression;

  public FunctionalPredicate(Expression expression) {
    this.expression = Objects.requireNonNull(expression, "expression");
  }

  @Override public Operator operator() { return Operator.FUNCTIONAL; }
  public Expression expression() { return expression; }

  @Override
  public boolean isEmpty() { return false; }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FunctionalPredicate other)) return false;
    return expression.equals(other.expression);
  }

  @Override
  public int hashCode() { return expression.hashCode(); }

  @Override
  public String toString() { return "FUNCTIONAL[" + expression + "]"; }
}
