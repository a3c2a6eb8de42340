package io.intellixity.recordql.persistence.query;

import java.util.Collection;

/**
 * Scalar or array literal.
 * <p>
 * Arrays are any {@link Collection} or Java array; everything else (including {@code null}) is a scalar.
 */
public record Literal(Object value) implements Expression {
  public boolean isArray() {
    return value instanceof Collection<?> || (value != null && value.getClass().isArray());
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
