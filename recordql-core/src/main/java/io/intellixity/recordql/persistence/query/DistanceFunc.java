package io.intellixity.recordql.persistence.query;

import java.util.Objects;

/** Spherical distance between a location column and a fixed point. */
public record DistanceFunc(String field, Location location) implements Func {
  public DistanceFunc {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(location, "location");
  }

  @Override
  public <R> R accept(FuncVisitor<R> visitor) { return visitor.visit(this); }
}
