package io.intellixity.recordql.persistence.query;

import java.util.Objects;

/** A column of the joined user table (e.g. {@code email}). */
public record UserDataFunc(String dataName) implements Func {
  public UserDataFunc {
    Objects.requireNonNull(dataName, "dataName");
  }

  @Override
  public <R> R accept(FuncVisitor<R> visitor) { return visitor.visit(this); }
}
