package io.intellixity.recordql.persistence.query;

/** Row count; {@code overallRecords} asks for the count over the whole result instead of a group. */
public record CountFunc(boolean overallRecords) implements Func {
  @Override
  public <R> R accept(FuncVisitor<R> visitor) { return visitor.visit(this); }
}
