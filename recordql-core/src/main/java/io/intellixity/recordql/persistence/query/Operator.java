package io.intellixity.recordql.persistence.query;

public enum Operator {
  AND(Kind.COMPOUND),
  OR(Kind.COMPOUND),
  NOT(Kind.COMPOUND),

  EQUAL(Kind.BINARY),
  NOT_EQUAL(Kind.BINARY),
  GREATER_THAN(Kind.BINARY),
  LESS_THAN(Kind.BINARY),
  GREATER_THAN_OR_EQUAL(Kind.BINARY),
  LESS_THAN_OR_EQUAL(Kind.BINARY),
  LIKE(Kind.BINARY),
  ILIKE(Kind.BINARY),
  IN(Kind.BINARY),

  FUNCTIONAL(Kind.FUNCTIONAL);

  public enum Kind { COMPOUND, BINARY, FUNCTIONAL }

  private final Kind kind;

  Operator(Kind kind) {
    this.kind = kind;
  }

  public Kind kind() { return kind; }

  public boolean isCompound() { return kind == Kind.COMPOUND; }

  public boolean isBinary() { return kind == Kind.BINARY; }
}
