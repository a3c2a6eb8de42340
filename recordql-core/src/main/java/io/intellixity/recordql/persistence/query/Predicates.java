package io.intellixity.recordql.persistence.query;

import java.util.List;

public final class Predicates {
  private Predicates() {}

  public static KeyPath key(String name) { return new KeyPath(name); }
  public static Literal value(Object value) { return new Literal(value); }
  public static FunctionCall call(Func func) { return new FunctionCall(func); }

  public static ComparisonPredicate eq(String keyPath, Object value) { return compare(Operator.EQUAL, keyPath, value); }
  public static ComparisonPredicate ne(String keyPath, Object value) { return compare(Operator.NOT_EQUAL, keyPath, value); }
  public static ComparisonPredicate gt(String keyPath, Object value) { return compare(Operator.GREATER_THAN, keyPath, value); }
  public static ComparisonPredicate lt(String keyPath, Object value) { return compare(Operator.LESS_THAN, keyPath, value); }
  public static ComparisonPredicate gte(String keyPath, Object value) { return compare(Operator.GREATER_THAN_OR_EQUAL, keyPath, value); }
  public static ComparisonPredicate lte(String keyPath, Object value) { return compare(Operator.LESS_THAN_OR_EQUAL, keyPath, value); }
  public static ComparisonPredicate like(String keyPath, String pattern) { return compare(Operator.LIKE, keyPath, pattern); }
  public static ComparisonPredicate ilike(String keyPath, String pattern) { return compare(Operator.ILIKE, keyPath, pattern); }

  /** {@code keyPath IN (values...)}. */
  public static ComparisonPredicate in(String keyPath, List<?> values) {
    return new ComparisonPredicate(Operator.IN, key(keyPath), value(values));
  }

  /** {@code value} is an element of the array/JSON column {@code keyPath}. */
  public static ComparisonPredicate contains(String keyPath, Object value) {
    return new ComparisonPredicate(Operator.IN, value(value), key(keyPath));
  }

  public static ComparisonPredicate compare(Operator op, String keyPath, Object value) {
    return new ComparisonPredicate(op, key(keyPath), value(value));
  }

  public static CompoundPredicate and(Predicate... children) {
    return new CompoundPredicate(Operator.AND, List.of(children));
  }

  public static CompoundPredicate or(Predicate... children) {
    return new CompoundPredicate(Operator.OR, List.of(children));
  }

  public static CompoundPredicate not(Predicate child) {
    return new CompoundPredicate(Operator.NOT, List.of(child));
  }

  public static FunctionalPredicate functional(Func func) {
    return new FunctionalPredicate(call(func));
  }
}
