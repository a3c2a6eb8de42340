package io.intellixity.recordql.persistence.query;

/**
 * One ORDER BY entry. Exactly one of {@code keyPath} / {@code func} is expected to be set;
 * renderers reject a sort with neither.
 */
public record Sort(String keyPath, Func func, SortOrder order) {
  public static Sort by(String keyPath, SortOrder order) { return new Sort(keyPath, null, order); }
  public static Sort by(Func func, SortOrder order) { return new Sort(null, func, order); }

  public boolean hasKeyPath() { return keyPath != null && !keyPath.isEmpty(); }
}
