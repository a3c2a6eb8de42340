package io.intellixity.recordql.persistence.jdbc.postgres;

/** One compiled ORDER BY entry: the sort expression and its {@code ASC}/{@code DESC} keyword. */
public record OrderTerm(String expression, String direction) {
  public String sql() { return expression + " " + direction; }
}
