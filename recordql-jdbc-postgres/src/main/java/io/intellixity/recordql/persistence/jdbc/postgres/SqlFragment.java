package io.intellixity.recordql.persistence.jdbc.postgres;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL text plus the positional bind values for its {@code ?} placeholders, in textual order.
 * Bind values may be null.
 */
public record SqlFragment(String sql, List<Object> args) {
  private static final SqlFragment EMPTY = new SqlFragment("", List.of());

  public SqlFragment {
    sql = sql == null ? "" : sql;
    args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
  }

  public static SqlFragment empty() { return EMPTY; }

  public static SqlFragment of(String sql) { return new SqlFragment(sql, List.of()); }

  public boolean isEmpty() { return sql.isBlank(); }

  /** Joins non-empty fragments with {@code separator}, concatenating args in order. */
  public static SqlFragment join(String separator, List<SqlFragment> parts) {
    List<String> sql = new ArrayList<>();
    List<Object> args = new ArrayList<>();
    for (SqlFragment p : parts) {
      if (p == null || p.isEmpty()) continue;
      sql.add(p.sql());
      args.addAll(p.args());
    }
    return new SqlFragment(String.join(separator, sql), args);
  }
}
