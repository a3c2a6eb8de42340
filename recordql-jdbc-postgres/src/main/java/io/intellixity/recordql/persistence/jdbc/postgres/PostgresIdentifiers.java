package io.intellixity.recordql.persistence.jdbc.postgres;

import io.intellixity.recordql.persistence.query.MalformedQueryException;
import org.postgresql.core.Utils;

import java.sql.SQLException;

/** Identifier and string-literal quoting backed by the PostgreSQL driver's escaping rules. */
public final class PostgresIdentifiers {
  private PostgresIdentifiers() {}

  /** {@code "ident"} with embedded quotes doubled. */
  public static String quoteIdent(String ident) {
    if (ident == null) return null;
    try {
      return Utils.escapeIdentifier(null, ident).toString();
    } catch (SQLException e) {
      throw new MalformedQueryException("Invalid identifier: " + ident, e);
    }
  }

  /** {@code "alias"."column"}. */
  public static String qualified(String alias, String column) {
    return quoteIdent(alias) + "." + quoteIdent(column);
  }

  /** {@code 'value'} for a server running with standard_conforming_strings on. */
  public static String quoteLiteral(String value) {
    try {
      return "'" + Utils.escapeLiteral(null, value, true) + "'";
    } catch (SQLException e) {
      throw new MalformedQueryException("Invalid string literal", e);
    }
  }
}
