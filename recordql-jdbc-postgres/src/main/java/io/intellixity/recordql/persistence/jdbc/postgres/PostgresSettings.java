package io.intellixity.recordql.persistence.jdbc.postgres;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Enumeration;
import java.util.Objects;
import java.util.Properties;

/**
 * Database-level naming used while compiling queries.
 *
 * <p>Loaded from every {@code META-INF/recordql.properties} resource on the classpath, later
 * resources overriding earlier ones:</p>
 *
 * <pre>
 * recordql.schema=app_main
 * recordql.user-record-type=user
 * recordql.user-table=_user
 * </pre>
 */
public record PostgresSettings(String schema, String userRecordType, String userTable) {
  public static final String RESOURCE = "META-INF/recordql.properties";

  public static final String DEFAULT_SCHEMA = "public";
  public static final String DEFAULT_USER_RECORD_TYPE = "user";
  public static final String DEFAULT_USER_TABLE = "_user";

  public PostgresSettings {
    schema = (schema == null) ? "" : schema.trim();
    userRecordType = blankTo(userRecordType, DEFAULT_USER_RECORD_TYPE);
    userTable = blankTo(userTable, DEFAULT_USER_TABLE);
  }

  public static PostgresSettings defaults() {
    return new PostgresSettings(DEFAULT_SCHEMA, DEFAULT_USER_RECORD_TYPE, DEFAULT_USER_TABLE);
  }

  public PostgresSettings withSchema(String schema) {
    return new PostgresSettings(schema, userRecordType, userTable);
  }

  /** Schema-qualified, quoted table name; unqualified when no schema is configured. */
  public String tableName(String table) {
    if (schema.isEmpty()) return PostgresIdentifiers.quoteIdent(table);
    return PostgresIdentifiers.quoteIdent(schema) + "." + PostgresIdentifiers.quoteIdent(table);
  }

  public static PostgresSettings fromProperties(Properties p) {
    Objects.requireNonNull(p, "p");
    return new PostgresSettings(
        p.getProperty("recordql.schema", DEFAULT_SCHEMA),
        p.getProperty("recordql.user-record-type"),
        p.getProperty("recordql.user-table"));
  }

  public static PostgresSettings load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static PostgresSettings load(ClassLoader cl) {
    if (cl == null) cl = PostgresSettings.class.getClassLoader();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }

    Properties merged = new Properties();
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }
      merged.putAll(p);
    }
    return fromProperties(merged);
  }

  private static String blankTo(String v, String def) {
    return (v == null || v.isBlank()) ? def : v.trim();
  }
}
