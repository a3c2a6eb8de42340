package io.intellixity.recordql.persistence.jdbc.postgres;

import io.intellixity.recordql.persistence.query.MalformedQueryException;
import io.intellixity.recordql.persistence.schema.DataType;

/** Storage column type for each domain {@link DataType}. */
public final class PostgresTypes {
  public static final String TEXT = "text";
  public static final String DOUBLE_PRECISION = "double precision";
  public static final String INTEGER = "integer";
  public static final String TIMESTAMP = "timestamp without time zone";
  public static final String BOOLEAN = "boolean";
  public static final String JSONB = "jsonb";
  public static final String POINT = "geometry(Point)";
  public static final String SERIAL = "serial UNIQUE";

  private PostgresTypes() {}

  public static String columnType(DataType dataType) {
    if (dataType == null) throw new MalformedQueryException("Unsupported dataType = null");
    return switch (dataType) {
      case STRING, ASSET, REFERENCE -> TEXT;
      case NUMBER -> DOUBLE_PRECISION;
      case INTEGER -> INTEGER;
      case DATE_TIME -> TIMESTAMP;
      case BOOLEAN -> BOOLEAN;
      case JSON -> JSONB;
      case LOCATION -> POINT;
      case SEQUENCE -> SERIAL;
      default -> throw new MalformedQueryException("Unsupported dataType = " + dataType);
    };
  }
}
