package io.intellixity.recordql.persistence.schema;

/** Domain type of a record column. */
public enum DataType {
  STRING,
  NUMBER,
  INTEGER,
  BOOLEAN,
  DATE_TIME,
  JSON,
  REFERENCE,
  ASSET,
  LOCATION,
  SEQUENCE,
  ACL
}
