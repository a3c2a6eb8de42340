package io.intellixity.recordql.persistence.acl;

/** Access level a query needs on the records it touches. */
public enum AclLevel {
  READ("read"),
  WRITE("write");

  private final String value;

  AclLevel(String value) {
    this.value = value;
  }

  /** Value stored in the {@code level} attribute of an access entry. */
  public String value() { return value; }
}
