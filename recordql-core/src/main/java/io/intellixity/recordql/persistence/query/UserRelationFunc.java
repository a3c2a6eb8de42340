package io.intellixity.recordql.persistence.query;

/**
 * Matches records whose owner (or {@code keyPath} column) is related to {@code user} through the
 * relation table {@code relationName}.
 * <p>
 * {@code direction} is one of {@code outward}, {@code inward}, {@code mutual}; blank means outward.
 * A blank {@code keyPath} (or {@code _owner}) means the record owner.
 */
public record UserRelationFunc(String keyPath, String relationName, String direction, String user) implements Func {
  public static final String OUTWARD = "outward";
  public static final String INWARD = "inward";
  public static final String MUTUAL = "mutual";

  public UserRelationFunc {
    keyPath = keyPath == null ? "" : keyPath;
    direction = direction == null ? "" : direction;
  }

  @Override
  public <R> R accept(FuncVisitor<R> visitor) { return visitor.visit(this); }
}
