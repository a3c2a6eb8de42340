package io.intellixity.recordql.persistence.jdbc.postgres;

import io.intellixity.recordql.persistence.query.*;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static io.intellixity.recordql.persistence.jdbc.postgres.PostgresIdentifiers.qualified;

/**
 * Compiles expressions to SQL operands. Key paths resolve against {@code alias}; literals become
 * {@code ?} placeholders.
 */
final class ExpressionCompiler implements ExpressionVisitor<SqlFragment>, FuncVisitor<SqlFragment> {
  /** Alias the user table is always joined under. */
  static final String USER_ALIAS = "_user";

  private final String alias;

  ExpressionCompiler(String alias) {
    this.alias = alias;
  }

  SqlFragment compile(Expression expression) {
    return expression.accept(this);
  }

  @Override
  public SqlFragment visit(KeyPath keyPath) {
    return SqlFragment.of(qualified(alias, keyPath.name()));
  }

  @Override
  public SqlFragment visit(Literal literal) {
    return literalOperand(literal);
  }

  @Override
  public SqlFragment visit(FunctionCall call) {
    return call.func().accept(this);
  }

  @Override
  public SqlFragment visit(DistanceFunc distance) {
    String sql = "ST_Distance_Sphere(" + qualified(alias, distance.field()) + ", ST_MakePoint(?, ?))";
    return new SqlFragment(sql, List.of(distance.location().longitude(), distance.location().latitude()));
  }

  @Override
  public SqlFragment visit(CountFunc count) {
    return SqlFragment.of(count.overallRecords() ? "COUNT(*) OVER()" : "COUNT(*)");
  }

  @Override
  public SqlFragment visit(UserDataFunc userData) {
    return SqlFragment.of(qualified(USER_ALIAS, userData.dataName()));
  }

  @Override
  public SqlFragment visit(UserRelationFunc userRelation) {
    throw unsupportedInExpression(userRelation);
  }

  @Override
  public SqlFragment visit(UserDiscoverFunc userDiscover) {
    throw unsupportedInExpression(userDiscover);
  }

  /**
   * {@code literal IN keyPath} tests membership in a JSON/array column ({@code jsonb_exists});
   * {@code keyPath IN literal} tests the column against a value list.
   */
  SqlFragment compileIn(ComparisonPredicate in) {
    Expression lhs = in.left();
    Expression rhs = in.right();

    if (lhs instanceof Literal && rhs instanceof KeyPath) {
      SqlFragment column = compile(rhs);
      SqlFragment value = compile(lhs);
      List<Object> args = new ArrayList<>(column.args());
      args.addAll(value.args());
      return new SqlFragment("jsonb_exists(" + column.sql() + ", " + value.sql() + ")", args);
    }

    if (lhs instanceof KeyPath && rhs instanceof Literal values) {
      SqlFragment column = compile(lhs);
      SqlFragment list = values.isArray()
          ? literalOperand(values)
          : arrayOperand(Collections.singletonList(values.value()));
      List<Object> args = new ArrayList<>(column.args());
      args.addAll(list.args());
      return new SqlFragment(column.sql() + " IN " + list.sql(), args);
    }

    throw new MalformedQueryException("malformed IN predicate: expected a key path and a literal, got "
        + kind(lhs) + " and " + kind(rhs));
  }

  static SqlFragment literalOperand(Literal literal) {
    if (literal.isArray()) return arrayOperand(elements(literal.value()));
    return new SqlFragment("?", Collections.singletonList(bindValue(literal.value())));
  }

  /** {@code (?, ?, ...)}; an empty list renders {@code (NULL)} since {@code IN ()} is not valid SQL. */
  private static SqlFragment arrayOperand(List<Object> elements) {
    if (elements.isEmpty()) return SqlFragment.of("(NULL)");
    List<Object> args = new ArrayList<>(elements.size());
    for (Object e : elements) args.add(bindValue(e));
    return new SqlFragment("(" + placeholders(args.size()) + ")", args);
  }

  static Object bindValue(Object value) {
    if (value instanceof Reference r) return r.key();
    return value;
  }

  static String placeholders(int count) {
    return String.join(", ", Collections.nCopies(count, "?"));
  }

  private static List<Object> elements(Object array) {
    if (array instanceof Collection<?> c) return new ArrayList<>(c);
    int n = Array.getLength(array);
    List<Object> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) out.add(Array.get(array, i));
    return out;
  }

  private static String kind(Expression e) {
    return e.getClass().getSimpleName();
  }

  private static MalformedQueryException unsupportedInExpression(Func f) {
    return new MalformedQueryException("got unrecognized function in expression = " + f.getClass().getSimpleName());
  }
}
