package io.intellixity.recordql.persistence.jdbc.postgres;

import io.intellixity.recordql.persistence.query.*;

import java.util.Locale;

import static io.intellixity.recordql.persistence.jdbc.postgres.PostgresIdentifiers.qualified;
import static io.intellixity.recordql.persistence.query.QueryValidationException.Reason.*;

/**
 * ORDER BY compilation.
 *
 * <p>ORDER BY entries are assembled without bind args, so function arguments are formatted into
 * the SQL text instead of using placeholders.</p>
 */
final class SortCompiler implements FuncVisitor<String> {
  private final String alias;

  SortCompiler(String alias) {
    this.alias = alias;
  }

  String compile(Sort sort) {
    return term(sort).sql();
  }

  OrderTerm term(Sort sort) {
    String expr;
    if (sort.hasKeyPath()) {
      expr = qualified(alias, sort.keyPath());
    } else if (sort.func() != null) {
      expr = sort.func().accept(this);
    } else {
      throw new QueryValidationException(INVALID_SORT, "invalid Sort: specify either KeyPath or Func");
    }
    return new OrderTerm(expr, order(sort.order()));
  }

  private static String order(SortOrder order) {
    if (order == null) throw new QueryValidationException(UNKNOWN_SORT_ORDER, "unknown sort order = null");
    return switch (order) {
      case ASC -> "ASC";
      case DESC -> "DESC";
    };
  }

  @Override
  public String visit(DistanceFunc distance) {
    return String.format(Locale.ROOT, "ST_Distance_Sphere(%s, ST_MakePoint(%f, %f))",
        qualified(alias, distance.field()),
        distance.location().longitude(),
        distance.location().latitude());
  }

  @Override
  public String visit(CountFunc count) {
    throw unsupported(count);
  }

  @Override
  public String visit(UserDataFunc userData) {
    throw unsupported(userData);
  }

  @Override
  public String visit(UserRelationFunc userRelation) {
    throw unsupported(userRelation);
  }

  @Override
  public String visit(UserDiscoverFunc userDiscover) {
    throw unsupported(userDiscover);
  }

  private static QueryValidationException unsupported(Func f) {
    return new QueryValidationException(UNSUPPORTED_FUNCTION,
        "got unrecognized function in sort = " + f.getClass().getSimpleName());
  }
}
