package io.intellixity.recordql.persistence.jdbc.postgres;

import io.intellixity.recordql.persistence.query.*;
import io.intellixity.recordql.persistence.schema.DataType;
import io.intellixity.recordql.persistence.schema.FieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Set;

import static io.intellixity.recordql.persistence.jdbc.postgres.PostgresIdentifiers.qualified;
import static io.intellixity.recordql.persistence.query.QueryValidationException.Reason.INVALID_CONTEXT;

/**
 * Turns relationship and discovery functions into join requests on the session plus a
 * comparison over the joined aliases.
 */
final class FunctionalPredicateTranslator implements FuncVisitor<SqlFragment> {
  private static final Logger log = LoggerFactory.getLogger(FunctionalPredicateTranslator.class);

  static final String OWNER = "_owner";
  static final String OWNER_ID = "_owner_id";
  static final String TRANSIENT_EMAIL = "_transient__email";
  static final String TRANSIENT_USERNAME = "_transient__username";

  private final CompilerSession session;

  FunctionalPredicateTranslator(CompilerSession session) {
    this.session = session;
  }

  @Override
  public SqlFragment visit(UserRelationFunc fn) {
    String direction = fn.direction().isEmpty() ? UserRelationFunc.OUTWARD : fn.direction();
    boolean outward = direction.equals(UserRelationFunc.OUTWARD) || direction.equals(UserRelationFunc.MUTUAL);
    boolean inward = direction.equals(UserRelationFunc.INWARD) || direction.equals(UserRelationFunc.MUTUAL);
    if (!outward && !inward) {
      throw new MalformedQueryException("unknown user relation direction: " + fn.direction());
    }
    if (fn.relationName() == null || fn.relationName().isBlank()) {
      throw new MalformedQueryException("user relation requires a relation table name");
    }

    String primaryColumn = fn.keyPath();
    if (primaryColumn.isEmpty() || primaryColumn.equals(OWNER)) primaryColumn = OWNER_ID;

    String table = fn.relationName();
    String outwardAlias = outward ? session.requestJoin(new JoinSpec(table, primaryColumn, "right_id")) : null;
    String inwardAlias = inward ? session.requestJoin(new JoinSpec(table, primaryColumn, "left_id")) : null;

    String sql;
    if (outwardAlias != null && inwardAlias != null) {
      sql = qualified(outwardAlias, "left_id") + " = " + qualified(inwardAlias, "right_id")
          + " AND " + qualified(outwardAlias, "left_id") + " = ?";
    } else if (outwardAlias != null) {
      sql = qualified(outwardAlias, "left_id") + " = ?";
    } else {
      sql = qualified(inwardAlias, "right_id") + " = ?";
    }
    return new SqlFragment(sql, Collections.singletonList(fn.user()));
  }

  /** Discovery by email; other argument names are not supported yet and are ignored. */
  @Override
  public SqlFragment visit(UserDiscoverFunc fn) {
    PostgresSettings settings = session.settings();
    if (!settings.userRecordType().equals(session.primaryTable())) {
      throw new QueryValidationException(INVALID_CONTEXT,
          "user discover predicate can only be used on user record, not '" + session.primaryTable() + "'");
    }
    if (log.isDebugEnabled() && !fn.args().keySet().equals(Set.of("email"))) {
      log.debug("recordql.pq op=user_discover ignoredArgs={}", fn.args().keySet());
    }

    String alias = session.requestJoin(new JoinSpec(settings.userTable(), "_id", "id"));
    ComparisonPredicate byEmail = new ComparisonPredicate(Operator.IN,
        new KeyPath("email"), new Literal(fn.argsByName("email")));
    SqlFragment sql = new ExpressionCompiler(alias).compileIn(byEmail);

    session.addSyntheticColumn(TRANSIENT_EMAIL,
        FieldType.computed(DataType.STRING, new FunctionCall(new UserDataFunc("email"))));
    session.addSyntheticColumn(TRANSIENT_USERNAME,
        FieldType.computed(DataType.STRING, new FunctionCall(new UserDataFunc("username"))));
    return sql;
  }

  @Override
  public SqlFragment visit(DistanceFunc distance) {
    throw notAPredicate(distance);
  }

  @Override
  public SqlFragment visit(CountFunc count) {
    throw notAPredicate(count);
  }

  @Override
  public SqlFragment visit(UserDataFunc userData) {
    throw notAPredicate(userData);
  }

  private static MalformedQueryException notAPredicate(Func f) {
    return new MalformedQueryException(
        "the specified function cannot be used as a functional predicate: " + f.getClass().getSimpleName());
  }
}
