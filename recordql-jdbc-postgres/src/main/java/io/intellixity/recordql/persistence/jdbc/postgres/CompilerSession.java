package io.intellixity.recordql.persistence.jdbc.postgres;

import io.intellixity.recordql.persistence.acl.AclLevel;
import io.intellixity.recordql.persistence.acl.UserInfo;
import io.intellixity.recordql.persistence.query.Predicate;
import io.intellixity.recordql.persistence.query.Sort;
import io.intellixity.recordql.persistence.schema.FieldType;
import io.intellixity.recordql.persistence.schema.RecordSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static io.intellixity.recordql.persistence.jdbc.postgres.PostgresIdentifiers.qualified;
import static io.intellixity.recordql.persistence.jdbc.postgres.PostgresIdentifiers.quoteIdent;

/**
 * Per-query compilation state: the secondary tables the query must join and the synthetic
 * columns registered while compiling its predicate.
 *
 * <p>One session per query. Not thread-safe. After {@link #drain(RecordSchema)} the session
 * rejects further use.</p>
 */
public final class CompilerSession {
  private static final Logger log = LoggerFactory.getLogger(CompilerSession.class);

  private final PostgresSettings settings;
  private final String primaryTable;
  private final List<JoinSpec> joins = new ArrayList<>();
  private final Map<String, FieldType> syntheticColumns = new LinkedHashMap<>();
  private boolean drained;

  public CompilerSession(PostgresSettings settings, String primaryTable) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.primaryTable = Objects.requireNonNull(primaryTable, "primaryTable");
  }

  public PostgresSettings settings() { return settings; }
  public String primaryTable() { return primaryTable; }

  /** WHERE fragment for {@code predicate}, resolving key paths against the primary table. */
  public SqlFragment compile(Predicate predicate) {
    ensureOpen();
    return new PredicateCompiler(this).compile(predicate);
  }

  /** ORDER BY entry for {@code sort}; never carries bind args. */
  public String compileSort(Sort sort) {
    return compileOrderTerm(sort).sql();
  }

  public OrderTerm compileOrderTerm(Sort sort) {
    ensureOpen();
    return new SortCompiler(primaryTable).term(sort);
  }

  public SqlFragment accessControl(UserInfo user, AclLevel level) {
    return AccessControlPredicate.build(user, level);
  }

  /**
   * Returns the alias for {@code spec}, adding it to the join list on first request.
   * Equal specs always share one alias.
   */
  public String requestJoin(JoinSpec spec) {
    ensureOpen();
    Objects.requireNonNull(spec, "spec");
    int idx = joins.indexOf(spec);
    if (idx < 0) {
      joins.add(spec);
      idx = joins.size() - 1;
    }
    return aliasName(spec.secondaryTable(), idx);
  }

  /** The user table always uses {@value ExpressionCompiler#USER_ALIAS} so user data columns can reference it. */
  String aliasName(String secondaryTable, int indexInJoins) {
    if (settings.userTable().equals(secondaryTable)) return ExpressionCompiler.USER_ALIAS;
    return "_t" + indexInJoins;
  }

  public List<JoinSpec> joins() { return Collections.unmodifiableList(joins); }

  public JoinClauses renderJoins() {
    List<String> clauses = new ArrayList<>(joins.size());
    for (int i = 0; i < joins.size(); i++) {
      JoinSpec j = joins.get(i);
      String alias = aliasName(j.secondaryTable(), i);
      clauses.add("LEFT JOIN " + settings.tableName(j.secondaryTable()) + " AS " + quoteIdent(alias)
          + " ON " + qualified(primaryTable, j.primaryColumn()) + " = " + qualified(alias, j.secondaryColumn()));
    }
    return new JoinClauses(clauses, !joins.isEmpty());
  }

  void addSyntheticColumn(String column, FieldType type) {
    syntheticColumns.put(column, type);
  }

  public Map<String, FieldType> syntheticColumns() { return Collections.unmodifiableMap(syntheticColumns); }

  /** {@code schema} plus synthetic columns; existing columns are never replaced. */
  public RecordSchema extendSchema(RecordSchema schema) {
    return (schema == null ? RecordSchema.empty() : schema).extend(syntheticColumns);
  }

  /** Renders joins and the extended schema, then closes the session. */
  public Output drain(RecordSchema schema) {
    ensureOpen();
    JoinClauses jc = renderJoins();
    RecordSchema extended = extendSchema(schema);
    drained = true;
    if (log.isDebugEnabled()) {
      log.debug("recordql.pq op=drain table={} joins={} distinct={} syntheticColumns={}",
          primaryTable, jc.clauses().size(), jc.requiresDistinct(), syntheticColumns.keySet());
    }
    return new Output(jc, extended);
  }

  private void ensureOpen() {
    if (drained) throw new IllegalStateException("CompilerSession for '" + primaryTable + "' was already drained");
  }

  public record Output(JoinClauses joins, RecordSchema schema) {}
}
