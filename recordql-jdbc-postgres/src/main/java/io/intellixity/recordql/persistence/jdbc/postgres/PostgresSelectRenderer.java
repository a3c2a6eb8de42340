package io.intellixity.recordql.persistence.jdbc.postgres;

import io.intellixity.recordql.persistence.acl.AclLevel;
import io.intellixity.recordql.persistence.query.CountFunc;
import io.intellixity.recordql.persistence.query.FunctionCall;
import io.intellixity.recordql.persistence.query.RecordQuery;
import io.intellixity.recordql.persistence.query.Sort;
import io.intellixity.recordql.persistence.schema.FieldType;
import io.intellixity.recordql.persistence.schema.RecordSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.intellixity.recordql.persistence.jdbc.postgres.PostgresIdentifiers.qualified;
import static io.intellixity.recordql.persistence.jdbc.postgres.PostgresIdentifiers.quoteIdent;

/**
 * Renders a {@link RecordQuery} into a single SELECT.
 *
 * <p>The primary table is aliased by its record type, so key paths compile to
 * {@code "recordType"."column"}. Args follow placeholder order: select-list args, then WHERE args.</p>
 *
 * <p>When joins force DISTINCT, sort expressions are selected under {@link #SORT_COLUMN_PREFIX}
 * aliases and ordered by alias. A record count on a DISTINCT select wraps it in a subquery so the
 * count covers deduplicated rows.</p>
 */
public final class PostgresSelectRenderer {
  private static final Logger log = LoggerFactory.getLogger(PostgresSelectRenderer.class);

  /** Column carrying the overall record count when {@link RecordQuery#withCount()} is set. */
  public static final String RECORD_COUNT_COLUMN = "_record_count";

  /**
   * Prefix of the extra columns carrying ORDER BY expressions when the select is DISTINCT
   * ({@code _sort_0}, {@code _sort_1}, ...). They are not part of the returned schema.
   */
  public static final String SORT_COLUMN_PREFIX = "_sort_";

  static final String SUBQUERY_ALIAS = "_q";

  private final PostgresSettings settings;

  public PostgresSelectRenderer(PostgresSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public PostgresSelectRenderer() {
    this(PostgresSettings.load());
  }

  public PostgresSettings settings() { return settings; }

  public SelectStatement render(RecordQuery query, RecordSchema schema) {
    Objects.requireNonNull(query, "query");
    String table = query.recordType();
    if (table == null || table.isBlank()) throw new IllegalArgumentException("RecordQuery has no recordType");

    CompilerSession session = new CompilerSession(settings, table);

    List<SqlFragment> where = new ArrayList<>();
    if (query.predicate() != null) {
      where.add(session.compile(query.predicate()));
    }
    if (query.viewAsUser() != null && !query.bypassAccessControl()) {
      where.add(session.accessControl(query.viewAsUser(), AclLevel.READ));
    }
    SqlFragment filter = SqlFragment.join(" AND ", where);

    List<OrderTerm> sorts = new ArrayList<>();
    for (Sort s : query.sorts()) {
      sorts.add(session.compileOrderTerm(s));
    }

    CompilerSession.Output out = session.drain(schema);
    boolean distinct = out.joins().requiresDistinct();
    // count the deduplicated rows
    boolean wrapped = distinct && query.withCount();

    List<Object> args = new ArrayList<>();
    List<String> columns = selectColumns(table, out.schema(), args);
    List<String> orderBy = new ArrayList<>(sorts.size());
    for (int i = 0; i < sorts.size(); i++) {
      OrderTerm term = sorts.get(i);
      if (!distinct) {
        orderBy.add(term.sql());
        continue;
      }
      // SELECT DISTINCT only orders by selected columns
      String alias = SORT_COLUMN_PREFIX + i;
      columns.add(term.expression() + " AS " + quoteIdent(alias));
      orderBy.add(quoteIdent(alias) + " " + term.direction());
    }
    if (query.withCount() && !wrapped) columns.add(recordCountColumn(table));
    args.addAll(filter.args());

    StringBuilder sql = new StringBuilder();
    if (wrapped) {
      sql.append("SELECT ").append(quoteIdent(SUBQUERY_ALIAS)).append(".*, ")
          .append(recordCountColumn(SUBQUERY_ALIAS)).append(" FROM (");
    }
    sql.append("SELECT ");
    if (distinct) sql.append("DISTINCT ");
    sql.append(String.join(", ", columns));
    sql.append(" FROM ").append(settings.tableName(table)).append(" AS ").append(quoteIdent(table));
    for (String join : out.joins().clauses()) {
      sql.append(' ').append(join);
    }
    if (!filter.isEmpty()) sql.append(" WHERE ").append(filter.sql());
    if (wrapped) sql.append(") AS ").append(quoteIdent(SUBQUERY_ALIAS));
    if (!orderBy.isEmpty()) sql.append(" ORDER BY ").append(String.join(", ", orderBy));
    if (query.limit() != null) sql.append(" LIMIT ").append(query.limit());
    if (query.offset() > 0) sql.append(" OFFSET ").append(query.offset());

    SelectStatement stmt = new SelectStatement(sql.toString(), args, out.schema());
    debugSql(table, stmt, out.joins());
    return stmt;
  }

  /** Schema columns in order, or {@code "t".*} for an empty schema; computed column args go to {@code args}. */
  private static List<String> selectColumns(String table, RecordSchema schema, List<Object> args) {
    List<String> cols = new ArrayList<>();
    for (var e : schema.fields().entrySet()) {
      FieldType ft = e.getValue();
      if (!ft.isComputed()) {
        cols.add(qualified(table, e.getKey()));
        continue;
      }
      SqlFragment expr = new ExpressionCompiler(table).compile(ft.expression());
      cols.add(expr.sql() + " AS " + quoteIdent(e.getKey()));
      args.addAll(expr.args());
    }
    if (cols.isEmpty()) cols.add(quoteIdent(table) + ".*");
    return cols;
  }

  private static String recordCountColumn(String alias) {
    return new ExpressionCompiler(alias).compile(new FunctionCall(new CountFunc(true))).sql()
        + " AS " + quoteIdent(RECORD_COUNT_COLUMN);
  }

  private static void debugSql(String table, SelectStatement stmt, JoinClauses joins) {
    if (!log.isDebugEnabled()) return;
    log.debug("recordql.pq op=select table={} joins={} distinct={} argCount={} sql={}",
        table, joins.clauses().size(), joins.requiresDistinct(), stmt.args().size(), stmt.sql());

    // TRACE: arg types only, values may carry PII
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : stmt.args()) {
        log.trace("recordql.pq arg index={} valueType={} valueLen={}",
            idx++, v == null ? "null" : v.getClass().getName(),
            (v instanceof CharSequence cs) ? cs.length() : -1);
      }
    }
  }
}
