package io.intellixity.dslite.jdbc.dialect;

import io.intellixity.dslite.compile.Identifiers;
import io.intellixity.dslite.jdbc.SqlStatement;
import io.intellixity.dslite.jdbc.SqlStatement.ExecKind;
import io.intellixity.dslite.jdbc.compile.*;
import io.intellixity.dslite.query.QueryClause;
import io.intellixity.dslite.query.QueryValidationException;
import io.intellixity.dslite.query.SearchRequest;
import io.intellixity.dslite.schema.IndexDef;
import io.intellixity.dslite.schema.TableDef;

import java.util.*;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Assembles:\n
 * - search: SELECT proj FROM t [joins] WHERE w [ORDER BY ..] LIMIT ? OFFSET ?\n
 * - aggregate: SELECT agg-proj FROM t [joins] WHERE w [GROUP BY ..] [ORDER BY ..] [LIMIT ?]\n
 * - DML and DDL from validated names and bound values\n
 *
 * Fragments are joined with single spaces; empty fragments are skipped.\n
 * DB-specific dialects override hooks for quoting, paging, and upsert syntax.\n
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  private final FieldRefLowering fields = new FieldRefLowering(this::quoteIdent);
  private final ClauseCompiler clauses = new ClauseCompiler(fields);
  private final JoinLowering joins = new JoinLowering(fields);
  private final ProjectionLowering projection = new ProjectionLowering(fields);
  private final SortLowering sorts = new SortLowering(fields);
  private final AggregationLowering aggregations = new AggregationLowering(fields);

  /** Quote an identifier that already passed {@link Identifiers#validate(String, String)}. */
  protected abstract String quoteIdent(String ident);


  @Override
  public final SqlStatement renderSearch(String table, SearchRequest request, int size, int from) {
    String tableSql = quoteTable(table);
    String joinSql = joins.lower(request.join());
    String selectSql = projection.lower(request.source());
    SqlFragment where = clauses.compile(request.query());
    String orderBy = sorts.lower(request.sort());

    List<Object> params = new ArrayList<>(where.params());
    String pageSql = applyOffsetPage(size, from, params);
    String sql = assemble("SELECT " + selectSql, "FROM " + tableSql, joinSql, "WHERE " + where.sql(), orderBy, pageSql);
    return new SqlStatement(sql, params, ExecKind.QUERY);
  }

  @Override
  public final SqlStatement renderAggregate(String table, SearchRequest request) {
    String tableSql = quoteTable(table);
    String joinSql = joins.lower(request.join());
    SqlFragment where = clauses.compile(request.query());
    AggregationLowering.Lowered agg = aggregations.lower(request.aggs());
    String orderBy = sorts.lower(request.sort());

    List<Object> params = new ArrayList<>(where.params());
    String limitSql = "";
    if (request.size() != null) limitSql = applyLimit(request.size(), params);
    String sql = assemble("SELECT " + agg.projection(), "FROM " + tableSql, joinSql, "WHERE " + where.sql(),
        agg.groupBy(), orderBy, limitSql);
    return new SqlStatement(sql, params, ExecKind.QUERY);
  }

  /** Default is {@code LIMIT ? OFFSET ?} with both values bound; dialects override. */
  protected String applyOffsetPage(int size, int from, List<Object> params) {
    params.add(size);
    params.add(from);
    return "LIMIT ? OFFSET ?";
  }

  protected String applyLimit(int size, List<Object> params) {
    params.add(size);
    return "LIMIT ?";
  }

  protected static String assemble(String... parts) {
    StringJoiner sj = new StringJoiner(" ");
    for (String p : parts) {
      if (p != null && !p.isEmpty()) sj.add(p);
    }
    return sj.toString();
  }

  protected final String quoteTable(String table) {
    return quoteIdent(Identifiers.validate(table, "table name"));
  }

  // --- DML ---

  @Override
  public SqlStatement renderInsert(String table, List<String> columns, Map<String, Object> row) {
    String tableSql = quoteTable(table);
    if (columns == null || columns.isEmpty()) throw new QueryValidationException("Insert has no columns");
    List<String> cols = new ArrayList<>(columns.size());
    List<String> ph = new ArrayList<>(columns.size());
    List<Object> params = new ArrayList<>(columns.size());
    for (String c : columns) {
      cols.add(quoteIdent(Identifiers.validate(c, "column name")));
      ph.add("?");
      // rows after the first are read by the first row's columns; a missing key binds NULL
      params.add(row.get(c));
    }
    String sql = "INSERT INTO " + tableSql + " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", ph) + ")";
    return new SqlStatement(sql, params, ExecKind.UPDATE_LAST_INSERT_ID);
  }

  @Override
  public SqlStatement renderUpdate(String table, Map<String, Object> changes, QueryClause where) {
    String tableSql = quoteTable(table);
    if (changes == null || changes.isEmpty()) throw new QueryValidationException("Update document (doc) is empty or invalid.");
    List<String> sets = new ArrayList<>(changes.size());
    List<Object> params = new ArrayList<>();
    for (Map.Entry<String, Object> e : changes.entrySet()) {
      sets.add(quoteIdent(Identifiers.validate(e.getKey(), "column name")) + " = ?");
      params.add(e.getValue());
    }
    SqlFragment w = clauses.compile(where);
    params.addAll(w.params());
    String sql = "UPDATE " + tableSql + " SET " + String.join(", ", sets) + " WHERE " + w.sql();
    return new SqlStatement(sql, params, ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderDelete(String table, QueryClause where) {
    String tableSql = quoteTable(table);
    SqlFragment w = clauses.compile(where);
    return new SqlStatement("DELETE FROM " + tableSql + " WHERE " + w.sql(), w.params(), ExecKind.UPDATE);
  }

  /** {@code INSERT ... ON CONFLICT}; syntax differs across databases. */
  @Override
  public abstract SqlStatement renderUpsert(String table, Map<String, Object> row, List<String> conflictKeys);

  // --- DDL ---

  @Override
  public SqlStatement renderCreateTable(TableDef table) {
    String tableSql = quoteTable(table.name());
    if (table.columns().isEmpty()) throw new QueryValidationException("Table and columns are required.");
    List<String> defs = new ArrayList<>(table.columns().size());
    for (Map.Entry<String, String> c : table.columns().entrySet()) {
      String col = quoteIdent(Identifiers.validate(c.getKey(), "column name"));
      defs.add(col + " " + validateTypeDef(c.getKey(), c.getValue()));
    }
    String sql = "CREATE TABLE IF NOT EXISTS " + tableSql + " (" + String.join(", ", defs) + ")";
    return new SqlStatement(sql, List.of(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderDropTable(String table) {
    return new SqlStatement("DROP TABLE IF EXISTS " + quoteTable(table), List.of(), ExecKind.UPDATE);
  }

  @Override
  public String indexName(IndexDef index) {
    if (index.name() != null) return index.name();
    String joined = String.join("_", index.fields())
        .replace("->>", "_")
        .replace("->", "_")
        .replace(".", "_")
        .replaceAll("\\s+", "");
    return "idx_" + index.table() + "_" + joined;
  }

  @Override
  public SqlStatement renderCreateIndex(IndexDef index) {
    String tableSql = quoteTable(index.table());
    if (index.fields().isEmpty()) throw new QueryValidationException("Table name and at least one field are required.");
    String name = quoteIdent(Identifiers.validate(indexName(index), "index name"));
    List<String> cols = new ArrayList<>(index.fields().size());
    for (String f : index.fields()) cols.add(fields.lower(f));
    String sql = assemble("CREATE", index.unique() ? "UNIQUE" : "", "INDEX IF NOT EXISTS", name,
        "ON", tableSql, "(" + String.join(", ", cols) + ")");
    return new SqlStatement(sql, List.of(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderDropIndex(String indexName) {
    String name = quoteIdent(Identifiers.validate(indexName, "index name"));
    return new SqlStatement("DROP INDEX IF EXISTS " + name, List.of(), ExecKind.UPDATE);
  }

  /**
   * Column type definitions (e.g. {@code TEXT NOT NULL}) are developer input, but they are still interpolated,
   * so they are limited to letters, digits, underscore, space, parentheses, comma and dot.
   */
  protected String validateTypeDef(String column, String typeDef) {
    if (typeDef == null || typeDef.isBlank()) {
      throw new QueryValidationException("Missing column definition for " + column);
    }
    for (int i = 0; i < typeDef.length(); i++) {
      char c = typeDef.charAt(i);
      boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
          || c == '_' || c == ' ' || c == '(' || c == ')' || c == ',' || c == '.';
      if (!ok) throw new QueryValidationException("Invalid characters detected in column definition for " + column + ": " + typeDef);
    }
    return typeDef.trim();
  }
}
