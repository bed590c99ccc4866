package io.intellixity.dslite.jdbc.sqlite;

import io.intellixity.dslite.compile.Identifiers;
import io.intellixity.dslite.jdbc.SqlStatement;
import io.intellixity.dslite.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.dslite.jdbc.dialect.JdbcDialect;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SQLite dialect implementation for JDBC.
 *
 * Keeps only SQLite-specific overrides: backtick quoting, {@code ON CONFLICT} upsert, {@code last_insert_rowid()}.\n
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class SqliteDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  @Override public String id() { return "sqlite"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  public String lastInsertIdSql() {
    return "SELECT last_insert_rowid()";
  }

  @Override
  public SqlStatement renderUpsert(String table, Map<String, Object> row, List<String> conflictKeys) {
    List<String> columns = new ArrayList<>(row.keySet());
    SqlStatement ins = renderInsert(table, columns, row);

    Set<String> keys = new LinkedHashSet<>();
    for (String k : conflictKeys) keys.add(Identifiers.validate(k, "conflict key"));
    List<String> keySql = new ArrayList<>(keys.size());
    for (String k : keys) keySql.add(quoteIdent(k));

    List<String> sets = new ArrayList<>();
    for (String c : columns) {
      if (keys.contains(c)) continue;
      String q = quoteIdent(c);
      sets.add(q + " = excluded." + q);
    }
    String action = sets.isEmpty() ? "DO NOTHING" : "DO UPDATE SET " + String.join(", ", sets);
    String sql = ins.sql() + " ON CONFLICT(" + String.join(", ", keySql) + ") " + action;
    return new SqlStatement(sql, ins.params(), ins.execKind());
  }
}
