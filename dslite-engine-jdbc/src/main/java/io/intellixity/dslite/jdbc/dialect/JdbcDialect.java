package io.intellixity.dslite.jdbc.dialect;

import io.intellixity.dslite.jdbc.SqlStatement;
import io.intellixity.dslite.spi.sql.Dialect;

/** Dialect for JDBC engines. */
public interface JdbcDialect extends Dialect<SqlStatement> {
  /** Single-value query returning the row id of the last insert on the current connection. */
  String lastInsertIdSql();
}
