package io.intellixity.dslite.jdbc.sqlite;

import io.intellixity.dslite.exec.Propagation;
import io.intellixity.dslite.jdbc.JdbcDataEngine;
import io.intellixity.dslite.jdbc.JdbcHandle;
import io.intellixity.dslite.spi.exec.EngineOptions;

import javax.sql.DataSource;

/** Wires a {@link JdbcDataEngine} with the {@link SqliteDialect}. */
public final class SqliteEngines {
  private SqliteEngines() {}

  public static JdbcDataEngine create(DataSource ds) {
    return create("sqlite", ds, EngineOptions.defaults());
  }

  public static JdbcDataEngine create(String handleId, DataSource ds, EngineOptions options) {
    JdbcHandle handle = new JdbcHandle(handleId, ds);
    return new JdbcDataEngine(handle, new SqliteDialect(), Propagation.REQUIRED, options, null, null);
  }
}
