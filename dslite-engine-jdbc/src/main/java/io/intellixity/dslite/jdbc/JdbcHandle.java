package io.intellixity.dslite.jdbc;

import io.intellixity.dslite.exec.handle.EngineHandle;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC-family engine handle (resolved by application code). */
public final class JdbcHandle implements EngineHandle<DataSource> {
  private final String id;
  private final DataSource client;

  public JdbcHandle(String id, DataSource client) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
}
