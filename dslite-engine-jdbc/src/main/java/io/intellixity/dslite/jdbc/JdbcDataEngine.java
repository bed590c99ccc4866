package io.intellixity.dslite.jdbc;

import io.intellixity.dslite.exec.Propagation;
import io.intellixity.dslite.exec.QueryExecutionException;
import io.intellixity.dslite.exec.TxHandle;
import io.intellixity.dslite.exec.WriteResult;
import io.intellixity.dslite.jdbc.bind.DefaultJdbcBinder;
import io.intellixity.dslite.jdbc.bind.JdbcBinder;
import io.intellixity.dslite.jdbc.dialect.JdbcDialect;
import io.intellixity.dslite.spi.exec.AbstractDataEngine;
import io.intellixity.dslite.spi.exec.EngineOptions;
import io.intellixity.dslite.spi.exec.QueryValidationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;

public final class JdbcDataEngine extends AbstractDataEngine<SqlStatement, JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcDataEngine.class);
  private final DataSource ds;
  private final JdbcDialect dialect;
  private final JdbcBinder binder;

  public JdbcDataEngine(JdbcHandle handle,
                        JdbcDialect dialect,
                        Propagation defaultPropagation,
                        EngineOptions options,
                        QueryValidationStrategy queryValidation,
                        JdbcBinder binder) {
    super(dialect, Objects.requireNonNull(handle, "handle"), defaultPropagation, options, queryValidation);
    this.ds = handle.client();
    this.dialect = dialect;
    this.binder = (binder == null) ? new DefaultJdbcBinder() : binder;
  }

  public JdbcDataEngine(JdbcHandle handle, JdbcDialect dialect, Propagation defaultPropagation) {
    this(handle, dialect, defaultPropagation, EngineOptions.defaults(), null, null);
  }

  /** Convenience constructor: wraps the raw DataSource into a handle. */
  public JdbcDataEngine(DataSource ds, JdbcDialect dialect) {
    this(new JdbcHandle(dialect.id(), ds), dialect, Propagation.REQUIRED);
  }

  @Override
  protected TxHandle beginTx() {
    try {
      Connection c = ds.getConnection();
      try {
        c.setAutoCommit(false);
      } catch (SQLException e) {
        try {
          c.close();
        } catch (SQLException closeFailure) {
          e.addSuppressed(closeFailure);
        }
        throw e;
      }
      log.debug("dslite.jdbc tx=BEGIN handleId={}", handle().id());
      return new JdbcTxHandle(c);
    } catch (SQLException e) {
      throw new QueryExecutionException("BEGIN transaction failed", e);
    }
  }

  @Override
  protected void commitTx(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try (Connection c = j.conn()) {
      c.commit();
      log.debug("dslite.jdbc tx=COMMIT handleId={}", handle().id());
    } catch (SQLException e) {
      throw new QueryExecutionException("COMMIT transaction failed", e);
    }
  }

  @Override
  protected void rollbackTx(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try (Connection c = j.conn()) {
      c.rollback();
      log.debug("dslite.jdbc tx=ROLLBACK handleId={}", handle().id());
    } catch (SQLException e) {
      throw new QueryExecutionException("ROLLBACK transaction failed", e);
    }
  }

  @Override
  protected List<Map<String, Object>> executeQuery(TxHandle txOrNull, SqlStatement ss) {
    try {
      Connection c = (txOrNull == null) ? ds.getConnection() : ((JdbcTxHandle) txOrNull).conn();
      try {
        long start = System.nanoTime();
        debugSql(ss);
        try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
          bindAll(ps, ss);
          try (ResultSet rs = ps.executeQuery()) {
            List<Map<String, Object>> out = JdbcRowReader.readAll(rs);
            debugDone(ss, out.size(), System.nanoTime() - start);
            return out;
          }
        }
      } finally {
        if (txOrNull == null) c.close();
      }
    } catch (SQLException e) {
      throw new QueryExecutionException(ss.verb() + " statement failed", e, ss.sql());
    }
  }

  @Override
  protected WriteResult executeWrite(TxHandle txOrNull, SqlStatement ss) {
    try {
      Connection c = (txOrNull == null) ? ds.getConnection() : ((JdbcTxHandle) txOrNull).conn();
      try {
        long start = System.nanoTime();
        debugSql(ss);
        return switch (ss.execKind()) {
          case UPDATE -> {
            try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
              bindAll(ps, ss);
              long n = ps.executeUpdate();
              debugDone(ss, n, System.nanoTime() - start);
              yield WriteResult.of(n);
            }
          }
          case UPDATE_LAST_INSERT_ID -> {
            long n;
            try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
              bindAll(ps, ss);
              n = ps.executeUpdate();
            }
            Long id = lastInsertId(c);
            debugDone(ss, n, System.nanoTime() - start);
            yield new WriteResult(n, id);
          }
          case QUERY -> throw new IllegalArgumentException("Invalid execKind=QUERY for a write; use UPDATE/UPDATE_LAST_INSERT_ID");
        };
      } finally {
        if (txOrNull == null) c.close();
      }
    } catch (SQLException e) {
      throw new QueryExecutionException(ss.verb() + " statement failed", e, ss.sql());
    }
  }

  /** Must run on the connection that executed the insert. */
  private Long lastInsertId(Connection c) throws SQLException {
    try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery(dialect.lastInsertIdSql())) {
      if (!rs.next()) return null;
      long v = rs.getLong(1);
      return rs.wasNull() ? null : v;
    }
  }

  public record JdbcTxHandle(Connection conn) implements TxHandle {}

  private void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    List<Object> params = ss.params();
    for (int i = 0; i < params.size(); i++) {
      binder.bind(ps, i + 1, params.get(i));
    }
  }

  private void debugSql(SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    JdbcHandle h = handle();
    log.debug("dslite.jdbc op={} execKind={} paramCount={} handleId={} sql={}",
        ss.verb(), ss.execKind(), ss.params().size(), h.id(), ss.sql());

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled() && !ss.params().isEmpty()) {
      int idx = 1;
      for (Object v : ss.params()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("dslite.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(SqlStatement ss, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("dslite.jdbc_done op={} execKind={} durationMs={} result={}",
        ss.verb(), ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}
