package io.intellixity.dslite.jdbc.sqlite;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * HikariCP pools over sqlite-jdbc.\n
 *
 * Each pooled connection gets a busy timeout (SQLite allows a single writer) and foreign key enforcement.\n
 */
public final class SqliteDataSources {
  private static final Logger log = LoggerFactory.getLogger(SqliteDataSources.class);

  public static final int DEFAULT_POOL_SIZE = 4;
  public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;

  private SqliteDataSources() {}

  /** Pool over a database file; the file is created on first connect. */
  public static HikariDataSource forFile(Path dbFile) {
    Objects.requireNonNull(dbFile, "dbFile");
    return open("jdbc:sqlite:" + dbFile.toAbsolutePath(), DEFAULT_POOL_SIZE);
  }

  /** Single-connection pool over a private in-memory database. */
  public static HikariDataSource inMemory() {
    return open("jdbc:sqlite::memory:", 1);
  }

  static boolean isInMemory(String jdbcUrl) {
    return jdbcUrl.contains(":memory:") || jdbcUrl.contains("mode=memory");
  }

  /** In-memory urls are capped at one connection. */
  public static HikariDataSource open(String jdbcUrl, int maxPoolSize) {
    if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:sqlite:")) {
      throw new IllegalArgumentException("Not a SQLite JDBC url: " + jdbcUrl);
    }
    if (maxPoolSize < 1) throw new IllegalArgumentException("maxPoolSize must be >= 1");

    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(jdbcUrl);
    if (isInMemory(jdbcUrl)) {
      // each in-memory connection is its own database: keep exactly one, and never retire it
      if (maxPoolSize > 1) log.warn("dslite.sqlite in-memory url={}; maxPoolSize {} reduced to 1", jdbcUrl, maxPoolSize);
      maxPoolSize = 1;
      hc.setMinimumIdle(1);
      hc.setMaxLifetime(0);
      hc.setIdleTimeout(0);
    }
    hc.setMaximumPoolSize(maxPoolSize);
    hc.setPoolName("dslite-sqlite");
    // forwarded to the driver as connection properties (sqlite-jdbc pragmas)
    hc.addDataSourceProperty("busy_timeout", String.valueOf(DEFAULT_BUSY_TIMEOUT_MS));
    hc.addDataSourceProperty("foreign_keys", "true");
    log.debug("dslite.sqlite pool url={} maxPoolSize={}", jdbcUrl, maxPoolSize);
    return new HikariDataSource(hc);
  }
}
