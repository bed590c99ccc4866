package io.intellixity.dslite.exec.handle;

/**
 * Resolved runtime handle for a backend.\n
 *
 * For JDBC, client() is the javax.sql.DataSource.\n
 */
public interface EngineHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  /** Native client used by an engine. */
  TClient client();
}
