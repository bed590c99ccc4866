package io.intellixity.dslite.exec;

/**
 * The backend rejected a fully validated, fully bound statement.
 * <p>
 * Carries the SQL text that was attempted; bound values are never included.
 */
public final class QueryExecutionException extends RuntimeException {
  private final String failedSql;

  public QueryExecutionException(String message, Throwable cause, String failedSql) {
    super(message + (failedSql == null ? "" : " [sql=" + failedSql + "]"), cause);
    this.failedSql = failedSql;
  }

  public QueryExecutionException(String message, Throwable cause) {
    this(message, cause, null);
  }

  /** May be null for failures outside a single statement (e.g. commit). */
  public String failedSql() { return failedSql; }
}
