package io.intellixity.dslite.exec;

import java.util.*;

/**
 * Outcome of a read (search / aggregate).
 * <p>
 * A failed read still reports {@link #rows()} as empty, but {@link #failed()} tells it apart from a query
 * that matched nothing.
 */
public final class QueryResult {
  private final List<Map<String, Object>> rows;
  private final QueryExecutionException failure;

  private QueryResult(List<Map<String, Object>> rows, QueryExecutionException failure) {
    this.rows = rows;
    this.failure = failure;
  }

  public static QueryResult ok(List<Map<String, Object>> rows) {
    return new QueryResult(Collections.unmodifiableList(new ArrayList<>(rows == null ? List.of() : rows)), null);
  }

  public static QueryResult failed(QueryExecutionException failure) {
    return new QueryResult(List.of(), Objects.requireNonNull(failure, "failure"));
  }

  public List<Map<String, Object>> rows() { return rows; }

  public boolean failed() { return failure != null; }

  public Optional<QueryExecutionException> failure() { return Optional.ofNullable(failure); }

  /** Returns the rows, or rethrows the execution failure. */
  public List<Map<String, Object>> orThrow() {
    if (failure != null) throw failure;
    return rows;
  }

  public int size() { return rows.size(); }

  @Override
  public String toString() {
    return failed() ? "QueryResult{failed=" + failure.getMessage() + "}" : "QueryResult{rows=" + rows.size() + "}";
  }
}
