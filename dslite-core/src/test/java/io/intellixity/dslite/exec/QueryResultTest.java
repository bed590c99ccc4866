package io.intellixity.dslite.exec;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QueryResultTest {
  @Test
  void emptySuccessIsNotAFailure() {
    QueryResult r = QueryResult.ok(List.of());
    assertFalse(r.failed());
    assertTrue(r.rows().isEmpty());
    assertTrue(r.orThrow().isEmpty());
  }

  @Test
  void failureKeepsSqlAndRethrowsOnDemand() {
    var cause = new SQLException("no such table: nope");
    QueryResult r = QueryResult.failed(new QueryExecutionException("Search query failed", cause, "SELECT * FROM `nope`"));
    assertTrue(r.failed());
    assertTrue(r.rows().isEmpty());
    QueryExecutionException ex = assertThrows(QueryExecutionException.class, r::orThrow);
    assertEquals("SELECT * FROM `nope`", ex.failedSql());
    assertSame(cause, ex.getCause());
  }

  @Test
  void rowsAreImmutable() {
    QueryResult r = QueryResult.ok(List.of(Map.of("id", 1)));
    assertThrows(UnsupportedOperationException.class, () -> r.rows().add(Map.of()));
  }
}
