package io.intellixity.dslite.spi.exec;

import io.intellixity.dslite.exec.Propagation;
import io.intellixity.dslite.exec.QueryExecutionException;
import io.intellixity.dslite.exec.QueryResult;
import io.intellixity.dslite.exec.TxHandle;
import io.intellixity.dslite.exec.WriteResult;
import io.intellixity.dslite.exec.handle.EngineHandle;
import io.intellixity.dslite.query.QueryClause;
import io.intellixity.dslite.query.QueryValidationException;
import io.intellixity.dslite.query.SearchRequest;
import io.intellixity.dslite.schema.IndexDef;
import io.intellixity.dslite.schema.TableDef;
import io.intellixity.dslite.spi.sql.Dialect;
import io.intellixity.dslite.spi.sql.NativeStatement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractDataEngineTest {

  private record Stmt(String text) implements NativeStatement {}

  private static final class EchoDialect implements Dialect<Stmt> {
    @Override public String id() { return "echo"; }
    @Override public Stmt renderSearch(String table, SearchRequest request, int size, int from) {
      return new Stmt("search " + table + " size=" + size + " from=" + from);
    }
    @Override public Stmt renderAggregate(String table, SearchRequest request) { return new Stmt("aggregate " + table); }
    @Override public Stmt renderInsert(String table, List<String> columns, Map<String, Object> row) {
      return new Stmt("insert " + table + " " + columns + " " + row.get("fail"));
    }
    @Override public Stmt renderUpdate(String table, Map<String, Object> changes, QueryClause where) { return new Stmt("update " + table); }
    @Override public Stmt renderDelete(String table, QueryClause where) { return new Stmt("delete " + table); }
    @Override public Stmt renderUpsert(String table, Map<String, Object> row, List<String> conflictKeys) { return new Stmt("upsert " + table); }
    @Override public Stmt renderCreateTable(TableDef table) { return new Stmt("create " + table.name()); }
    @Override public Stmt renderDropTable(String table) { return new Stmt("drop " + table); }
    @Override public Stmt renderCreateIndex(IndexDef index) { return new Stmt("index " + indexName(index)); }
    @Override public Stmt renderDropIndex(String indexName) { return new Stmt("drop index " + indexName); }
    @Override public String indexName(IndexDef index) { return index.name() == null ? "idx_echo" : index.name(); }
  }

  private record NoopHandle() implements EngineHandle<Object> {
    @Override public String id() { return "noop"; }
    @Override public Object client() { return new Object(); }
  }

  private static final class RecordingEngine extends AbstractDataEngine<Stmt, NoopHandle> {
    final List<String> events = new ArrayList<>();
    boolean failReads;

    RecordingEngine(Propagation defaultPropagation) {
      super(new EchoDialect(), new NoopHandle(), defaultPropagation);
    }

    RecordingEngine(EngineOptions options) {
      super(new EchoDialect(), new NoopHandle(), Propagation.REQUIRED, options, null);
    }

    @Override protected TxHandle beginTx() { events.add("begin"); return new TxHandle() {}; }
    @Override protected void commitTx(TxHandle tx) { events.add("commit"); }
    @Override protected void rollbackTx(TxHandle tx) { events.add("rollback"); }

    @Override
    protected List<Map<String, Object>> executeQuery(TxHandle txOrNull, Stmt stmt) {
      events.add((txOrNull == null ? "" : "tx:") + stmt.text());
      if (failReads) throw new QueryExecutionException("Search query failed", new IllegalStateException("boom"), stmt.text());
      return List.of(Map.of("id", 1));
    }

    @Override
    protected WriteResult executeWrite(TxHandle txOrNull, Stmt stmt) {
      events.add((txOrNull == null ? "" : "tx:") + stmt.text());
      if (stmt.text().endsWith("true")) throw new QueryExecutionException("Insert query failed", new IllegalStateException("constraint"), stmt.text());
      return new WriteResult(1, 7L);
    }
  }

  @Test
  void inTxSupplier_usesEngineDefaultPropagation_requiredStartsTx() {
    RecordingEngine e = new RecordingEngine(Propagation.REQUIRED);
    assertEquals("ok", e.inTx(() -> "ok"));
    assertEquals(List.of("begin", "commit"), e.events);
  }

  @Test
  void inTxSupplier_usesEngineDefaultPropagation_supportsDoesNotStartTx() {
    RecordingEngine e = new RecordingEngine(Propagation.SUPPORTS);
    assertEquals("ok", e.inTx(() -> "ok"));
    assertTrue(e.events.isEmpty());
  }

  @Test
  void nestedRequiredJoinsTheOuterTransaction() {
    RecordingEngine e = new RecordingEngine(Propagation.REQUIRED);
    e.inTx(() -> e.insert("t", Map.of("a", 1)));
    assertEquals(List.of("begin", "tx:insert t [a] null", "commit"), e.events);
  }

  @Test
  void failureRollsBackAndRethrowsTheSameException() {
    RecordingEngine e = new RecordingEngine(Propagation.REQUIRED);
    QueryExecutionException ex = assertThrows(QueryExecutionException.class, () -> e.inTx(() -> {
      e.insert("t", Map.of("a", 1));
      return e.insert("t", Map.of("fail", true));
    }));
    assertEquals("Insert query failed", ex.getMessage().substring(0, "Insert query failed".length()));
    assertEquals("rollback", e.events.get(e.events.size() - 1));
    assertFalse(e.inTransaction());
  }

  @Test
  void mandatoryAndNeverGuardTheTransactionState() {
    RecordingEngine e = new RecordingEngine(Propagation.REQUIRED);
    assertThrows(IllegalStateException.class, () -> e.inTx(Propagation.MANDATORY, () -> "x"));
    assertThrows(IllegalStateException.class,
        () -> e.inTx(() -> e.inTx(Propagation.NEVER, () -> "x")));
  }

  @Test
  void manualTransactionIsReusedByWrites() {
    RecordingEngine e = new RecordingEngine(Propagation.REQUIRED);
    e.begin();
    assertTrue(e.inTransaction());
    e.insert("t", List.of(Map.of("a", 1), Map.of("a", 2)));
    e.commit();
    assertFalse(e.inTransaction());
    assertEquals(List.of("begin", "tx:insert t [a] null", "tx:insert t [a] null", "commit"), e.events);
  }

  @Test
  void manualTransactionMisuseIsRejected() {
    RecordingEngine e = new RecordingEngine(Propagation.REQUIRED);
    assertThrows(IllegalStateException.class, e::commit);
    assertThrows(IllegalStateException.class, e::rollback);
    e.begin();
    assertThrows(IllegalStateException.class, e::begin);
    e.rollback();
    assertEquals(List.of("begin", "rollback"), e.events);
  }

  @Test
  void insertSumsChangesAndKeepsLastId() {
    RecordingEngine e = new RecordingEngine(Propagation.REQUIRED);
    WriteResult r = e.insert("t", List.of(Map.of("a", 1), Map.of("a", 2), Map.of("a", 3)));
    assertEquals(3, r.changes());
    assertEquals(7L, r.lastInsertId());
  }

  @Test
  void emptyInsertDoesNotTouchTheBackend() {
    RecordingEngine e = new RecordingEngine(Propagation.REQUIRED);
    assertEquals(0, e.insert("t", List.of()).changes());
    assertTrue(e.events.isEmpty());
  }

  @Test
  void searchAppliesDefaultPageSize() {
    RecordingEngine e = new RecordingEngine(new EngineOptions(25));
    e.search("users", null);
    e.search("users", new SearchRequest().withSize(2).withFrom(4));
    assertEquals(List.of("search users size=25 from=0", "search users size=2 from=4"), e.events);
  }

  @Test
  void readFailureIsReportedNotThrown() {
    RecordingEngine e = new RecordingEngine(Propagation.REQUIRED);
    e.failReads = true;
    QueryResult r = e.search("users", new SearchRequest());
    assertTrue(r.failed());
    assertTrue(r.rows().isEmpty());
    assertEquals("search users size=10 from=0", r.failure().orElseThrow().failedSql());
  }

  @Test
  void readValidationFailureIsThrownBeforeRendering() {
    RecordingEngine e = new RecordingEngine(Propagation.REQUIRED);
    assertThrows(QueryValidationException.class, () -> e.search("users; --", new SearchRequest()));
    assertThrows(QueryValidationException.class, () -> e.aggregate("users", new SearchRequest()));
    assertTrue(e.events.isEmpty());
  }

  @Test
  void createIndexReturnsResolvedName() {
    RecordingEngine e = new RecordingEngine(Propagation.REQUIRED);
    assertEquals("idx_echo", e.createIndex(IndexDef.on("users", "email")));
    assertEquals("by_email", e.createIndex(IndexDef.on("users", "email").named("by_email")));
  }
}
