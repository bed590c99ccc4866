package io.intellixity.dslite.spi.exec;

import io.intellixity.dslite.exec.DataEngine;
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
import io.intellixity.dslite.spi.exec.QueryValidationStrategy.Operation;
import io.intellixity.dslite.spi.sql.Dialect;
import io.intellixity.dslite.spi.sql.NativeStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Template-method orchestrator for DSL operations.\n
 *
 * Responsibilities:\n
 * - Transaction scoping via {@link #inTx(Propagation, Supplier)} and the manual begin/commit/rollback\n
 * - Request validation via {@link QueryValidationStrategy}\n
 * - Build native statements using {@link Dialect}\n
 * - Delegate execution to backend-specific hooks\n
 *
 * Reads never open a transaction; writes and DDL run under {@link #defaultWritePropagation()}.\n
 */
public abstract class AbstractDataEngine<S extends NativeStatement, H extends EngineHandle<?>> implements DataEngine<H> {
  private static final Logger log = LoggerFactory.getLogger(AbstractDataEngine.class);

  private final H handle;
  private final Dialect<S> dialect;
  private final Propagation defaultPropagation;
  private final EngineOptions options;
  private final QueryValidationStrategy queryValidation;
  /**
   * Engine-scoped transaction slot.\n
   *
   * One slot per engine instance, so two engines used on the same thread never share a transaction.\n
   */
  private final ThreadLocal<TxHandle> tx = new ThreadLocal<>();

  protected AbstractDataEngine(Dialect<S> dialect,
                               H handle,
                               Propagation defaultPropagation,
                               EngineOptions options,
                               QueryValidationStrategy queryValidation) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.defaultPropagation = (defaultPropagation == null) ? Propagation.REQUIRED : defaultPropagation;
    this.options = (options == null) ? EngineOptions.defaults() : options;
    this.queryValidation = (queryValidation == null) ? new DefaultQueryValidationStrategy() : queryValidation;
  }

  protected AbstractDataEngine(Dialect<S> dialect, H handle, Propagation defaultPropagation) {
    this(dialect, handle, defaultPropagation, EngineOptions.defaults(), new DefaultQueryValidationStrategy());
  }

  /** Backend-specific transaction begin. */
  protected abstract TxHandle beginTx();

  /** Backend-specific transaction commit (paired with {@link #beginTx()}). */
  protected abstract void commitTx(TxHandle tx);

  /** Backend-specific transaction rollback (paired with {@link #beginTx()}). */
  protected abstract void rollbackTx(TxHandle tx);

  /** Run a row-returning statement. Throws {@link QueryExecutionException} on backend failure. */
  protected abstract List<Map<String, Object>> executeQuery(TxHandle txOrNull, S stmt);

  /** Run a row-changing statement (DML or DDL). Throws {@link QueryExecutionException} on backend failure. */
  protected abstract WriteResult executeWrite(TxHandle txOrNull, S stmt);

  @Override
  public final Propagation defaultPropagation() {
    return defaultPropagation;
  }

  /**
   * Propagation used by write operations when the caller did not wrap the work in
   * {@link DataEngine#inTx(Propagation, Supplier)}.
   */
  protected Propagation defaultWritePropagation() { return defaultPropagation; }

  protected final TxHandle currentTxOrNull() {
    return tx.get();
  }

  @Override
  public final boolean inTransaction() {
    return tx.get() != null;
  }

  @Override
  public final <T> T inTx(Propagation propagation, Supplier<T> work) {
    Objects.requireNonNull(propagation, "propagation");
    Objects.requireNonNull(work, "work");
    TxHandle existing = currentTxOrNull();
    return switch (propagation) {
      case REQUIRED -> (existing != null) ? work.get() : runInNewTx(work);
      case SUPPORTS -> work.get();
      case MANDATORY -> {
        if (existing == null) throw new IllegalStateException("No existing transaction for propagation=MANDATORY");
        yield work.get();
      }
      case NEVER -> {
        if (existing != null) throw new IllegalStateException("Existing transaction found for propagation=NEVER");
        yield work.get();
      }
    };
  }

  private <T> T runInNewTx(Supplier<T> work) {
    TxHandle t = beginTx();
    tx.set(t);
    try {
      T result = work.get();
      commitTx(t);
      return result;
    } catch (RuntimeException | Error e) {
      rollbackQuietly(t, e);
      throw e;
    } finally {
      tx.remove();
    }
  }

  private void rollbackQuietly(TxHandle t, Throwable primary) {
    try {
      rollbackTx(t);
    } catch (RuntimeException rollbackFailure) {
      primary.addSuppressed(rollbackFailure);
    }
  }

  @Override
  public final void begin() {
    if (currentTxOrNull() != null) throw new IllegalStateException("A transaction is already active on this thread");
    tx.set(beginTx());
  }

  @Override
  public final void commit() {
    TxHandle t = requireManualTx("commit");
    try {
      commitTx(t);
    } finally {
      tx.remove();
    }
  }

  @Override
  public final void rollback() {
    TxHandle t = requireManualTx("rollback");
    try {
      rollbackTx(t);
    } finally {
      tx.remove();
    }
  }

  private TxHandle requireManualTx(String op) {
    TxHandle t = currentTxOrNull();
    if (t == null) throw new IllegalStateException("No active transaction to " + op);
    return t;
  }

  protected final Dialect<S> dialect() { return dialect; }
  @Override
  public final H handle() { return handle; }
  protected final EngineOptions options() { return options; }
  protected QueryValidationStrategy queryValidation() { return queryValidation; }

  // --- Reads (no auto-tx creation; execution failures become QueryResult.failed) ---

  @Override
  public final QueryResult search(String table, SearchRequest request) {
    SearchRequest effective = (request == null) ? SearchRequest.matchAll() : request;
    queryValidation().validate(Operation.SEARCH, table, effective);
    int size = (effective.size() == null) ? options.defaultPageSize() : effective.size();
    int from = (effective.from() == null) ? 0 : effective.from();
    S stmt = dialect.renderSearch(table, effective, size, from);
    return read("search", table, stmt);
  }

  @Override
  public final QueryResult aggregate(String table, SearchRequest request) {
    if (request == null) throw new QueryValidationException("Table and `aggs` block are required.");
    queryValidation().validate(Operation.AGGREGATE, table, request);
    S stmt = dialect.renderAggregate(table, request);
    return read("aggregate", table, stmt);
  }

  private QueryResult read(String op, String table, S stmt) {
    try {
      return QueryResult.ok(executeQuery(currentTxOrNull(), stmt));
    } catch (QueryExecutionException e) {
      log.error("dslite {} failed table={} sql={}", op, table, e.failedSql(), e);
      return QueryResult.failed(e);
    }
  }

  // --- Writes (auto-tx creation; execution failures propagate) ---

  @Override
  public final WriteResult insert(String table, List<Map<String, Object>> rows) {
    if (table == null || rows == null) throw new QueryValidationException("Table and data are required for insert.");
    if (rows.isEmpty()) return WriteResult.of(0);
    Map<String, Object> first = rows.get(0);
    if (first == null || first.isEmpty()) throw new QueryValidationException("Insert rows must not be empty.");
    List<String> columns = List.copyOf(first.keySet());

    List<S> stmts = new ArrayList<>(rows.size());
    for (Map<String, Object> row : rows) {
      if (row == null) throw new QueryValidationException("Insert rows must not be null.");
      stmts.add(dialect.renderInsert(table, columns, row));
    }

    return inTx(defaultWritePropagation(), () -> {
      long changes = 0;
      Long lastId = null;
      for (S stmt : stmts) {
        WriteResult r = executeWrite(currentTxOrNull(), stmt);
        changes += r.changes();
        if (r.lastInsertId() != null) lastId = r.lastInsertId();
      }
      return new WriteResult(changes, lastId);
    });
  }

  @Override
  public final WriteResult update(String table, Map<String, Object> changes, QueryClause where) {
    if (table == null || changes == null || changes.isEmpty()) {
      throw new QueryValidationException("Table and a non-empty change set are required for update.");
    }
    S stmt = dialect.renderUpdate(table, changes, where);
    return inTx(defaultWritePropagation(), () -> executeWrite(currentTxOrNull(), stmt));
  }

  @Override
  public final WriteResult delete(String table, QueryClause where) {
    if (table == null) throw new QueryValidationException("Table is required for delete.");
    S stmt = dialect.renderDelete(table, where);
    return inTx(defaultWritePropagation(), () -> executeWrite(currentTxOrNull(), stmt));
  }

  @Override
  public final WriteResult upsert(String table, Map<String, Object> row, List<String> conflictKeys) {
    if (table == null || row == null || row.isEmpty() || conflictKeys == null || conflictKeys.isEmpty()) {
      throw new QueryValidationException("Table, doc, and conflictKey are required for upsert.");
    }
    S stmt = dialect.renderUpsert(table, row, conflictKeys);
    return inTx(defaultWritePropagation(), () -> executeWrite(currentTxOrNull(), stmt));
  }

  // --- Schema ---

  @Override
  public final void createTable(TableDef table) {
    if (table == null || table.name() == null || table.columns().isEmpty()) {
      throw new QueryValidationException("Table and columns are required.");
    }
    S stmt = dialect.renderCreateTable(table);
    inTx(defaultWritePropagation(), () -> executeWrite(currentTxOrNull(), stmt));
  }

  @Override
  public final void dropTable(String table) {
    if (table == null) throw new QueryValidationException("Table name is required for drop.");
    S stmt = dialect.renderDropTable(table);
    inTx(defaultWritePropagation(), () -> executeWrite(currentTxOrNull(), stmt));
  }

  @Override
  public final String createIndex(IndexDef index) {
    if (index == null || index.table() == null || index.fields().isEmpty()) {
      throw new QueryValidationException("Table name and at least one field are required.");
    }
    S stmt = dialect.renderCreateIndex(index);
    inTx(defaultWritePropagation(), () -> executeWrite(currentTxOrNull(), stmt));
    return dialect.indexName(index);
  }

  @Override
  public final void dropIndex(String indexName) {
    if (indexName == null) throw new QueryValidationException("Index name is required for dropIndex.");
    S stmt = dialect.renderDropIndex(indexName);
    inTx(defaultWritePropagation(), () -> executeWrite(currentTxOrNull(), stmt));
  }
}
