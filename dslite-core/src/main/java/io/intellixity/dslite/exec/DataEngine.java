package io.intellixity.dslite.exec;

import io.intellixity.dslite.exec.handle.EngineHandle;
import io.intellixity.dslite.query.QueryClause;
import io.intellixity.dslite.query.SearchRequest;
import io.intellixity.dslite.schema.IndexDef;
import io.intellixity.dslite.schema.TableDef;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

public interface DataEngine<H extends EngineHandle<?>> {
  /** Returns the engine handle used by this instance. */
  H handle();

  /** Default transaction propagation for this engine instance (used by {@link #inTx(Supplier)}). */
  Propagation defaultPropagation();

  /** Run work within a transaction boundary using the given propagation behavior. */
  <T> T inTx(Propagation propagation, Supplier<T> work);

  /** Run work using this engine instance's {@link #defaultPropagation()}.\n */
  default <T> T inTx(Supplier<T> work) {
    return inTx(defaultPropagation(), work);
  }

  /** Open a transaction bound to the calling thread until {@link #commit()} or {@link #rollback()}. */
  void begin();

  void commit();

  void rollback();

  /** True while the calling thread holds a transaction of this engine. */
  boolean inTransaction();

  /**
   * Paged search. Execution failures are reported through {@link QueryResult#failed()}, validation failures
   * are thrown.
   */
  QueryResult search(String table, SearchRequest request);

  /** GROUP BY query; {@code request.aggs()} is required. */
  QueryResult aggregate(String table, SearchRequest request);

  /** Insert rows; columns are taken from the first row. Runs in one transaction. */
  WriteResult insert(String table, List<Map<String, Object>> rows);

  default WriteResult insert(String table, Map<String, Object> row) {
    return insert(table, List.of(row));
  }

  /** Set {@code changes} on every row matching {@code where}; a null clause matches all rows. */
  WriteResult update(String table, Map<String, Object> changes, QueryClause where);

  /** Delete rows matching {@code where}; a null clause matches all rows. */
  WriteResult delete(String table, QueryClause where);

  /** Insert, or update the non-key columns when a row with the same conflict keys exists. */
  WriteResult upsert(String table, Map<String, Object> row, List<String> conflictKeys);

  void createTable(TableDef table);

  void dropTable(String table);

  /** Returns the index name actually used. */
  String createIndex(IndexDef index);

  void dropIndex(String indexName);
}
