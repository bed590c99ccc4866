package io.intellixity.dslite.spi.sql;

import io.intellixity.dslite.query.QueryClause;
import io.intellixity.dslite.query.SearchRequest;
import io.intellixity.dslite.schema.IndexDef;
import io.intellixity.dslite.schema.TableDef;

import java.util.List;
import java.util.Map;

/**
 * Backend SPI: turns validated requests into native statements.
 * <p>
 * Every identifier passes the safe-identifier rule inside the dialect before it is quoted into statement
 * text; every value travels as a bound parameter.
 */
public interface Dialect<S extends NativeStatement> {
  String id();

  /** {@code size} and {@code from} are already defaulted by the engine. */
  S renderSearch(String table, SearchRequest request, int size, int from);

  S renderAggregate(String table, SearchRequest request);

  S renderInsert(String table, List<String> columns, Map<String, Object> row);

  S renderUpdate(String table, Map<String, Object> changes, QueryClause where);

  S renderDelete(String table, QueryClause where);

  S renderUpsert(String table, Map<String, Object> row, List<String> conflictKeys);

  S renderCreateTable(TableDef table);

  S renderDropTable(String table);

  S renderCreateIndex(IndexDef index);

  S renderDropIndex(String indexName);

  /** Name {@link #renderCreateIndex(IndexDef)} uses for {@code index}. */
  String indexName(IndexDef index);
}
