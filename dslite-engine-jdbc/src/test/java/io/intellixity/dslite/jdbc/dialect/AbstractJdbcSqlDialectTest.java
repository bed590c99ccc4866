package io.intellixity.dslite.jdbc.dialect;

import io.intellixity.dslite.jdbc.SqlStatement;
import io.intellixity.dslite.jdbc.SqlStatement.ExecKind;
import io.intellixity.dslite.query.*;
import io.intellixity.dslite.query.aggregation.Aggregation;
import io.intellixity.dslite.query.aggregation.Metric;
import io.intellixity.dslite.query.aggregation.MetricOp;
import io.intellixity.dslite.schema.IndexDef;
import io.intellixity.dslite.schema.TableDef;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.dslite.query.QueryClauses.*;
import static org.junit.jupiter.api.Assertions.*;

final class AbstractJdbcSqlDialectTest {
  /** Backtick quoting with no upsert support; enough to exercise the shared rendering. */
  static final class BacktickDialect extends AbstractJdbcSqlDialect {
    @Override public String id() { return "test"; }
    @Override protected String quoteIdent(String ident) { return "`" + ident + "`"; }
    @Override public String lastInsertIdSql() { return "SELECT 1"; }

    @Override
    public SqlStatement renderUpsert(String table, Map<String, Object> row, List<String> conflictKeys) {
      throw new UnsupportedOperationException("upsert");
    }
  }

  private final BacktickDialect dialect = new BacktickDialect();

  @Test
  void searchAppendsPagingParamsAfterWhereParams() {
    SearchRequest req = SearchRequest.of(term("status", "active")).withSort(SortField.desc("age"));
    SqlStatement s = dialect.renderSearch("users", req, 10, 20);
    assertEquals("SELECT * FROM `users` WHERE `status` = ? ORDER BY `age` DESC LIMIT ? OFFSET ?", s.sql());
    assertEquals(List.of("active", 10, 20), s.params());
    assertEquals(ExecKind.QUERY, s.execKind());
    assertEquals("SELECT", s.verb());
  }

  @Test
  void searchWithJoinsAndProjection() {
    SearchRequest req = SearchRequest.matchAll()
        .withSource("users.name", "orders.total as amount")
        .withJoin(JoinSpec.left("orders", "users.id", "orders.user_id"));
    SqlStatement s = dialect.renderSearch("users", req, 5, 0);
    assertEquals("SELECT `users`.`name`, `orders`.`total` AS `amount` FROM `users` "
        + "LEFT JOIN `orders` ON `users`.`id` = `orders`.`user_id` WHERE 1=1 LIMIT ? OFFSET ?", s.sql());
    assertEquals(List.of(5, 0), s.params());
  }

  @Test
  void tableNameIsValidatedBeforeAnythingElse() {
    InvalidIdentifierException e = assertThrows(InvalidIdentifierException.class,
        () -> dialect.renderSearch("users; DROP TABLE users", SearchRequest.matchAll(), 10, 0));
    assertEquals("table name", e.context());
  }

  @Test
  void aggregateWithOptionalLimit() {
    Aggregation aggs = Aggregation.groupBy("status").withMetric(Metric.of("total", MetricOp.SUM, "amount"));
    SearchRequest req = SearchRequest.of(range("amount", RangeOp.GT, 0)).withAggs(aggs)
        .withSort(SortField.desc("total"));
    SqlStatement s = dialect.renderAggregate("orders", req);
    assertEquals("SELECT `status`, SUM(`amount`) AS `total` FROM `orders` WHERE (`amount` > ?) "
        + "GROUP BY `status` ORDER BY `total` DESC", s.sql());
    assertEquals(List.of(0), s.params());

    SqlStatement limited = dialect.renderAggregate("orders", req.withSize(3).withFrom(9));
    assertTrue(limited.sql().endsWith("ORDER BY `total` DESC LIMIT ?"));
    assertEquals(List.of(0, 3), limited.params());
  }

  @Test
  void insertBindsByColumnOrder() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("age", 30);
    SqlStatement s = dialect.renderInsert("users", List.of("name", "age"), row);
    assertEquals("INSERT INTO `users` (`name`, `age`) VALUES (?, ?)", s.sql());
    assertEquals(Arrays.asList(null, 30), s.params());
    assertEquals(ExecKind.UPDATE_LAST_INSERT_ID, s.execKind());
  }

  @Test
  void updatePutsSetParamsBeforeWhereParams() {
    Map<String, Object> changes = new LinkedHashMap<>();
    changes.put("status", "inactive");
    changes.put("age", 31);
    SqlStatement s = dialect.renderUpdate("users", changes, term("id", 7));
    assertEquals("UPDATE `users` SET `status` = ?, `age` = ? WHERE `id` = ?", s.sql());
    assertEquals(List.of("inactive", 31, 7), s.params());
    assertThrows(InvalidIdentifierException.class,
        () -> dialect.renderUpdate("users", Map.of("age = 0, name", 1), null));
  }

  @Test
  void deleteWithoutWhereMatchesAll() {
    assertEquals("DELETE FROM `users` WHERE 1=1", dialect.renderDelete("users", null).sql());
  }

  @Test
  void createAndDropTable() {
    TableDef t = TableDef.of("users").column("id", "INTEGER PRIMARY KEY").column("name", "TEXT NOT NULL");
    assertEquals("CREATE TABLE IF NOT EXISTS `users` (`id` INTEGER PRIMARY KEY, `name` TEXT NOT NULL)",
        dialect.renderCreateTable(t).sql());
    assertEquals("DROP TABLE IF EXISTS `users`", dialect.renderDropTable("users").sql());
  }

  @Test
  void columnTypeDefinitionIsRestricted() {
    TableDef t = TableDef.of("users").column("id", "INTEGER); DROP TABLE users; --");
    assertThrows(QueryValidationException.class, () -> dialect.renderCreateTable(t));
    assertThrows(QueryValidationException.class,
        () -> dialect.renderCreateTable(TableDef.of("users").column("id", " ")));
    assertThrows(InvalidIdentifierException.class,
        () -> dialect.renderCreateTable(TableDef.of("bad-name").column("id", "INTEGER")));
  }

  @Test
  void indexNamesAndDdl() {
    IndexDef idx = IndexDef.on("users", "email");
    assertEquals("idx_users_email", dialect.indexName(idx));
    assertEquals("CREATE INDEX IF NOT EXISTS `idx_users_email` ON `users` (`email`)",
        dialect.renderCreateIndex(idx).sql());

    IndexDef json = IndexDef.on("users", "meta->>city", "users.age").asUnique();
    assertEquals("idx_users_meta_city_users_age", dialect.indexName(json));
    assertEquals("CREATE UNIQUE INDEX IF NOT EXISTS `idx_users_meta_city_users_age` ON `users` "
        + "(`meta` ->> '$.city', `users`.`age`)", dialect.renderCreateIndex(json).sql());

    assertEquals("by_email", dialect.indexName(idx.named("by_email")));
    assertEquals("DROP INDEX IF EXISTS `by_email`", dialect.renderDropIndex("by_email").sql());
    assertThrows(InvalidIdentifierException.class, () -> dialect.renderDropIndex("x; --"));
  }
}
