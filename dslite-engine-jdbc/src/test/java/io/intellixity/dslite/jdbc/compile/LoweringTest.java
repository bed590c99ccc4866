package io.intellixity.dslite.jdbc.compile;

import io.intellixity.dslite.query.*;
import io.intellixity.dslite.query.aggregation.Aggregation;
import io.intellixity.dslite.query.aggregation.Metric;
import io.intellixity.dslite.query.aggregation.MetricOp;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class LoweringTest {
  private final FieldRefLowering fields = new FieldRefLowering(id -> "`" + id + "`");

  @Test
  void joinsRenderInOrder() {
    JoinLowering joins = new JoinLowering(fields);
    String sql = joins.lower(List.of(
        JoinSpec.left("orders", "users.id", "orders.user_id"),
        new JoinSpec(JoinType.INNER, "items", new JoinSpec.On("orders.id", "items.order_id", "="))));
    assertEquals("LEFT JOIN `orders` ON `users`.`id` = `orders`.`user_id` "
        + "INNER JOIN `items` ON `orders`.`id` = `items`.`order_id`", sql);
    assertEquals("", joins.lower(List.of()));
  }

  @Test
  void joinWithoutOnIsRejected() {
    JoinLowering joins = new JoinLowering(fields);
    QueryValidationException e = assertThrows(QueryValidationException.class,
        () -> joins.lower(List.of(new JoinSpec(JoinType.LEFT, "orders", null))));
    assertEquals("Invalid JOIN definition for target orders: 'on' clause is missing.", e.getMessage());
  }

  @Test
  void joinOperatorIsWhitelisted() {
    JoinLowering joins = new JoinLowering(fields);
    assertThrows(QueryValidationException.class, () -> joins.lower(List.of(
        new JoinSpec(JoinType.LEFT, "orders", new JoinSpec.On("a", "b", "= 1 OR 1 =")))));
    assertThrows(InvalidIdentifierException.class, () -> joins.lower(List.of(
        JoinSpec.left("orders o", "a", "b"))));
  }

  @Test
  void projectionWithAliases() {
    ProjectionLowering p = new ProjectionLowering(fields);
    assertEquals("*", p.lower(List.of()));
    assertEquals("`users`.`name` AS `user_name`, `age`", p.lower(List.of("users.name as user_name", "age")));
    assertEquals("`meta` ->> '$.city' AS `city`", p.lower(List.of("meta->>city AS city")));
    assertThrows(InvalidIdentifierException.class, () -> p.lower(List.of("name as x y")));
  }

  @Test
  void sortClause() {
    SortLowering s = new SortLowering(fields);
    assertEquals("", s.lower(null));
    assertEquals("ORDER BY `age` DESC, `name` ASC", s.lower(List.of(SortField.desc("age"), SortField.asc("name"))));
  }

  @Test
  void aggregationProjectionAndGroupBy() {
    AggregationLowering a = new AggregationLowering(fields);
    Aggregation aggs = Aggregation.groupBy("status")
        .withMetric(Metric.count("n"))
        .withMetric(Metric.of("total", MetricOp.SUM, "amount"));
    AggregationLowering.Lowered out = a.lower(aggs);
    assertEquals("`status`, COUNT(*) AS `n`, SUM(`amount`) AS `total`", out.projection());
    assertEquals("GROUP BY `status`", out.groupBy());
  }

  @Test
  void unsupportedMetricsAreDropped() {
    AggregationLowering a = new AggregationLowering(fields);
    Aggregation aggs = Aggregation.groupBy("status").withMetric(new Metric("p", "median", "amount"));
    assertEquals("`status`", a.lower(aggs).projection());

    Aggregation onlyBad = new Aggregation(List.of(), List.of(new Metric("p", "median", "amount")));
    QueryValidationException e = assertThrows(QueryValidationException.class, () -> a.lower(onlyBad));
    assertEquals("Aggregation must define \"group_by\" or \"metrics\".", e.getMessage());
  }

  @Test
  void metricAliasIsValidated() {
    AggregationLowering a = new AggregationLowering(fields);
    Aggregation aggs = new Aggregation(List.of(), List.of(Metric.of("x) FROM users --", MetricOp.SUM, "amount")));
    assertThrows(InvalidIdentifierException.class, () -> a.lower(aggs));
  }
}
