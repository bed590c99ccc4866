package io.intellixity.dslite.jdbc.compile;

import io.intellixity.dslite.query.QueryValidationException;
import io.intellixity.dslite.query.aggregation.Aggregation;
import io.intellixity.dslite.query.aggregation.Metric;
import io.intellixity.dslite.query.aggregation.MetricOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lowers {@code aggs} into a projection and a {@code GROUP BY} clause.\n
 *
 * Group keys lead the projection, followed by {@code SUM(`amount`) AS `total`} style metric columns.\n
 * Metrics with an unsupported operator are left out.\n
 */
public final class AggregationLowering {
  private static final Logger log = LoggerFactory.getLogger(AggregationLowering.class);

  public record Lowered(String projection, String groupBy) {}

  private final FieldRefLowering fields;

  public AggregationLowering(FieldRefLowering fields) {
    this.fields = Objects.requireNonNull(fields, "fields");
  }

  public Lowered lower(Aggregation aggs) {
    if (aggs == null) throw new QueryValidationException("Table and `aggs` block are required.");

    List<String> select = new ArrayList<>();
    List<String> keys = new ArrayList<>(aggs.groupBy().size());
    for (String f : aggs.groupBy()) keys.add(fields.lower(f));
    select.addAll(keys);

    for (Metric m : aggs.metrics()) {
      String alias = fields.quote(m.alias(), "metric alias");
      MetricOp op = m.metricOp();
      if (op == null) {
        log.debug("dslite aggregate metric dropped alias={} op={}", m.alias(), m.op());
        continue;
      }
      if (m.field() == null) {
        throw new QueryValidationException("Metric " + m.alias() + " requires a field");
      }
      select.add(op.name() + "(" + fields.lower(m.field()) + ") AS " + alias);
    }

    if (select.isEmpty()) {
      throw new QueryValidationException("Aggregation must define \"group_by\" or \"metrics\".");
    }
    String groupBy = keys.isEmpty() ? "" : "GROUP BY " + String.join(", ", keys);
    return new Lowered(String.join(", ", select), groupBy);
  }
}
