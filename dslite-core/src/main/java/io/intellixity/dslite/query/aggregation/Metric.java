package io.intellixity.dslite.query.aggregation;

/**
 * One aggregate output column: {@code "<alias>": {"<op>": "<field>"}}.
 * <p>
 * {@code op} stays the raw key so unsupported operators can be skipped rather than rejected.
 */
public record Metric(String alias, String op, String field) {
  public static Metric of(String alias, MetricOp op, String field) {
    return new Metric(alias, op.key(), field);
  }

  public static Metric count(String alias) { return of(alias, MetricOp.COUNT, "*"); }

  /** Null when {@link #op()} is not a supported operator. */
  public MetricOp metricOp() { return MetricOp.fromKey(op); }
}
