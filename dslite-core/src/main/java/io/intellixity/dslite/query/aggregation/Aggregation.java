package io.intellixity.dslite.query.aggregation;

import java.util.ArrayList;
import java.util.List;

public record Aggregation(List<String> groupBy, List<Metric> metrics) {
  public Aggregation {
    groupBy = (groupBy == null) ? List.of() : List.copyOf(groupBy);
    metrics = (metrics == null) ? List.of() : List.copyOf(metrics);
  }

  public static Aggregation groupBy(String... fields) {
    return new Aggregation(List.of(fields), List.of());
  }

  public Aggregation withMetric(Metric metric) {
    List<Metric> out = new ArrayList<>(metrics);
    out.add(metric);
    return new Aggregation(groupBy, out);
  }
}
