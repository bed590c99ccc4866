package io.intellixity.dslite.query.aggregation;

import java.util.Locale;

public enum MetricOp {
  SUM, AVG, COUNT, MIN, MAX;

  /** Case-sensitive lookup of the lower-case DSL key; null when unsupported. */
  public static MetricOp fromKey(String key) {
    if (key == null) return null;
    for (MetricOp op : values()) {
      if (op.key().equals(key)) return op;
    }
    return null;
  }

  public String key() { return name().toLowerCase(Locale.ROOT); }
}
