package io.intellixity.dslite.query;

import java.util.Locale;

public enum RangeOp {
  GT(">"),
  GTE(">="),
  LT("<"),
  LTE("<=");

  private final String symbol;

  RangeOp(String symbol) { this.symbol = symbol; }

  public String symbol() { return symbol; }

  /** Returns the operator for a range key such as {@code "gte"}, or null when the key is not a range operator. Keys are case-sensitive. */
  public static RangeOp fromKey(String key) {
    if (key == null) return null;
    return switch (key) {
      case "gt" -> GT;
      case "gte" -> GTE;
      case "lt" -> LT;
      case "lte" -> LTE;
      default -> null;
    };
  }

  public String key() { return name().toLowerCase(Locale.ROOT); }
}
