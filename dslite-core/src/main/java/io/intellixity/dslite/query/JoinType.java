package io.intellixity.dslite.query;

import java.util.Locale;

public enum JoinType {
  LEFT, INNER, RIGHT, FULL;

  /** Null or blank means {@link #LEFT}; unknown names are rejected. */
  public static JoinType parse(String raw) {
    if (raw == null || raw.isBlank()) return LEFT;
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Unsupported join type: " + raw, e);
    }
  }
}
