package io.intellixity.dslite.query;

import java.util.Locale;
import java.util.Objects;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  public enum Direction {
    ASC, DESC;

    /** Anything other than "desc" (any case) sorts ascending. */
    public static Direction lenient(String raw) {
      if (raw == null) return ASC;
      return "DESC".equals(raw.trim().toUpperCase(Locale.ROOT)) ? DESC : ASC;
    }
  }
}
