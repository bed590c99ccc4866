package io.intellixity.dslite.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded comparison: {@code {"range": {"<field>": {"gte": 18, "lt": 65}}}}.
 * <p>
 * Bounds keep their input order. Keys that are not {@link RangeOp} keys are retained but never compiled.
 */
public record RangeClause(String field, Map<String, Object> bounds) implements QueryClause {
  public RangeClause {
    Objects.requireNonNull(field, "field");
    bounds = (bounds == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(bounds));
  }

  @Override
  public <R> R accept(ClauseVisitor<R> visitor) { return visitor.visitRange(this); }
}
