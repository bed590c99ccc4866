package io.intellixity.dslite.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Set membership: {@code {"terms": {"<field>": [v1, v2]}}}. An empty list never matches. */
public record TermsClause(String field, List<Object> values) implements QueryClause {
  public TermsClause {
    Objects.requireNonNull(field, "field");
    // values may contain nulls, so List.copyOf is not an option
    values = (values == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
  }

  @Override
  public <R> R accept(ClauseVisitor<R> visitor) { return visitor.visitTerms(this); }
}
