package io.intellixity.dslite.query;

import java.util.Objects;

/** Equality: {@code {"term": {"<field>": <value>}}}. */
public record TermClause(String field, Object value) implements QueryClause {
  public TermClause {
    Objects.requireNonNull(field, "field");
  }

  @Override
  public <R> R accept(ClauseVisitor<R> visitor) { return visitor.visitTerm(this); }
}
