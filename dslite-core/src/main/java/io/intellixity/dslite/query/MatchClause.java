package io.intellixity.dslite.query;

import java.util.Objects;

/** Tokenized substring match; every whitespace separated token must appear in the field. */
public record MatchClause(String field, String text) implements QueryClause {
  public MatchClause {
    Objects.requireNonNull(field, "field");
    text = (text == null) ? "" : text;
  }

  @Override
  public <R> R accept(ClauseVisitor<R> visitor) { return visitor.visitMatch(this); }
}
