package io.intellixity.dslite.query;

import java.util.Objects;

/** Whole-phrase substring match. */
public record MatchPhraseClause(String field, String phrase) implements QueryClause {
  public MatchPhraseClause {
    Objects.requireNonNull(field, "field");
    phrase = (phrase == null) ? "" : phrase;
  }

  @Override
  public <R> R accept(ClauseVisitor<R> visitor) { return visitor.visitMatchPhrase(this); }
}
