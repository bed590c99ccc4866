package io.intellixity.dslite.query;

/** Non-null test. A null field is legal and never matches. */
public record ExistsClause(String field) implements QueryClause {
  @Override
  public <R> R accept(ClauseVisitor<R> visitor) { return visitor.visitExists(this); }
}
