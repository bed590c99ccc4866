package io.intellixity.dslite.query;

/** A clause object without any recognized tag. Compiles to always-true. */
public record UnknownClause(String tag) implements QueryClause {
  @Override
  public <R> R accept(ClauseVisitor<R> visitor) { return visitor.visitUnknown(this); }
}
