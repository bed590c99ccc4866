package io.intellixity.dslite.query;

import java.util.List;

/**
 * Boolean combinator.
 * <p>
 * {@code must} and {@code filter} are AND-ed as one group; {@code should} is OR-ed and only counts when that
 * group is empty; every {@code mustNot} child is negated and AND-ed separately.
 */
public record BoolClause(List<QueryClause> must,
                         List<QueryClause> filter,
                         List<QueryClause> should,
                         List<QueryClause> mustNot) implements QueryClause {
  public BoolClause {
    must = (must == null) ? List.of() : List.copyOf(must);
    filter = (filter == null) ? List.of() : List.copyOf(filter);
    should = (should == null) ? List.of() : List.copyOf(should);
    mustNot = (mustNot == null) ? List.of() : List.copyOf(mustNot);
  }

  public boolean isEmpty() {
    return must.isEmpty() && filter.isEmpty() && should.isEmpty() && mustNot.isEmpty();
  }

  @Override
  public <R> R accept(ClauseVisitor<R> visitor) { return visitor.visitBool(this); }
}
