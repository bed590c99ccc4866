package io.intellixity.dslite.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * One node of a query clause tree.
 * <p>
 * The set of implementations is closed; backends dispatch through {@link ClauseVisitor} so that adding a
 * variant breaks every compiler until it handles it.
 */
@JsonDeserialize(using = ClauseJsonDeserializer.class)
public interface QueryClause {
  <R> R accept(ClauseVisitor<R> visitor);
}
