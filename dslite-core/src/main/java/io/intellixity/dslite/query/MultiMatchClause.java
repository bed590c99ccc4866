package io.intellixity.dslite.query;

import java.util.List;

/** Match the same text against several fields; any field may match. */
public record MultiMatchClause(String text, List<String> fields) implements QueryClause {
  public MultiMatchClause {
    text = (text == null) ? "" : text;
    fields = (fields == null) ? List.of() : List.copyOf(fields);
  }

  @Override
  public <R> R accept(ClauseVisitor<R> visitor) { return visitor.visitMultiMatch(this); }
}
