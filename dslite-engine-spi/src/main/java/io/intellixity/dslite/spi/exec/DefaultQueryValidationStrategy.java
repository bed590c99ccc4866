package io.intellixity.dslite.spi.exec;

import io.intellixity.dslite.compile.Identifiers;
import io.intellixity.dslite.query.QueryValidationException;
import io.intellixity.dslite.query.SearchRequest;

import java.util.Locale;
import java.util.Objects;

/**
 * Default, backend-agnostic request validation.\n
 *
 * Validates:\n
 * - table name (safe identifier)\n
 * - aggregate requests carry an aggs block\n
 * - size > 0 and from >= 0 when present\n
 */
public final class DefaultQueryValidationStrategy implements QueryValidationStrategy {
  @Override
  public void validate(Operation operation, String table, SearchRequest request) {
    Objects.requireNonNull(operation, "operation");
    if (table == null || table.isBlank()) {
      throw new QueryValidationException("Table name is required for " + operation.name().toLowerCase(Locale.ROOT) + ".");
    }
    Identifiers.validate(table, "table name");
    if (request == null) return;

    if (operation == Operation.AGGREGATE && request.aggs() == null) {
      throw new QueryValidationException("Table and `aggs` block are required.");
    }
    if (request.size() != null && request.size() <= 0) {
      throw new QueryValidationException("size must be > 0, got " + request.size());
    }
    if (request.from() != null && request.from() < 0) {
      throw new QueryValidationException("from must be >= 0, got " + request.from());
    }
  }
}
