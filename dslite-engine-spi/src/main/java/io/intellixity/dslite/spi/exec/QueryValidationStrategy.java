package io.intellixity.dslite.spi.exec;

import io.intellixity.dslite.query.SearchRequest;

/**
 * SPI hook to validate read requests before dialect rendering.
 * <p>
 * Applications may plug in stricter rules (e.g. a table allow-list or a page size cap).
 */
public interface QueryValidationStrategy {
  enum Operation { SEARCH, AGGREGATE }

  void validate(Operation operation, String table, SearchRequest request);
}
