package io.intellixity.dslite.query;

/**
 * Raised when a request is structurally invalid or references an unsafe identifier.
 * <p>
 * Always thrown before any SQL text is built, and never downgraded to an empty result.
 */
public class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
