package io.intellixity.dslite.query;

/** An identifier failed the safe-identifier rule. */
public final class InvalidIdentifierException extends QueryValidationException {
  private final String identifier;
  private final String context;

  public InvalidIdentifierException(String identifier, String context) {
    super("Invalid characters detected in " + context + ": " + identifier);
    this.identifier = identifier;
    this.context = context;
  }

  public String identifier() { return identifier; }

  /** Where the identifier was used, e.g. "table name" or "metric alias". */
  public String context() { return context; }
}
