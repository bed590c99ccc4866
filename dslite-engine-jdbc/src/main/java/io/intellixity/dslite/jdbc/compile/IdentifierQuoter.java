package io.intellixity.dslite.jdbc.compile;

/** Dialect-specific quoting of an identifier that already passed the safe-identifier rule. */
@FunctionalInterface
public interface IdentifierQuoter {
  String quote(String safeIdentifier);
}
