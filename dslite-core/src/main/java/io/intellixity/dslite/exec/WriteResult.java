package io.intellixity.dslite.exec;

/**
 * @param changes      rows changed by the statement(s)
 * @param lastInsertId row id of the last inserted row, when the operation reports one
 */
public record WriteResult(long changes, Long lastInsertId) {
  public static WriteResult of(long changes) { return new WriteResult(changes, null); }
}
