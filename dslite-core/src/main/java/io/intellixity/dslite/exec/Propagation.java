package io.intellixity.dslite.exec;

/**
 * Transaction propagation behavior for {@link DataEngine#inTx(Propagation, java.util.function.Supplier)}.
 * <p>
 * SQLite allows a single writer per database, so there is no "requires new" variant: a second write
 * transaction opened from inside the first would wait on its own lock.
 */
public enum Propagation {
  /** Support a current transaction, create a new one if none exists. */
  REQUIRED,

  /** Support a current transaction, execute non-transactionally if none exists. */
  SUPPORTS,

  /** Support a current transaction, throw an exception if none exists. */
  MANDATORY,

  /** Execute non-transactionally, throw an exception if a transaction exists. */
  NEVER
}
