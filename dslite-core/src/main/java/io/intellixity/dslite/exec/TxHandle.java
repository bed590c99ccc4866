package io.intellixity.dslite.exec;

/** Backend transaction token; engines downcast to their own implementation. */
public interface TxHandle {
}
