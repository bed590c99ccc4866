package io.intellixity.dslite.spi.sql;

/** Marker for a backend-ready statement produced by a {@link Dialect}. */
public interface NativeStatement {
}
