package io.intellixity.dslite.spi.exec;

/**
 * Engine-wide settings.
 *
 * @param defaultPageSize search page size when a request has no {@code size}
 */
public record EngineOptions(int defaultPageSize) {
  public static final int DEFAULT_PAGE_SIZE = 10;

  public EngineOptions {
    if (defaultPageSize <= 0) throw new IllegalArgumentException("defaultPageSize must be > 0");
  }

  public static EngineOptions defaults() {
    return new EngineOptions(DEFAULT_PAGE_SIZE);
  }
}
