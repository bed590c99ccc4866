package io.intellixity.dslite.compile;

import io.intellixity.dslite.query.InvalidIdentifierException;

/**
 * Safe-identifier rule shared by every place a schema name reaches SQL text.
 * <p>
 * A safe identifier is non-empty and made only of ASCII letters, digits and underscore. Quoting happens
 * after this check, never instead of it.
 */
public final class Identifiers {
  private Identifiers() {}

  public static boolean isSafe(String name) {
    if (name == null || name.isEmpty()) return false;
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      boolean ok = (c >= 'a' && c <= 'z')
          || (c >= 'A' && c <= 'Z')
          || (c >= '0' && c <= '9')
          || c == '_';
      if (!ok) return false;
    }
    return true;
  }

  /**
   * @param context where the name is used, e.g. "table name"; carried by the exception
   * @return {@code name}, unchanged
   * @throws InvalidIdentifierException when {@code name} is not safe
   */
  public static String validate(String name, String context) {
    if (!isSafe(name)) throw new InvalidIdentifierException(String.valueOf(name), context);
    return name;
  }
}
