package io.intellixity.dslite.jdbc.compile;

import io.intellixity.dslite.compile.Identifiers;
import io.intellixity.dslite.query.QueryValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lowers a field reference into SQL text.\n
 *
 * Forms:\n
 * - {@code *}\n
 * - identifier path: {@code name}, {@code users.name}\n
 * - JSON accessor: {@code meta->>address.city} becomes {@code `meta` ->> '$.address.city'}\n
 */
public final class FieldRefLowering {
  private final IdentifierQuoter quoter;

  public FieldRefLowering(IdentifierQuoter quoter) {
    this.quoter = Objects.requireNonNull(quoter, "quoter");
  }

  public String lower(String ref) {
    if (ref == null) throw new QueryValidationException("Field reference is required");
    if ("*".equals(ref)) return "*";

    int arrow = ref.indexOf("->");
    if (arrow >= 0) {
      String op = ref.startsWith("->>", arrow) ? "->>" : "->";
      String column = ref.substring(0, arrow).trim();
      String path = ref.substring(arrow + op.length()).trim();
      return quotePath(column, "JSON column name") + " " + op + " '" + jsonPath(path) + "'";
    }
    return quotePath(ref, "field name");
  }

  /** Validates and quotes each dot separated segment. */
  public String quotePath(String path, String context) {
    String[] parts = path.split("\\.", -1);
    List<String> out = new ArrayList<>(parts.length);
    for (String p : parts) out.add(quoter.quote(Identifiers.validate(p, context)));
    return String.join(".", out);
  }

  public String quote(String identifier, String context) {
    return quoter.quote(Identifiers.validate(identifier, context));
  }

  // The path lands inside a string literal, so every segment is held to the identifier rule
  // (plus optional [n] array indexes) and no quote character can get through.
  private static String jsonPath(String path) {
    for (String seg : path.split("\\.", -1)) {
      int bracket = seg.indexOf('[');
      String name = (bracket < 0) ? seg : seg.substring(0, bracket);
      Identifiers.validate(name, "JSON path");
      if (bracket >= 0 && !isArrayIndexes(seg.substring(bracket))) {
        throw new QueryValidationException("Invalid characters detected in JSON path: " + path);
      }
    }
    return "$." + path;
  }

  private static boolean isArrayIndexes(String s) {
    int i = 0;
    while (i < s.length()) {
      if (s.charAt(i) != '[') return false;
      int j = i + 1;
      while (j < s.length() && Character.isDigit(s.charAt(j)) && s.charAt(j) < 128) j++;
      if (j == i + 1 || j >= s.length() || s.charAt(j) != ']') return false;
      i = j + 1;
    }
    return true;
  }
}
