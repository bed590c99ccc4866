package io.intellixity.dslite.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Table to create: column name to type definition (e.g. {@code "INTEGER PRIMARY KEY"}), in declaration order.
 * <p>
 * Type definitions are trusted developer input but are still restricted to a conservative character set.
 */
public record TableDef(String name, Map<String, String> columns) {
  public TableDef {
    columns = (columns == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
  }

  public static TableDef of(String name) { return new TableDef(name, Map.of()); }

  public TableDef column(String column, String typeDef) {
    Map<String, String> out = new LinkedHashMap<>(columns);
    out.put(column, typeDef);
    return new TableDef(name, out);
  }
}
