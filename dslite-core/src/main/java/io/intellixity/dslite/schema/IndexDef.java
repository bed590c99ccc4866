package io.intellixity.dslite.schema;

import java.util.List;

/**
 * @param name null to derive {@code idx_<table>_<fields>}
 * @param fields field references; JSON accessors such as {@code meta->>city} are allowed
 */
public record IndexDef(String table, List<String> fields, String name, boolean unique) {
  public IndexDef {
    fields = (fields == null) ? List.of() : List.copyOf(fields);
  }

  public static IndexDef on(String table, String... fields) {
    return new IndexDef(table, List.of(fields), null, false);
  }

  public IndexDef named(String indexName) { return new IndexDef(table, fields, indexName, unique); }

  public IndexDef asUnique() { return new IndexDef(table, fields, name, true); }
}
