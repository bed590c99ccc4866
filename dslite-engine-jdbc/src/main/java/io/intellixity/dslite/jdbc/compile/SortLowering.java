package io.intellixity.dslite.jdbc.compile;

import io.intellixity.dslite.query.SortField;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class SortLowering {
  private final FieldRefLowering fields;

  public SortLowering(FieldRefLowering fields) {
    this.fields = Objects.requireNonNull(fields, "fields");
  }

  /** Returns {@code ORDER BY ...}, or an empty string when there is nothing to sort by. */
  public String lower(List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return "";
    List<String> parts = new ArrayList<>(sort.size());
    for (SortField sf : sort) {
      parts.add(fields.lower(sf.field()) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
    }
    return "ORDER BY " + String.join(", ", parts);
  }
}
