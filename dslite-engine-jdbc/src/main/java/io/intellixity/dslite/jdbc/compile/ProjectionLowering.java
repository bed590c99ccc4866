package io.intellixity.dslite.jdbc.compile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Lowers {@code _source} entries; {@code "<field> as <alias>"} renames a column. */
public final class ProjectionLowering {
  // greedy head: the last " as " separates the alias
  private static final Pattern ALIASED = Pattern.compile("^(.*)\\s+as\\s+(.*)$", Pattern.CASE_INSENSITIVE);

  private final FieldRefLowering fields;

  public ProjectionLowering(FieldRefLowering fields) {
    this.fields = Objects.requireNonNull(fields, "fields");
  }

  public String lower(List<String> source) {
    if (source == null || source.isEmpty()) return "*";
    List<String> parts = new ArrayList<>(source.size());
    for (String entry : source) {
      Matcher m = ALIASED.matcher(entry);
      if (m.matches()) {
        String expr = fields.lower(m.group(1).trim());
        String alias = fields.quote(m.group(2).trim(), "source alias");
        parts.add(expr + " AS " + alias);
      } else {
        parts.add(fields.lower(entry));
      }
    }
    return String.join(", ", parts);
  }
}
