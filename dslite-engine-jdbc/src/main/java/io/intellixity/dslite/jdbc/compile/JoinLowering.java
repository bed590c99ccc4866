package io.intellixity.dslite.jdbc.compile;

import io.intellixity.dslite.query.JoinSpec;
import io.intellixity.dslite.query.QueryValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** {@code LEFT JOIN `orders` ON `users`.`id` = `orders`.`user_id`}, one per descriptor, space separated. */
public final class JoinLowering {
  /** The operator is interpolated into SQL text, so only plain comparisons are allowed. */
  static final Set<String> ALLOWED_OPS = Set.of("=", "!=", "<>", "<", "<=", ">", ">=");

  private final FieldRefLowering fields;

  public JoinLowering(FieldRefLowering fields) {
    this.fields = Objects.requireNonNull(fields, "fields");
  }

  public String lower(List<JoinSpec> joins) {
    if (joins == null || joins.isEmpty()) return "";
    List<String> parts = new ArrayList<>(joins.size());
    for (JoinSpec j : joins) parts.add(lower(j));
    return String.join(" ", parts);
  }

  private String lower(JoinSpec j) {
    String target = fields.quote(j.target(), "join target table");
    JoinSpec.On on = j.on();
    if (on == null || isBlank(on.left()) || isBlank(on.right())) {
      throw new QueryValidationException(
          "Invalid JOIN definition for target " + j.target() + ": 'on' clause is missing.");
    }
    if (!ALLOWED_OPS.contains(on.op())) {
      throw new QueryValidationException("Unsupported JOIN operator for target " + j.target() + ": " + on.op());
    }
    String left = fields.lower(on.left());
    String right = fields.lower(on.right());
    return j.type().name() + " JOIN " + target + " ON " + left + " " + on.op() + " " + right;
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
