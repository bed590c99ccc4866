package io.intellixity.dslite.jdbc.compile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** SQL text plus the values for its {@code ?} placeholders, in text order. */
public record SqlFragment(String sql, List<Object> params) {
  public static final SqlFragment TRUE = new SqlFragment("1=1", List.of());
  public static final SqlFragment FALSE = new SqlFragment("1=0", List.of());

  public SqlFragment {
    // params may hold nulls
    params = (params == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static SqlFragment of(String sql, Object... params) {
    List<Object> out = new ArrayList<>(params.length);
    Collections.addAll(out, params);
    return new SqlFragment(sql, out);
  }
}
