package io.intellixity.dslite.jdbc;

import io.intellixity.dslite.spi.sql.NativeStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

public record SqlStatement(String sql, List<Object> params, ExecKind execKind) implements NativeStatement {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery(). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate(). */
    UPDATE,
    /** Execute via PreparedStatement.executeUpdate(), then read the last inserted row id on the same connection. */
    UPDATE_LAST_INSERT_ID
  }

  public SqlStatement {
    // params may hold nulls
    params = (params == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Object> params) {
    this(sql, params, ExecKind.QUERY);
  }

  /** Leading keyword, e.g. SELECT or INSERT; used for logs and error messages. */
  public String verb() {
    String s = sql.trim();
    int sp = s.indexOf(' ');
    return (sp < 0 ? s : s.substring(0, sp)).toUpperCase(Locale.ROOT);
  }
}
