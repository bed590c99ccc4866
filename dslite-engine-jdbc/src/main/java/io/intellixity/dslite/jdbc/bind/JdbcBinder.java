package io.intellixity.dslite.jdbc.bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/** Binds one positional parameter value onto a prepared statement. */
@FunctionalInterface
public interface JdbcBinder {
  void bind(PreparedStatement ps, int position1Based, Object value) throws SQLException;
}
