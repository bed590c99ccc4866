package io.intellixity.dslite.jdbc.bind;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.intellixity.dslite.query.QueryJson;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Map;

/**
 * Default value binder for embedded SQL engines.\n
 *
 * - integral numbers bind as long, decimals as double\n
 * - booleans bind as 1/0\n
 * - maps and collections bind as JSON text (queryable with ->> / ->)\n
 * - temporals and enums bind as their text form\n
 * - anything else goes through setObject\n
 */
public class DefaultJdbcBinder implements JdbcBinder {
  @Override
  public void bind(PreparedStatement ps, int pos, Object v) throws SQLException {
    if (v == null) {
      ps.setNull(pos, Types.NULL);
    } else if (v instanceof String s) {
      ps.setString(pos, s);
    } else if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      ps.setLong(pos, ((Number) v).longValue());
    } else if (v instanceof Double || v instanceof Float) {
      ps.setDouble(pos, ((Number) v).doubleValue());
    } else if (v instanceof Boolean b) {
      ps.setInt(pos, b ? 1 : 0);
    } else if (v instanceof byte[] bytes) {
      ps.setBytes(pos, bytes);
    } else if (v instanceof Map<?, ?> || v instanceof Collection<?>) {
      ps.setString(pos, toJson(v));
    } else if (v instanceof Enum<?> e) {
      ps.setString(pos, e.name());
    } else if (v instanceof TemporalAccessor) {
      ps.setString(pos, v.toString());
    } else {
      ps.setObject(pos, v);
    }
  }

  private static String toJson(Object v) throws SQLException {
    try {
      return QueryJson.mapper().writeValueAsString(v);
    } catch (JsonProcessingException e) {
      throw new SQLException("Failed to encode " + v.getClass().getSimpleName() + " parameter as JSON", e);
    }
  }
}
