package io.intellixity.dslite.jdbc;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a whole ResultSet into column-label keyed rows.\n
 *
 * Keys follow select-list order; a later duplicate label overwrites an earlier one.\n
 */
final class JdbcRowReader {
  private JdbcRowReader() {}

  static List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 1; i <= n; i++) labels[i - 1] = md.getColumnLabel(i);

    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(n * 2);
      for (int i = 1; i <= n; i++) row.put(labels[i - 1], rs.getObject(i));
      out.add(row);
    }
    return out;
  }
}
