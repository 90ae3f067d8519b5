package io.intellixity.polydata.jdbc;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads result-set rows into ordered maps keyed by column label. */
final class JdbcRowReader {
  private final SqlDialect dialect;

  JdbcRowReader(SqlDialect dialect) {
    this.dialect = dialect;
  }

  List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 0; i < n; i++) labels[i] = md.getColumnLabel(i + 1);

    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 0; i < n; i++) row.put(labels[i], value(rs.getObject(i + 1)));
      out.add(row);
    }
    return out;
  }

  private Object value(Object v) throws SQLException {
    if (v instanceof java.sql.Array a) {
      Object arr = a.getArray();
      if (arr instanceof Object[] oa) return Arrays.asList(oa);
      return arr;
    }
    return dialect.fromJdbcValue(v);
  }
}
