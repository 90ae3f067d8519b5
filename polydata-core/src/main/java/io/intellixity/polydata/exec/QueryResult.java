package io.intellixity.polydata.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of an executed operation.
 * <p>
 * Reads fill {@code rows}; writes fill {@code affected} and, where the provider can return written
 * rows (RETURNING, re-read), {@code rows} as well. Row maps keep column order and allow null values.
 */
public record QueryResult(List<Map<String, Object>> rows, long affected) {
  public QueryResult {
    List<Map<String, Object>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
    if (rows != null) {
      for (Map<String, Object> r : rows) {
        copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(r)));
      }
    }
    rows = Collections.unmodifiableList(copy);
  }

  public static QueryResult ofRows(List<Map<String, Object>> rows) {
    return new QueryResult(rows, rows == null ? 0 : rows.size());
  }

  public static QueryResult ofCount(long affected) {
    return new QueryResult(List.of(), affected);
  }

  public static QueryResult of(List<Map<String, Object>> rows, long affected) {
    return new QueryResult(rows, affected);
  }

  /** First row or {@code null}. */
  public Map<String, Object> single() {
    return rows.isEmpty() ? null : rows.get(0);
  }

  public boolean isEmpty() { return rows.isEmpty(); }

  public int size() { return rows.size(); }

  /** Keeps at most one row; used for single-row descriptors. */
  public QueryResult firstOnly() {
    if (rows.size() <= 1) return this;
    return new QueryResult(rows.subList(0, 1), affected);
  }
}
