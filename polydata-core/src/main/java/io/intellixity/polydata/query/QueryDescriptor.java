package io.intellixity.polydata.query;

import io.intellixity.polydata.error.UnsupportedQueryException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider-agnostic description of one operation, before compilation.
 * <p>
 * Values are immutable; every {@code with*} method returns a copy. Predicate and payload maps keep
 * insertion order (placeholder numbering follows it) and allow {@code null} values, which compile
 * to {@code IS NULL} tests in predicates.
 */
public record QueryDescriptor(
    QueryKind kind,
    String target,
    List<String> columns,
    Map<String, Object> where,
    List<Join> joins,
    List<OrderBy> orderBy,
    List<String> groupBy,
    Map<String, Object> having,
    Integer limit,
    Integer offset,
    Map<String, Object> data,
    List<String> returning,
    boolean single
) {
  public QueryDescriptor {
    columns = copyList(columns);
    where = copyPredicates(where, "where");
    joins = copyList(joins);
    orderBy = copyList(orderBy);
    groupBy = copyList(groupBy);
    having = copyPredicates(having, "having");
    data = copyMap(data);
    returning = copyList(returning);
  }

  public static QueryDescriptor empty() {
    return new QueryDescriptor(null, null, null, null, null, null, null, null, null, null, null, null, false);
  }

  public boolean hasReturning() { return !returning.isEmpty(); }

  public QueryDescriptor withKind(QueryKind k) {
    return new QueryDescriptor(k, target, columns, where, joins, orderBy, groupBy, having, limit, offset, data, returning, single);
  }

  public QueryDescriptor withTarget(String t) {
    return new QueryDescriptor(kind, t, columns, where, joins, orderBy, groupBy, having, limit, offset, data, returning, single);
  }

  public QueryDescriptor withColumns(List<String> c) {
    return new QueryDescriptor(kind, target, c, where, joins, orderBy, groupBy, having, limit, offset, data, returning, single);
  }

  public QueryDescriptor withWhere(Map<String, Object> w) {
    return new QueryDescriptor(kind, target, columns, w, joins, orderBy, groupBy, having, limit, offset, data, returning, single);
  }

  public QueryDescriptor withJoins(List<Join> j) {
    return new QueryDescriptor(kind, target, columns, where, j, orderBy, groupBy, having, limit, offset, data, returning, single);
  }

  public QueryDescriptor withOrderBy(List<OrderBy> o) {
    return new QueryDescriptor(kind, target, columns, where, joins, o, groupBy, having, limit, offset, data, returning, single);
  }

  public QueryDescriptor withGroupBy(List<String> g) {
    return new QueryDescriptor(kind, target, columns, where, joins, orderBy, g, having, limit, offset, data, returning, single);
  }

  public QueryDescriptor withHaving(Map<String, Object> h) {
    return new QueryDescriptor(kind, target, columns, where, joins, orderBy, groupBy, h, limit, offset, data, returning, single);
  }

  public QueryDescriptor withLimit(Integer l) {
    return new QueryDescriptor(kind, target, columns, where, joins, orderBy, groupBy, having, l, offset, data, returning, single);
  }

  public QueryDescriptor withOffset(Integer o) {
    return new QueryDescriptor(kind, target, columns, where, joins, orderBy, groupBy, having, limit, o, data, returning, single);
  }

  public QueryDescriptor withData(Map<String, Object> d) {
    return new QueryDescriptor(kind, target, columns, where, joins, orderBy, groupBy, having, limit, offset, d, returning, single);
  }

  public QueryDescriptor withReturning(List<String> r) {
    return new QueryDescriptor(kind, target, columns, where, joins, orderBy, groupBy, having, limit, offset, data, r, single);
  }

  public QueryDescriptor withSingle(boolean s) {
    return new QueryDescriptor(kind, target, columns, where, joins, orderBy, groupBy, having, limit, offset, data, returning, s);
  }

  /**
   * Structural checks every dialect relies on.
   *
   * @throws UnsupportedQueryException when the kind is unset or the descriptor cannot be compiled
   */
  public void validate() {
    if (kind == null) throw new UnsupportedQueryException("Operation kind must be set before execution");
    if (target == null || target.isBlank()) {
      throw new UnsupportedQueryException(kind + " requires a target table/collection");
    }
    if ((kind == QueryKind.INSERT || kind == QueryKind.UPDATE) && data.isEmpty()) {
      throw new UnsupportedQueryException(kind + " requires a non-empty payload");
    }
    if (limit != null && limit < 0) throw new UnsupportedQueryException("limit must be >= 0: " + limit);
    if (offset != null && offset < 0) throw new UnsupportedQueryException("offset must be >= 0: " + offset);
    if (!having.isEmpty() && groupBy.isEmpty()) {
      throw new UnsupportedQueryException("having requires groupBy");
    }
  }

  private static <T> List<T> copyList(List<T> in) {
    return (in == null) ? List.of() : List.copyOf(in);
  }

  private static Map<String, Object> copyMap(Map<String, Object> in) {
    if (in == null || in.isEmpty()) return Map.of();
    return Collections.unmodifiableMap(new LinkedHashMap<>(in));
  }

  private static Map<String, Object> copyPredicates(Map<String, Object> in, String clause) {
    if (in == null || in.isEmpty()) return Map.of();
    List<String> keys = new ArrayList<>(in.keySet());
    for (String k : keys) {
      if (k == null || k.isBlank()) {
        throw new UnsupportedQueryException(clause + " keys must be non-empty strings");
      }
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(in));
  }
}
