package io.intellixity.polydata.query;

import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.exec.QueryResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Immutable fluent builder over a {@link QueryDescriptor}.
 * <p>
 * Every method returns a new builder, so a partially built query can be shared and extended from
 * several threads without interference:
 * <pre>
 * QueryResult r = polydata.query("postgresql")
 *     .select("id", "name").from("users").where("email", email).first().execute();
 * </pre>
 */
public final class QueryBuilder {
  private final QueryRunner runner;
  private final String providerId;
  private final QueryDescriptor descriptor;
  private final boolean cached;

  public QueryBuilder(QueryRunner runner, String providerId) {
    this(runner, providerId, QueryDescriptor.empty(), false);
  }

  private QueryBuilder(QueryRunner runner, String providerId, QueryDescriptor descriptor, boolean cached) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.providerId = Objects.requireNonNull(providerId, "providerId");
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    this.cached = cached;
  }

  private QueryBuilder with(QueryDescriptor d) {
    return new QueryBuilder(runner, providerId, d, cached);
  }

  public String providerId() { return providerId; }
  public QueryDescriptor descriptor() { return descriptor; }
  public boolean isCached() { return cached; }

  public QueryBuilder select(String... columns) {
    List<String> cols = (columns == null || columns.length == 0) ? List.of("*") : Arrays.asList(columns);
    return with(descriptor.withKind(QueryKind.SELECT).withColumns(cols));
  }

  public QueryBuilder from(String table) {
    return with(descriptor.withTarget(table));
  }

  /** Adds an equality predicate; {@code null} matches missing/null values. */
  public QueryBuilder where(String column, Object value) {
    Map<String, Object> w = new LinkedHashMap<>(descriptor.where());
    w.put(column, value);
    return with(descriptor.withWhere(w));
  }

  public QueryBuilder where(Map<String, ?> predicates) {
    Map<String, Object> w = new LinkedHashMap<>(descriptor.where());
    if (predicates != null) w.putAll(predicates);
    return with(descriptor.withWhere(w));
  }

  public QueryBuilder join(String table, String on) {
    return addJoin(Join.Type.INNER, table, on);
  }

  public QueryBuilder leftJoin(String table, String on) {
    return addJoin(Join.Type.LEFT, table, on);
  }

  private QueryBuilder addJoin(Join.Type type, String table, String on) {
    List<Join> j = new ArrayList<>(descriptor.joins());
    j.add(new Join(type, table, on));
    return with(descriptor.withJoins(j));
  }

  public QueryBuilder orderBy(String field) {
    return orderBy(field, OrderBy.Direction.ASC);
  }

  public QueryBuilder orderBy(String field, OrderBy.Direction direction) {
    List<OrderBy> o = new ArrayList<>(descriptor.orderBy());
    o.add(new OrderBy(field, direction));
    return with(descriptor.withOrderBy(o));
  }

  public QueryBuilder groupBy(String... fields) {
    List<String> g = new ArrayList<>(descriptor.groupBy());
    if (fields != null) g.addAll(Arrays.asList(fields));
    return with(descriptor.withGroupBy(g));
  }

  public QueryBuilder having(String column, Object value) {
    Map<String, Object> h = new LinkedHashMap<>(descriptor.having());
    h.put(column, value);
    return with(descriptor.withHaving(h));
  }

  public QueryBuilder having(Map<String, ?> predicates) {
    Map<String, Object> h = new LinkedHashMap<>(descriptor.having());
    if (predicates != null) h.putAll(predicates);
    return with(descriptor.withHaving(h));
  }

  public QueryBuilder limit(int limit) {
    if (limit < 0) throw new ValidationException("limit must be >= 0: " + limit);
    return with(descriptor.withLimit(limit));
  }

  public QueryBuilder offset(int offset) {
    if (offset < 0) throw new ValidationException("offset must be >= 0: " + offset);
    return with(descriptor.withOffset(offset));
  }

  public QueryBuilder insert(Map<String, ?> data) {
    return with(descriptor.withKind(QueryKind.INSERT).withData(copy(data)));
  }

  public QueryBuilder into(String table) {
    return with(descriptor.withTarget(table));
  }

  public QueryBuilder insertInto(String table, Map<String, ?> data) {
    return insert(data).into(table);
  }

  public QueryBuilder update(Map<String, ?> data) {
    return with(descriptor.withKind(QueryKind.UPDATE).withData(copy(data)));
  }

  public QueryBuilder update(String table, Map<String, ?> data) {
    return update(data).table(table);
  }

  public QueryBuilder table(String table) {
    return with(descriptor.withTarget(table));
  }

  public QueryBuilder delete() {
    return with(descriptor.withKind(QueryKind.DELETE));
  }

  public QueryBuilder deleteFrom(String table) {
    return delete().from(table);
  }

  public QueryBuilder returning(String... columns) {
    List<String> r = (columns == null || columns.length == 0) ? List.of("*") : Arrays.asList(columns);
    return with(descriptor.withReturning(r));
  }

  /** At most one row: sets the single-row flag and {@code limit 1}. */
  public QueryBuilder first() {
    return with(descriptor.withSingle(true).withLimit(1));
  }

  /** Opt this read into the result cache; ignored for writes. */
  public QueryBuilder cached() {
    return new QueryBuilder(runner, providerId, descriptor, true);
  }

  public QueryResult execute() {
    return runner.run(providerId, descriptor, cached);
  }

  /** Executes and returns the first row, or {@code null} when nothing matched. */
  public Map<String, Object> executeFirst() {
    return execute().single();
  }

  public CompletableFuture<QueryResult> executeAsync() {
    return runner.runAsync(providerId, descriptor, cached);
  }

  private static Map<String, Object> copy(Map<String, ?> data) {
    return (data == null) ? Map.of() : new LinkedHashMap<>(data);
  }
}
