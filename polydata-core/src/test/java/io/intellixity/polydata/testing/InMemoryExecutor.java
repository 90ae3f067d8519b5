package io.intellixity.polydata.testing;

import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.exec.ProviderExecutor;
import io.intellixity.polydata.exec.ProviderHandle;
import io.intellixity.polydata.exec.QueryResult;
import io.intellixity.polydata.provider.Capabilities;
import io.intellixity.polydata.provider.ProviderKind;
import io.intellixity.polydata.query.OrderBy;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.schema.FieldDef;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SchemaResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Map-backed executor honoring equality predicates, ordering, paging and unique fields. */
public final class InMemoryExecutor implements ProviderExecutor {
  private final String id;
  private final ProviderKind kind;
  private final Capabilities capabilities;
  private final Map<String, List<Map<String, Object>>> tables = new ConcurrentHashMap<>();
  private final Map<String, SchemaDescriptor> schemas = new ConcurrentHashMap<>();
  private final AtomicInteger executions = new AtomicInteger();
  private final AtomicInteger ensures = new AtomicInteger();
  private volatile boolean closed;
  private volatile RuntimeException closeFailure;

  public InMemoryExecutor(String id, ProviderKind kind, boolean returning) {
    this.id = id;
    this.kind = kind;
    this.capabilities = Capabilities.of(false, returning, false, false);
  }

  public int executions() { return executions.get(); }
  public int ensures() { return ensures.get(); }
  public boolean isClosed() { return closed; }
  public void failOnClose(RuntimeException e) { this.closeFailure = e; }
  public List<Map<String, Object>> table(String name) { return tables.getOrDefault(name, List.of()); }

  @Override public String id() { return id; }
  @Override public ProviderKind kind() { return kind; }
  @Override public Capabilities capabilities() { return capabilities; }

  @Override
  public ProviderHandle<?> handle() {
    return new ProviderHandle<Map<String, List<Map<String, Object>>>>() {
      @Override public String id() { return id; }
      @Override public Map<String, List<Map<String, Object>>> client() { return tables; }
      @Override public String namespace() { return "memory"; }
    };
  }

  @Override public void ping() {}

  @Override
  public synchronized QueryResult execute(QueryDescriptor q) {
    q.validate();
    if (!q.joins().isEmpty()) throw new UnsupportedQueryException("joins");
    executions.incrementAndGet();
    List<Map<String, Object>> rows = tables.computeIfAbsent(q.target(), k -> new ArrayList<>());
    QueryResult r = switch (q.kind()) {
      case SELECT -> select(rows, q);
      case INSERT -> insert(rows, q);
      case UPDATE -> update(rows, q);
      case DELETE -> delete(rows, q);
    };
    return q.single() ? r.firstOnly() : r;
  }

  private QueryResult select(List<Map<String, Object>> rows, QueryDescriptor q) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Map<String, Object> r : rows) if (matches(r, q.where())) out.add(r);
    for (int i = q.orderBy().size() - 1; i >= 0; i--) {
      OrderBy o = q.orderBy().get(i);
      Comparator<Map<String, Object>> c = Comparator.comparing(r -> String.valueOf(r.get(o.field())));
      out.sort(o.direction() == OrderBy.Direction.DESC ? c.reversed() : c);
    }
    int from = Math.min(q.offset() == null ? 0 : q.offset(), out.size());
    int to = (q.limit() == null) ? out.size() : Math.min(out.size(), from + q.limit());
    return QueryResult.ofRows(out.subList(from, to));
  }

  private QueryResult insert(List<Map<String, Object>> rows, QueryDescriptor q) {
    SchemaDescriptor s = schemas.get(q.target());
    if (s != null) {
      for (FieldDef f : s.fields()) {
        if (!f.unique() && !f.primaryKey()) continue;
        Object v = q.data().get(f.name());
        for (Map<String, Object> r : rows) {
          if (v != null && Objects.equals(r.get(f.name()), v)) {
            throw new ValidationException("Duplicate value for " + f.name());
          }
        }
      }
    }
    Map<String, Object> row = new LinkedHashMap<>(q.data());
    rows.add(row);
    return capabilities.returning() && q.hasReturning()
        ? QueryResult.of(List.of(row), 1)
        : QueryResult.ofCount(1);
  }

  private QueryResult update(List<Map<String, Object>> rows, QueryDescriptor q) {
    List<Map<String, Object>> changed = new ArrayList<>();
    for (Map<String, Object> r : rows) {
      if (!matches(r, q.where())) continue;
      r.putAll(q.data());
      changed.add(r);
    }
    return capabilities.returning() && q.hasReturning()
        ? QueryResult.of(changed, changed.size())
        : QueryResult.ofCount(changed.size());
  }

  private QueryResult delete(List<Map<String, Object>> rows, QueryDescriptor q) {
    List<Map<String, Object>> removed = new ArrayList<>();
    rows.removeIf(r -> {
      boolean m = matches(r, q.where());
      if (m) removed.add(r);
      return m;
    });
    return capabilities.returning() && q.hasReturning()
        ? QueryResult.of(removed, removed.size())
        : QueryResult.ofCount(removed.size());
  }

  private static boolean matches(Map<String, Object> row, Map<String, Object> where) {
    for (var e : where.entrySet()) {
      Object actual = row.get(e.getKey());
      Object expected = e.getValue();
      if (actual instanceof Number a && expected instanceof Number b) {
        if (a.doubleValue() != b.doubleValue()) return false;
      } else if (!Objects.equals(actual, expected)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public QueryResult executeNative(Object statement, List<Object> params) {
    executions.incrementAndGet();
    return QueryResult.ofRows(List.of(Map.of("statement", String.valueOf(statement), "params", params.size())));
  }

  @Override
  public SchemaResult ensureSchema(SchemaDescriptor schema) {
    ensures.incrementAndGet();
    schemas.put(schema.name(), schema);
    tables.computeIfAbsent(schema.name(), k -> new ArrayList<>());
    return new SchemaResult(schema.name(), true);
  }

  @Override
  public void close() {
    closed = true;
    if (closeFailure != null) throw closeFailure;
  }
}
