package io.intellixity.polydata.dynamo;

import io.intellixity.polydata.dynamo.DynamoStatement.Action;
import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.spi.Dialect;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wide-column dialect: compiles descriptors into {@link DynamoStatement}s.
 * <p>
 * Predicates become filter or condition expressions over {@code #n}/{@code :v} placeholders.
 * Reads whose predicate is exactly the table key become GetItem, other reads a Scan; writes
 * addressed by the full key touch one item, otherwise every matching item. Table keys are
 * registered when the schema is ensured and default to {@code id}.
 */
public final class DynamoDialect implements Dialect<DynamoStatement> {
  static final List<String> DEFAULT_KEY = List.of("id");

  private final Map<String, List<String>> keys = new ConcurrentHashMap<>();

  @Override public String id() { return "dynamodb"; }

  public void registerKey(String table, List<String> keyFields) {
    keys.put(table, keyFields.isEmpty() ? DEFAULT_KEY : List.copyOf(keyFields));
  }

  public List<String> keyOf(String table) {
    return keys.getOrDefault(table, DEFAULT_KEY);
  }

  @Override
  public DynamoStatement compile(QueryDescriptor q) {
    if (q.kind() == null) throw new UnsupportedQueryException("Operation kind must be set before compilation");
    if (!q.joins().isEmpty()) throw new UnsupportedQueryException("Joins are not supported on wide-column providers");
    if (!q.groupBy().isEmpty()) throw new UnsupportedQueryException("Group by is not supported on wide-column providers");
    String table = name(q.target());
    List<String> key = keyOf(table);
    return switch (q.kind()) {
      case SELECT -> renderRead(table, key, q);
      case INSERT -> renderPut(table, key, q);
      case UPDATE -> renderUpdate(table, key, q);
      case DELETE -> renderDelete(table, key, q);
    };
  }

  private DynamoStatement renderRead(String table, List<String> key, QueryDescriptor q) {
    Expr ex = new Expr();
    String projection = ex.projection(q.columns());
    if (isExactKey(q.where(), key)) {
      DynamoStatement.Builder b = DynamoStatement.builder(Action.GET_ITEM, table).key(q.where()).projection(projection);
      return ex.applyTo(b).build();
    }
    DynamoStatement.Builder b = DynamoStatement.builder(Action.SCAN, table)
        .filter(ex.conditions(q.where()))
        .projection(projection)
        .orderBy(q.orderBy())
        .offset(q.offset())
        .take(q.single() ? Integer.valueOf(1) : q.limit());
    return ex.applyTo(b).build();
  }

  private DynamoStatement renderPut(String table, List<String> key, QueryDescriptor q) {
    for (String k : key) {
      if (q.data().get(k) == null) {
        throw new UnsupportedQueryException("Insert into '" + table + "' requires key attribute '" + k + "'");
      }
    }
    Expr ex = new Expr();
    DynamoStatement.Builder b = DynamoStatement.builder(Action.PUT_ITEM, table)
        .item(q.data())
        .condition("attribute_not_exists(" + ex.name(key.get(0)) + ")");
    return ex.applyTo(b).build();
  }

  private DynamoStatement renderUpdate(String table, List<String> key, QueryDescriptor q) {
    Expr ex = new Expr();
    List<String> sets = new ArrayList<>();
    for (Map.Entry<String, Object> e : q.data().entrySet()) {
      if (key.contains(e.getKey())) {
        throw new UnsupportedQueryException("Key attribute '" + e.getKey() + "' cannot be updated");
      }
      sets.add(ex.name(name(e.getKey())) + " = " + ex.value(e.getValue()));
    }
    DynamoStatement.Builder b = DynamoStatement.builder(Action.UPDATE_ITEM, table).update("SET " + String.join(", ", sets));
    return ex.applyTo(addressed(b, ex, key, q.where())).build();
  }

  private DynamoStatement renderDelete(String table, List<String> key, QueryDescriptor q) {
    Expr ex = new Expr();
    DynamoStatement.Builder b = DynamoStatement.builder(Action.DELETE_ITEM, table);
    return ex.applyTo(addressed(b, ex, key, q.where())).build();
  }

  /** Full key: one item guarded by existence and the remaining predicates; otherwise a filtered sweep. */
  private static DynamoStatement.Builder addressed(DynamoStatement.Builder b, Expr ex, List<String> key,
                                                   Map<String, Object> where) {
    if (!where.keySet().containsAll(key) || key.stream().anyMatch(k -> where.get(k) == null)) {
      return b.filter(ex.conditions(where));
    }
    Map<String, Object> k = new LinkedHashMap<>();
    Map<String, Object> rest = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : where.entrySet()) {
      if (key.contains(e.getKey())) k.put(e.getKey(), e.getValue());
      else rest.put(e.getKey(), e.getValue());
    }
    String exists = "attribute_exists(" + ex.name(key.get(0)) + ")";
    String more = ex.conditions(rest);
    return b.key(k).condition(more == null ? exists : exists + " AND " + more);
  }

  private static boolean isExactKey(Map<String, Object> where, List<String> key) {
    if (where.size() != key.size() || !where.keySet().containsAll(key)) return false;
    for (String k : key) if (where.get(k) == null) return false;
    return true;
  }

  private static String name(String n) {
    if (n == null || n.isBlank()) throw new UnsupportedQueryException("Attribute and table names must be non-empty");
    return n.trim();
  }

  /** Placeholder allocation for one statement. */
  private static final class Expr {
    private final Map<String, String> names = new LinkedHashMap<>();
    private final Map<String, String> byAttribute = new HashMap<>();
    private final Map<String, Object> values = new LinkedHashMap<>();

    String name(String attribute) {
      String p = byAttribute.get(attribute);
      if (p == null) {
        p = "#n" + names.size();
        names.put(p, attribute);
        byAttribute.put(attribute, p);
      }
      return p;
    }

    String value(Object v) {
      String p = ":v" + values.size();
      values.put(p, v);
      return p;
    }

    /** Equality conjunction; a null value matches missing or NULL attributes. */
    String conditions(Map<String, Object> where) {
      if (where.isEmpty()) return null;
      List<String> parts = new ArrayList<>(where.size());
      for (Map.Entry<String, Object> e : where.entrySet()) {
        String n = name(DynamoDialect.name(e.getKey()));
        String v = value(e.getValue());
        parts.add(e.getValue() == null ? "(attribute_not_exists(" + n + ") OR " + n + " = " + v + ")" : n + " = " + v);
      }
      return String.join(" AND ", parts);
    }

    String projection(List<String> columns) {
      if (columns.isEmpty()) return null;
      List<String> parts = new ArrayList<>(columns.size());
      for (String c : columns) {
        if ("*".equals(c.trim())) return null;
        parts.add(name(DynamoDialect.name(c)));
      }
      return String.join(", ", parts);
    }

    DynamoStatement.Builder applyTo(DynamoStatement.Builder b) {
      names.forEach(b::name);
      values.forEach(b::value);
      return b;
    }
  }
}
