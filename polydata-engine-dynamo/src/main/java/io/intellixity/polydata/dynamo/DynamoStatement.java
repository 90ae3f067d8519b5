package io.intellixity.polydata.dynamo;

import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.exec.NativeStatement;
import io.intellixity.polydata.query.OrderBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Backend-native statement for the wide-column provider.
 * <p>
 * Expression strings use {@code #n} name and {@code :v} value placeholders resolved through
 * {@code names} and {@code values}; values are plain Java values converted to attribute values at
 * execution time. {@code orderBy}, {@code offset} and {@code take} are applied client-side after
 * the scan. An update or delete without a {@code key} applies to every item the filter matches.
 */
public record DynamoStatement(
    Action action,
    String table,
    Map<String, Object> key,
    Map<String, Object> item,
    String keyCondition,
    String filter,
    String update,
    String condition,
    String projection,
    Map<String, String> names,
    Map<String, Object> values,
    String indexName,
    Integer limit,
    List<OrderBy> orderBy,
    Integer offset,
    Integer take
) implements NativeStatement {
  public enum Action {
    GET_ITEM("getItem"),
    PUT_ITEM("putItem"),
    UPDATE_ITEM("updateItem"),
    DELETE_ITEM("deleteItem"),
    SCAN("scan"),
    QUERY("query");

    private final String id;

    Action(String id) { this.id = id; }

    public String id() { return id; }

    public static Action parse(String s) {
      Objects.requireNonNull(s, "action");
      String t = s.trim();
      for (Action a : values()) {
        if (a.id.equalsIgnoreCase(t) || a.name().equalsIgnoreCase(t)) return a;
      }
      throw new UnsupportedQueryException("Unsupported wide-column action: " + s);
    }
  }

  public DynamoStatement {
    Objects.requireNonNull(action, "action");
    if (table == null || table.isBlank()) throw new UnsupportedQueryException("table is required");
    key = nullableCopy(key);
    item = nullableCopy(item);
    names = (names == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(names));
    values = (values == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    orderBy = (orderBy == null) ? List.of() : List.copyOf(orderBy);
  }

  public static Builder builder(Action action, String table) {
    return new Builder(action, table);
  }

  public boolean hasKey() { return key != null && !key.isEmpty(); }

  public boolean clientSidePaging() {
    return !orderBy.isEmpty() || offset != null || take != null;
  }

  /**
   * Operation-map form: {@code {action, tableName, Key, Item, KeyConditionExpression, FilterExpression,
   * UpdateExpression, ConditionExpression, ProjectionExpression, ExpressionAttributeNames,
   * ExpressionAttributeValues, IndexName, Limit}}, the request shape of the DynamoDB API with plain
   * values in place of attribute values.
   */
  public static DynamoStatement fromMap(Map<?, ?> op) {
    Objects.requireNonNull(op, "operation");
    Object action = op.get("action");
    Object table = op.containsKey("tableName") ? op.get("tableName") : op.get("TableName");
    if (!(action instanceof String a) || !(table instanceof String t)) {
      throw new UnsupportedQueryException("Wide-column operations require string 'action' and 'tableName'");
    }
    Builder b = builder(Action.parse(a), t)
        .key(map(op.get("Key"), "Key"))
        .item(map(op.get("Item"), "Item"))
        .keyCondition(str(op.get("KeyConditionExpression"), "KeyConditionExpression"))
        .filter(str(op.get("FilterExpression"), "FilterExpression"))
        .update(str(op.get("UpdateExpression"), "UpdateExpression"))
        .condition(str(op.get("ConditionExpression"), "ConditionExpression"))
        .projection(str(op.get("ProjectionExpression"), "ProjectionExpression"))
        .indexName(str(op.get("IndexName"), "IndexName"));
    Map<String, Object> names = map(op.get("ExpressionAttributeNames"), "ExpressionAttributeNames");
    if (names != null) names.forEach((k, v) -> b.name(k, String.valueOf(v)));
    Map<String, Object> values = map(op.get("ExpressionAttributeValues"), "ExpressionAttributeValues");
    if (values != null) values.forEach(b::value);
    if (op.get("Limit") instanceof Number n) b.limit(n.intValue());
    return b.build();
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> map(Object o, String what) {
    if (o == null) return null;
    if (o instanceof Map<?, ?> m) return new LinkedHashMap<>((Map<String, Object>) m);
    throw new UnsupportedQueryException("Expected a map for '" + what + "'");
  }

  private static String str(Object o, String what) {
    if (o == null) return null;
    if (o instanceof String s) return s;
    throw new UnsupportedQueryException("Expected a string for '" + what + "'");
  }

  private static Map<String, Object> nullableCopy(Map<String, Object> m) {
    return (m == null) ? null : Collections.unmodifiableMap(new LinkedHashMap<>(m));
  }

  /** Safe for logs: no key or value contents. */
  @Override
  public String toString() {
    return "DynamoStatement[action=" + action.id() + ", table=" + table + ", filter=" + filter + "]";
  }

  public static final class Builder {
    private final Action action;
    private final String table;
    private Map<String, Object> key;
    private Map<String, Object> item;
    private String keyCondition;
    private String filter;
    private String update;
    private String condition;
    private String projection;
    private final Map<String, String> names = new LinkedHashMap<>();
    private final Map<String, Object> values = new LinkedHashMap<>();
    private String indexName;
    private Integer limit;
    private final List<OrderBy> orderBy = new ArrayList<>();
    private Integer offset;
    private Integer take;

    private Builder(Action action, String table) {
      this.action = action;
      this.table = table;
    }

    public Builder key(Map<String, Object> k) { this.key = k; return this; }
    public Builder item(Map<String, Object> i) { this.item = i; return this; }
    public Builder keyCondition(String e) { this.keyCondition = e; return this; }
    public Builder filter(String e) { this.filter = e; return this; }
    public Builder update(String e) { this.update = e; return this; }
    public Builder condition(String e) { this.condition = e; return this; }
    public Builder projection(String e) { this.projection = e; return this; }
    public Builder name(String placeholder, String attribute) { names.put(placeholder, attribute); return this; }
    public Builder value(String placeholder, Object v) { values.put(placeholder, v); return this; }
    public Builder indexName(String n) { this.indexName = n; return this; }
    public Builder limit(Integer l) { this.limit = l; return this; }
    public Builder orderBy(List<OrderBy> o) { orderBy.addAll(o); return this; }
    public Builder offset(Integer o) { this.offset = o; return this; }
    public Builder take(Integer t) { this.take = t; return this; }

    public DynamoStatement build() {
      return new DynamoStatement(action, table, key, item, keyCondition, filter, update, condition, projection,
          names, values, indexName, limit, orderBy, offset, take);
    }
  }
}
