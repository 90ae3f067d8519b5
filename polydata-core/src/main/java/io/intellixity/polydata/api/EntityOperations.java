package io.intellixity.polydata.api;

import io.intellixity.polydata.error.NotFoundException;
import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.exec.QueryResult;
import io.intellixity.polydata.notify.ChangeNotifier;
import io.intellixity.polydata.notify.ChangeType;
import io.intellixity.polydata.notify.Channels;
import io.intellixity.polydata.query.QueryBuilder;
import io.intellixity.polydata.schema.FieldDef;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SemanticType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * CRUD operations of one entity shared by the REST and GraphQL surfaces.
 * <p>
 * Request fields are checked against the schema, string inputs are coerced to the declared field
 * types, and every successful write publishes once to {@code <entity>:<created|updated|deleted>}.
 * Providers that cannot return written rows are re-read by id.
 */
public final class EntityOperations {
  public static final int DEFAULT_PAGE = 1;
  public static final int DEFAULT_LIMIT = 10;

  private final String providerId;
  private final SchemaDescriptor schema;
  private final Function<String, QueryBuilder> queries;
  private final ChangeNotifier notifier;

  public EntityOperations(String providerId, SchemaDescriptor schema,
                          Function<String, QueryBuilder> queries, ChangeNotifier notifier) {
    this.providerId = Objects.requireNonNull(providerId, "providerId");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.queries = Objects.requireNonNull(queries, "queries");
    this.notifier = Objects.requireNonNull(notifier, "notifier");
  }

  public String entity() { return schema.name(); }
  public SchemaDescriptor schema() { return schema; }

  public record Page(List<Map<String, Object>> data, int page, int limit, int total) {}

  public Page list(int page, int limit, Map<String, ?> filters) {
    if (page < 1) throw new ValidationException("page must be >= 1: " + page);
    if (limit < 1) throw new ValidationException("limit must be >= 1: " + limit);
    Map<String, Object> where = new LinkedHashMap<>();
    if (filters != null) {
      for (var e : filters.entrySet()) {
        FieldDef f = requireField(e.getKey());
        where.put(f.name(), coerce(f, e.getValue()));
      }
    }
    int offset;
    try {
      offset = Math.multiplyExact(page - 1, limit);
    } catch (ArithmeticException e) {
      throw new ValidationException("page " + page + " with limit " + limit + " is out of range", e);
    }
    QueryResult r = q().select("*").from(entity()).where(where)
        .limit(limit).offset(offset).execute();
    return new Page(r.rows(), page, limit, r.size());
  }

  public Map<String, Object> get(Object id) {
    Map<String, Object> row = findById(id);
    if (row == null) throw new NotFoundException(entity() + " not found: " + id);
    return row;
  }

  public Map<String, Object> create(Map<String, ?> input) {
    Map<String, Object> data = checkedPayload(input, true);
    String idField = schema.idField();
    FieldDef idDef = schema.field(idField);
    if (idDef != null && idDef.type() == SemanticType.UUID && data.get(idField) == null) {
      data.put(idField, UUID.randomUUID().toString());
    }
    QueryResult r = q().insertInto(entity(), data).returning("*").execute();
    Map<String, Object> row = r.single();
    if (row == null) {
      Object id = data.get(idField);
      row = (id == null) ? null : findById(id);
      if (row == null) row = data;
    }
    notifier.publish(Channels.of(entity(), ChangeType.CREATED), row);
    return row;
  }

  public Map<String, Object> update(Object id, Map<String, ?> input) {
    Map<String, Object> data = checkedPayload(input, false);
    if (data.isEmpty()) throw new ValidationException("Update payload is empty");
    Object key = coerceId(id);
    String idField = schema.idField();
    if (data.containsKey(idField)) {
      if (!Objects.equals(data.get(idField), key)) {
        throw new ValidationException("Field '" + idField + "' cannot be changed");
      }
      data.remove(idField);
      if (data.isEmpty()) throw new ValidationException("Update payload is empty");
    }
    QueryResult r = q().update(entity(), data).where(idField, key).returning("*").execute();
    Map<String, Object> row = r.single();
    if (row == null) {
      if (r.affected() == 0) throw new NotFoundException(entity() + " not found: " + id);
      row = findById(key);
      if (row == null) throw new NotFoundException(entity() + " not found: " + id);
    }
    notifier.publish(Channels.of(entity(), ChangeType.UPDATED), row);
    return row;
  }

  public void delete(Object id) {
    Object key = coerceId(id);
    QueryResult r = q().deleteFrom(entity()).where(schema.idField(), key).execute();
    if (r.affected() == 0) throw new NotFoundException(entity() + " not found: " + id);
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(schema.idField(), key);
    notifier.publish(Channels.of(entity(), ChangeType.DELETED), payload);
  }

  private Map<String, Object> findById(Object id) {
    return q().select("*").from(entity()).where(schema.idField(), coerceId(id)).first().executeFirst();
  }

  private QueryBuilder q() {
    return queries.apply(providerId);
  }

  private Map<String, Object> checkedPayload(Map<String, ?> input, boolean create) {
    if (input == null) throw new ValidationException("Request body is required");
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : input.entrySet()) {
      FieldDef f = requireField(e.getKey());
      out.put(f.name(), coerce(f, e.getValue()));
    }
    if (create) {
      List<String> missing = new ArrayList<>();
      for (FieldDef f : schema.fields()) {
        if (f.nullable() || f.defaultValue() != null || f.autoIncrement()) continue;
        if (f.primaryKey() && f.type() == SemanticType.UUID) continue;
        if (out.get(f.name()) == null) missing.add(f.name());
      }
      if (!missing.isEmpty()) throw new ValidationException("Missing required fields: " + String.join(", ", missing));
    } else {
      for (var e : out.entrySet()) {
        if (e.getValue() == null && !schema.field(e.getKey()).nullable()) {
          throw new ValidationException("Field '" + e.getKey() + "' must not be null");
        }
      }
    }
    return out;
  }

  private FieldDef requireField(String name) {
    FieldDef f = schema.field(name);
    if (f == null) throw new ValidationException("Unknown field '" + name + "' for " + entity());
    return f;
  }

  private Object coerceId(Object id) {
    if (id == null) throw new ValidationException("id is required");
    FieldDef f = schema.field(schema.idField());
    return (f == null) ? id : coerce(f, id);
  }

  /** Strings from paths and query strings are converted to the field's declared type. */
  static Object coerce(FieldDef f, Object v) {
    if (!(v instanceof String s)) return v;
    try {
      return switch (f.type()) {
        case INTEGER, BIGINT -> Long.parseLong(s.trim());
        case FLOAT, DOUBLE -> Double.parseDouble(s.trim());
        case BOOLEAN -> parseBoolean(f, s);
        default -> s;
      };
    } catch (NumberFormatException e) {
      throw new ValidationException("Field '" + f.name() + "' expects " + f.type().id() + ": " + s, e);
    }
  }

  private static Boolean parseBoolean(FieldDef f, String s) {
    String t = s.trim();
    if ("true".equalsIgnoreCase(t)) return Boolean.TRUE;
    if ("false".equalsIgnoreCase(t)) return Boolean.FALSE;
    throw new ValidationException("Field '" + f.name() + "' expects boolean: " + s);
  }
}
