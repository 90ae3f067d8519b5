package io.intellixity.polydata.api;

import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.notify.ChangeNotifier;
import io.intellixity.polydata.notify.ChangeType;
import io.intellixity.polydata.notify.Channels;
import io.intellixity.polydata.notify.Subscription;
import io.intellixity.polydata.query.QueryBuilder;
import io.intellixity.polydata.schema.FieldDef;
import io.intellixity.polydata.schema.SchemaDescriptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Derives REST routes and GraphQL resolvers for a schema.
 * <p>
 * For an entity {@code users}:
 * <pre>
 * GET    /api/users          list (page, limit, equality filters)
 * GET    /api/users/:id
 * POST   /api/users          201
 * PUT    /api/users/:id
 * DELETE /api/users/:id      204
 *
 * Query.users, Query.user, Mutation.createUser/updateUser/deleteUser,
 * Subscription.userCreated/userUpdated/userDeleted
 * </pre>
 */
public final class ApiSurfaceGenerator {
  private final Function<String, QueryBuilder> queries;
  private final ChangeNotifier notifier;

  public ApiSurfaceGenerator(Function<String, QueryBuilder> queries, ChangeNotifier notifier) {
    this.queries = Objects.requireNonNull(queries, "queries");
    this.notifier = Objects.requireNonNull(notifier, "notifier");
  }

  public List<RestRoute> rest(String providerId, SchemaDescriptor schema) {
    EntityOperations ops = new EntityOperations(providerId, schema, queries, notifier);
    String base = "/api/" + schema.name();
    String item = base + "/:id";
    return List.of(
        new RestRoute(HttpMethod.GET, base, guarded(req -> list(ops, req))),
        new RestRoute(HttpMethod.GET, item, guarded(req -> RestResponse.data(200, ops.get(req.pathParams().get("id"))))),
        new RestRoute(HttpMethod.POST, base, guarded(req -> RestResponse.data(201, ops.create(req.body())))),
        new RestRoute(HttpMethod.PUT, item, guarded(req -> RestResponse.data(200, ops.update(req.pathParams().get("id"), req.body())))),
        new RestRoute(HttpMethod.DELETE, item, guarded(req -> {
          ops.delete(req.pathParams().get("id"));
          return RestResponse.noContent();
        }))
    );
  }

  public GraphQlSurface graphQl(String providerId, SchemaDescriptor schema) {
    EntityOperations ops = new EntityOperations(providerId, schema, queries, notifier);
    String singular = singular(schema.name());
    String plural = singular + "s";
    String type = capitalize(singular);

    Map<String, GraphQlResolver> query = new LinkedHashMap<>();
    query.put(plural, args -> ops.list(intArg(args, "page", EntityOperations.DEFAULT_PAGE),
        intArg(args, "limit", EntityOperations.DEFAULT_LIMIT), Map.of()).data());
    query.put(singular, args -> ops.get(requireArg(args, "id")));

    Map<String, GraphQlResolver> mutation = new LinkedHashMap<>();
    mutation.put("create" + type, args -> ops.create(inputArg(args)));
    mutation.put("update" + type, args -> ops.update(requireArg(args, "id"), inputArg(args)));
    mutation.put("delete" + type, args -> {
      ops.delete(requireArg(args, "id"));
      return Boolean.TRUE;
    });

    Map<String, Supplier<Subscription>> subscription = new LinkedHashMap<>();
    subscription.put(singular + "Created", () -> notifier.subscribe(Channels.of(schema.name(), ChangeType.CREATED)));
    subscription.put(singular + "Updated", () -> notifier.subscribe(Channels.of(schema.name(), ChangeType.UPDATED)));
    subscription.put(singular + "Deleted", () -> notifier.subscribe(Channels.of(schema.name(), ChangeType.DELETED)));

    return new GraphQlSurface(type, query, mutation, subscription, sdl(schema, singular, plural, type));
  }

  static String sdl(SchemaDescriptor schema, String singular, String plural, String type) {
    String idField = schema.idField();
    StringBuilder sb = new StringBuilder();
    sb.append("type ").append(type).append(" {\n");
    for (FieldDef f : schema.fields()) {
      sb.append("  ").append(f.name()).append(": ").append(graphQlType(f, idField));
      if (!f.nullable()) sb.append('!');
      sb.append('\n');
    }
    sb.append("}\n\n");

    sb.append("input ").append(type).append("Input {\n");
    for (FieldDef f : schema.fields()) {
      if (f.autoIncrement()) continue;
      sb.append("  ").append(f.name()).append(": ").append(graphQlType(f, idField)).append('\n');
    }
    sb.append("}\n\n");

    sb.append("extend type Query {\n")
        .append("  ").append(plural).append("(page: Int, limit: Int): [").append(type).append("!]!\n")
        .append("  ").append(singular).append("(id: ID!): ").append(type).append('\n')
        .append("}\n\n");
    sb.append("extend type Mutation {\n")
        .append("  create").append(type).append("(input: ").append(type).append("Input!): ").append(type).append("!\n")
        .append("  update").append(type).append("(id: ID!, input: ").append(type).append("Input!): ").append(type).append("!\n")
        .append("  delete").append(type).append("(id: ID!): Boolean!\n")
        .append("}\n\n");
    sb.append("extend type Subscription {\n")
        .append("  ").append(singular).append("Created: ").append(type).append("!\n")
        .append("  ").append(singular).append("Updated: ").append(type).append("!\n")
        .append("  ").append(singular).append("Deleted: ").append(type).append("!\n")
        .append("}\n");
    return sb.toString();
  }

  private static String graphQlType(FieldDef f, String idField) {
    if (f.name().equals(idField)) return "ID";
    return switch (f.type()) {
      case INTEGER -> "Int";
      case FLOAT, DOUBLE -> "Float";
      case BOOLEAN -> "Boolean";
      default -> "String";
    };
  }

  static String singular(String entity) {
    if (entity.length() > 1 && entity.endsWith("s")) return entity.substring(0, entity.length() - 1);
    return entity;
  }

  static String capitalize(String s) {
    return s.isEmpty() ? s : s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
  }

  private static RestResponse list(EntityOperations ops, RestRequest req) {
    Map<String, String> filters = new LinkedHashMap<>(req.queryParams());
    int page = parseIntParam(filters.remove("page"), "page", EntityOperations.DEFAULT_PAGE);
    int limit = parseIntParam(filters.remove("limit"), "limit", EntityOperations.DEFAULT_LIMIT);
    EntityOperations.Page p = ops.list(page, limit, filters);
    Map<String, Object> pagination = new LinkedHashMap<>();
    pagination.put("page", p.page());
    pagination.put("limit", p.limit());
    pagination.put("total", p.total());
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("data", p.data());
    body.put("pagination", pagination);
    return RestResponse.ok(body);
  }

  private static int parseIntParam(String v, String name, int defaultValue) {
    if (v == null || v.isBlank()) return defaultValue;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new ValidationException(name + " must be an integer: " + v, e);
    }
  }

  private static RestHandler guarded(RestHandler h) {
    return req -> {
      try {
        return h.handle(req);
      } catch (RuntimeException e) {
        return ApiErrors.toResponse(e);
      }
    };
  }

  private static Object requireArg(Map<String, Object> args, String name) {
    Object v = (args == null) ? null : args.get(name);
    if (v == null) throw new ValidationException("Argument '" + name + "' is required");
    return v;
  }

  private static int intArg(Map<String, Object> args, String name, int defaultValue) {
    Object v = (args == null) ? null : args.get(name);
    if (v == null) return defaultValue;
    if (v instanceof Number n) return n.intValue();
    return parseIntParam(String.valueOf(v), name, defaultValue);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> inputArg(Map<String, Object> args) {
    Object v = requireArg(args, "input");
    if (!(v instanceof Map<?, ?>)) throw new ValidationException("Argument 'input' must be an object");
    return (Map<String, Object>) v;
  }
}
