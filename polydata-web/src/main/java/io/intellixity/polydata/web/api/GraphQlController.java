package io.intellixity.polydata.web.api;

import io.intellixity.polydata.Polydata;
import io.intellixity.polydata.api.ApiErrors;
import io.intellixity.polydata.api.ApiSurface;
import io.intellixity.polydata.api.GraphQlResolver;
import io.intellixity.polydata.api.GraphQlSurface;
import io.intellixity.polydata.api.RestResponse;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * GraphQL surface without a query language runtime: the combined SDL, and direct invocation of
 * one generated root field.
 * <pre>
 * GET  /graphql/schema
 * POST /graphql/query/users      {"page": 1, "limit": 10}
 * POST /graphql/mutation/createUser  {"input": {...}}
 * </pre>
 * Results are wrapped as {@code {"data": {field: result}}}.
 */
@RestController
@RequestMapping("/graphql")
public final class GraphQlController {
  static final String ROOT_TYPES = "type Query\ntype Mutation\ntype Subscription\n";

  private final Polydata polydata;

  public GraphQlController(Polydata polydata) {
    this.polydata = polydata;
  }

  @GetMapping(value = "/schema", produces = MediaType.TEXT_PLAIN_VALUE)
  public String schema() {
    StringBuilder sb = new StringBuilder(ROOT_TYPES);
    for (ApiSurface s : new TreeMap<>(polydata.apis()).values()) {
      if (s.graphQl() != null) sb.append('\n').append(s.graphQl().sdl());
    }
    return sb.toString();
  }

  @PostMapping("/{operation}/{field}")
  public ResponseEntity<Object> invoke(@PathVariable("operation") String operation,
                                       @PathVariable("field") String field,
                                       @RequestBody(required = false) Map<String, Object> args) {
    GraphQlResolver resolver = resolver(operation, field);
    if (resolver == null) {
      return EntityApiController.toEntity(ApiErrors.error(404, "NOT_FOUND", "No " + operation + " field " + field));
    }
    try {
      Object result = resolver.resolve(args == null ? Map.of() : args);
      Map<String, Object> data = new LinkedHashMap<>();
      data.put(field, result);
      return EntityApiController.toEntity(RestResponse.data(200, data));
    } catch (RuntimeException e) {
      return EntityApiController.toEntity(ApiErrors.toResponse(e));
    }
  }

  private GraphQlResolver resolver(String operation, String field) {
    for (ApiSurface s : polydata.apis().values()) {
      GraphQlSurface g = s.graphQl();
      if (g == null) continue;
      GraphQlResolver r = switch (operation) {
        case "query" -> g.query().get(field);
        case "mutation" -> g.mutation().get(field);
        default -> null;
      };
      if (r != null) return r;
    }
    return null;
  }
}
