package io.intellixity.polydata.web.api;

import io.intellixity.polydata.Polydata;
import io.intellixity.polydata.api.ApiErrors;
import io.intellixity.polydata.api.ApiSurface;
import io.intellixity.polydata.api.HttpMethod;
import io.intellixity.polydata.api.RestRequest;
import io.intellixity.polydata.api.RestResponse;
import io.intellixity.polydata.api.RestRoute;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/** Serves the generated REST routes of every entity under {@code /api/{entity}}. */
@RestController
@RequestMapping("/api")
public final class EntityApiController {
  private final Polydata polydata;

  public EntityApiController(Polydata polydata) {
    this.polydata = polydata;
  }

  @GetMapping("/{entity}")
  public ResponseEntity<Object> list(@PathVariable("entity") String entity,
                                     @RequestParam Map<String, String> query) {
    return dispatch(HttpMethod.GET, entity, null, query, null);
  }

  @GetMapping("/{entity}/{id}")
  public ResponseEntity<Object> get(@PathVariable("entity") String entity, @PathVariable("id") String id) {
    return dispatch(HttpMethod.GET, entity, id, null, null);
  }

  @PostMapping("/{entity}")
  public ResponseEntity<Object> create(@PathVariable("entity") String entity,
                                       @RequestBody(required = false) Map<String, Object> body) {
    return dispatch(HttpMethod.POST, entity, null, null, body);
  }

  @PutMapping("/{entity}/{id}")
  public ResponseEntity<Object> update(@PathVariable("entity") String entity, @PathVariable("id") String id,
                                       @RequestBody(required = false) Map<String, Object> body) {
    return dispatch(HttpMethod.PUT, entity, id, null, body);
  }

  @DeleteMapping("/{entity}/{id}")
  public ResponseEntity<Object> delete(@PathVariable("entity") String entity, @PathVariable("id") String id) {
    return dispatch(HttpMethod.DELETE, entity, id, null, null);
  }

  ResponseEntity<Object> dispatch(HttpMethod method, String entity, String id,
                                  Map<String, String> query, Map<String, Object> body) {
    ApiSurface surface = polydata.api(entity);
    String path = "/api/" + entity + (id == null ? "" : "/:id");
    RestRoute route = (surface == null) ? null : surface.route(method, path);
    if (route == null) {
      return toEntity(ApiErrors.error(404, "NOT_FOUND", "No route " + method + " " + path));
    }
    Map<String, String> pathParams = (id == null) ? Map.of() : Map.of("id", id);
    return toEntity(route.handler().handle(RestRequest.of(pathParams, query, body)));
  }

  static ResponseEntity<Object> toEntity(RestResponse r) {
    if (r.body() == null) return ResponseEntity.status(r.status()).build();
    return ResponseEntity.status(r.status()).body(r.body());
  }
}
