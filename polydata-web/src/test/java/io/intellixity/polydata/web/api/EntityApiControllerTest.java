package io.intellixity.polydata.web.api;

import io.intellixity.polydata.Polydata;
import io.intellixity.polydata.api.HttpMethod;
import io.intellixity.polydata.notify.Subscription;
import io.intellixity.polydata.web.WebFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class EntityApiControllerTest {
  private Polydata db;
  private EntityApiController controller;

  @BeforeEach
  void open() {
    db = WebFixtures.engine();
    controller = new EntityApiController(db);
  }

  @AfterEach
  void close() {
    db.close();
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> body(ResponseEntity<Object> r) {
    return (Map<String, Object>) r.getBody();
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> data(ResponseEntity<Object> r) {
    return (Map<String, Object>) body(r).get("data");
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> error(ResponseEntity<Object> r) {
    return (Map<String, Object>) body(r).get("error");
  }

  @Test
  void createThenGetRoundTripsThroughTheGeneratedRoutes() {
    ResponseEntity<Object> created = controller.create("users", Map.of("name", "Ada", "email", "ada@example.com"));
    assertEquals(201, created.getStatusCode().value());
    String id = (String) data(created).get("id");
    assertNotNull(id);

    ResponseEntity<Object> got = controller.get("users", id);
    assertEquals(200, got.getStatusCode().value());
    assertEquals("Ada", data(got).get("name"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void listCarriesPaginationAndFilters() {
    controller.create("users", Map.of("name", "Ada", "age", 36));
    controller.create("users", Map.of("name", "Linus", "age", 54));

    ResponseEntity<Object> r = controller.list("users", Map.of("age", "36", "limit", "5"));
    assertEquals(200, r.getStatusCode().value());
    List<Map<String, Object>> rows = (List<Map<String, Object>>) body(r).get("data");
    assertEquals(1, rows.size());
    assertEquals("Ada", rows.get(0).get("name"));
    assertEquals(Map.of("page", 1, "limit", 5, "total", 1), body(r).get("pagination"));
  }

  @Test
  void updateAndDelete() {
    String id = (String) data(controller.create("users", Map.of("name", "Ada"))).get("id");

    ResponseEntity<Object> updated = controller.update("users", id, Map.of("name", "Ada L."));
    assertEquals(200, updated.getStatusCode().value());
    assertEquals("Ada L.", data(updated).get("name"));

    ResponseEntity<Object> deleted = controller.delete("users", id);
    assertEquals(204, deleted.getStatusCode().value());
    assertNull(deleted.getBody());
    assertEquals(404, controller.get("users", id).getStatusCode().value());
  }

  @Test
  void writesPublishOnTheEntityChannel() throws InterruptedException {
    try (Subscription created = db.subscribe("users:created")) {
      controller.create("users", Map.of("name", "Ada"));
      Object payload = created.poll(Duration.ofSeconds(1));
      assertInstanceOf(Map.class, payload);
      assertEquals("Ada", ((Map<?, ?>) payload).get("name"));
    }
  }

  @Test
  void unknownEntityIsNotFound() {
    ResponseEntity<Object> r = controller.dispatch(HttpMethod.GET, "widgets", null, Map.of(), null);
    assertEquals(404, r.getStatusCode().value());
    assertEquals("NOT_FOUND", error(r).get("category"));
  }

  @Test
  void invalidPayloadIsBadRequest() {
    ResponseEntity<Object> missing = controller.create("users", Map.of("email", "x@example.com"));
    assertEquals(400, missing.getStatusCode().value());
    assertEquals("VALIDATION_ERROR", error(missing).get("category"));

    ResponseEntity<Object> unknown = controller.create("users", Map.of("name", "Ada", "role", "admin"));
    assertEquals(400, unknown.getStatusCode().value());
  }

  @Test
  void missingBodyIsBadRequest() {
    ResponseEntity<Object> r = controller.create("users", null);
    assertEquals(400, r.getStatusCode().value());
  }
}
