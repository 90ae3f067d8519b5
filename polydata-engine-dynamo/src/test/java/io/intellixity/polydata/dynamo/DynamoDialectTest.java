package io.intellixity.polydata.dynamo;

import io.intellixity.polydata.dynamo.DynamoStatement.Action;
import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.query.OrderBy;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.query.QueryKind;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DynamoDialectTest {
  private final DynamoDialect d = new DynamoDialect();

  private static QueryDescriptor q(QueryKind kind) {
    return QueryDescriptor.empty().withKind(kind).withTarget("users");
  }

  @Test
  void predicateOnKeyReadsOneItem() {
    DynamoStatement st = d.compile(q(QueryKind.SELECT).withWhere(Map.of("id", "u1")).withColumns(List.of("name")));

    assertEquals(Action.GET_ITEM, st.action());
    assertEquals(Map.of("id", "u1"), st.key());
    assertEquals("#n0", st.projection());
    assertEquals(Map.of("#n0", "name"), st.names());
  }

  @Test
  void otherPredicatesScanWithFilter() {
    Map<String, Object> where = new LinkedHashMap<>();
    where.put("status", "active");
    where.put("deleted_at", null);
    DynamoStatement st = d.compile(q(QueryKind.SELECT)
        .withWhere(where)
        .withOrderBy(List.of(new OrderBy("age", OrderBy.Direction.DESC)))
        .withLimit(10)
        .withOffset(5));

    assertEquals(Action.SCAN, st.action());
    assertEquals("#n0 = :v0 AND (attribute_not_exists(#n1) OR #n1 = :v1)", st.filter());
    assertEquals("status", st.names().get("#n0"));
    assertEquals("deleted_at", st.names().get("#n1"));
    assertEquals("active", st.values().get(":v0"));
    assertTrue(st.values().containsKey(":v1"));
    assertNull(st.values().get(":v1"));
    assertNull(st.limit(), "scan limit applies before filtering, so paging stays client-side");
    assertEquals(10, st.take());
    assertEquals(5, st.offset());
    assertEquals(List.of(new OrderBy("age", OrderBy.Direction.DESC)), st.orderBy());
  }

  @Test
  void singleRowScanTakesOne() {
    DynamoStatement st = d.compile(q(QueryKind.SELECT).withWhere(Map.of("email", "a@b.c")).withSingle(true));
    assertEquals(1, st.take());
  }

  @Test
  void insertGuardsAgainstOverwrite() {
    DynamoStatement st = d.compile(q(QueryKind.INSERT).withData(Map.of("id", "u1", "name", "Ada")));

    assertEquals(Action.PUT_ITEM, st.action());
    assertEquals("attribute_not_exists(#n0)", st.condition());
    assertEquals(Map.of("#n0", "id"), st.names());
  }

  @Test
  void updateByKeyIsConditionedOnExistence() {
    Map<String, Object> where = new LinkedHashMap<>();
    where.put("id", "u1");
    where.put("status", "pending");
    DynamoStatement st = d.compile(q(QueryKind.UPDATE).withWhere(where).withData(Map.of("status", "active")));

    assertEquals(Action.UPDATE_ITEM, st.action());
    assertEquals("SET #n0 = :v0", st.update());
    assertEquals(Map.of("id", "u1"), st.key());
    assertEquals("attribute_exists(#n1) AND #n0 = :v1", st.condition());
    assertEquals("active", st.values().get(":v0"));
    assertEquals("pending", st.values().get(":v1"));
    assertNull(st.filter());
  }

  @Test
  void keylessDeleteCarriesFilterOnly() {
    DynamoStatement st = d.compile(q(QueryKind.DELETE).withWhere(Map.of("status", "gone")));
    assertEquals(Action.DELETE_ITEM, st.action());
    assertFalse(st.hasKey());
    assertEquals("#n0 = :v0", st.filter());
  }

  @Test
  void registeredCompositeKeyDrivesAddressing() {
    d.registerKey("users", List.of("tenant", "id"));
    DynamoStatement partial = d.compile(q(QueryKind.SELECT).withWhere(Map.of("id", "u1")));
    assertEquals(Action.SCAN, partial.action());

    Map<String, Object> full = new LinkedHashMap<>();
    full.put("tenant", "t1");
    full.put("id", "u1");
    assertEquals(Action.GET_ITEM, d.compile(q(QueryKind.SELECT).withWhere(full)).action());
  }

  @Test
  void unsupportedShapesAreRejected() {
    assertThrows(UnsupportedQueryException.class,
        () -> d.compile(q(QueryKind.UPDATE).withWhere(Map.of("id", "u1")).withData(Map.of("id", "u2"))));
    assertThrows(UnsupportedQueryException.class,
        () -> d.compile(q(QueryKind.SELECT).withGroupBy(List.of("status"))));
    assertThrows(UnsupportedQueryException.class,
        () -> d.compile(q(QueryKind.INSERT).withData(Map.of("name", "no key"))));
    assertThrows(UnsupportedQueryException.class, () -> d.compile(QueryDescriptor.empty().withTarget("users")));
  }
}
