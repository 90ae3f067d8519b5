package io.intellixity.polydata.mongo;

import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.mongo.MongoStatement.Action;
import io.intellixity.polydata.query.Join;
import io.intellixity.polydata.query.OrderBy;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.query.QueryKind;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MongoDialectTest {
  private final MongoDialect d = new MongoDialect();

  private static QueryDescriptor q(QueryKind kind, String target) {
    return QueryDescriptor.empty().withKind(kind).withTarget(target);
  }

  @Test
  void selectCompilesToFindWithCursorModifiers() {
    Map<String, Object> where = new LinkedHashMap<>();
    where.put("status", "active");
    where.put("deleted_at", null);
    MongoStatement st = d.compile(q(QueryKind.SELECT, "users")
        .withColumns(List.of("name", "email"))
        .withWhere(where)
        .withOrderBy(List.of(new OrderBy("created_at", OrderBy.Direction.DESC), new OrderBy("name", OrderBy.Direction.ASC)))
        .withLimit(10)
        .withOffset(20));

    assertEquals(Action.FIND, st.action());
    assertEquals("users", st.collection());
    assertEquals(new Document("status", "active").append("deleted_at", null), st.filter());
    assertEquals(new Document("created_at", -1).append("name", 1), st.sort());
    assertEquals(20, st.skip());
    assertEquals(10, st.limit());
    assertEquals(new Document("name", 1).append("email", 1), st.projection());
  }

  @Test
  void starProjectionReturnsWholeDocuments() {
    MongoStatement st = d.compile(q(QueryKind.SELECT, "users").withColumns(List.of("*")));
    assertNull(st.projection());
    assertNull(st.sort());
    assertTrue(st.filter().isEmpty());
  }

  @Test
  void singleRowDescriptorsUseOneVariants() {
    Map<String, Object> byId = Map.of("_id", "abc");
    assertEquals(Action.FIND_ONE, d.compile(q(QueryKind.SELECT, "users").withWhere(byId).withSingle(true)).action());
    assertEquals(Action.UPDATE_ONE, d.compile(q(QueryKind.UPDATE, "users").withWhere(byId)
        .withData(Map.of("name", "x")).withSingle(true)).action());
    assertEquals(Action.DELETE_ONE, d.compile(q(QueryKind.DELETE, "users").withWhere(byId).withSingle(true)).action());
  }

  @Test
  void writesCompileToDriverVerbs() {
    MongoStatement ins = d.compile(q(QueryKind.INSERT, "users").withData(Map.of("name", "Ada")));
    assertEquals(Action.INSERT_ONE, ins.action());
    assertEquals(new Document("name", "Ada"), ins.document());

    MongoStatement upd = d.compile(q(QueryKind.UPDATE, "users")
        .withWhere(Map.of("status", "pending")).withData(Map.of("status", "active")));
    assertEquals(Action.UPDATE_MANY, upd.action());
    assertEquals(new Document("status", "pending"), upd.filter());
    assertEquals(new Document("$set", new Document("status", "active")), upd.document());

    MongoStatement del = d.compile(q(QueryKind.DELETE, "users").withWhere(Map.of("status", "gone")));
    assertEquals(Action.DELETE_MANY, del.action());
    assertEquals(new Document("status", "gone"), del.filter());
  }

  @Test
  void groupByCompilesToAggregatePipeline() {
    MongoStatement st = d.compile(q(QueryKind.SELECT, "orders")
        .withColumns(List.of("customer", "COUNT(*) AS n", "sum(total)"))
        .withWhere(Map.of("status", "paid"))
        .withGroupBy(List.of("customer"))
        .withHaving(Map.of("count(*)", 2))
        .withOrderBy(List.of(new OrderBy("n", OrderBy.Direction.DESC)))
        .withLimit(5));

    assertEquals(Action.AGGREGATE, st.action());
    List<Document> expected = List.of(
        new Document("$match", new Document("status", "paid")),
        new Document("$group", new Document("_id", new Document("customer", "$customer"))
            .append("n", new Document("$sum", 1))
            .append("sum_total", new Document("$sum", "$total"))),
        new Document("$project", new Document("_id", 0).append("customer", "$_id.customer")
            .append("n", 1).append("sum_total", 1)),
        new Document("$match", new Document("n", 2)),
        new Document("$sort", new Document("n", -1)),
        new Document("$limit", 5));
    assertEquals(expected, st.pipeline());
  }

  @Test
  void havingOnUnprojectedAggregateAddsAccumulator() {
    MongoStatement st = d.compile(q(QueryKind.SELECT, "orders")
        .withColumns(List.of("customer"))
        .withGroupBy(List.of("customer"))
        .withHaving(Map.of("MAX(total)", 100)));

    Document group = (Document) st.pipeline().get(0).get("$group");
    assertEquals(new Document("$max", "$total"), group.get("max_total"));
    assertEquals(new Document("$match", new Document("max_total", 100)), st.pipeline().get(2));
  }

  @Test
  void ungroupedColumnIsRejected() {
    QueryDescriptor query = q(QueryKind.SELECT, "orders")
        .withColumns(List.of("customer", "status"))
        .withGroupBy(List.of("customer"));
    assertThrows(UnsupportedQueryException.class, () -> d.compile(query));
  }

  @Test
  void joinsAreRejected() {
    QueryDescriptor query = q(QueryKind.SELECT, "users")
        .withJoins(List.of(new Join(Join.Type.INNER, "orders", "orders.user_id = users.id")));
    assertThrows(UnsupportedQueryException.class, () -> d.compile(query));
  }

  @Test
  void operatorInjectionIsRejected() {
    assertThrows(UnsupportedQueryException.class,
        () -> d.compile(q(QueryKind.SELECT, "users").withWhere(Map.of("$where", "sleep(1000)"))));
    assertThrows(UnsupportedQueryException.class,
        () -> d.compile(q(QueryKind.SELECT, "users").withWhere(Map.of("password", Map.of("$ne", "")))));
    assertThrows(UnsupportedQueryException.class,
        () -> d.compile(q(QueryKind.SELECT, "$cmd")));
  }
}
