package io.intellixity.polydata.jdbc;

import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.exec.QueryResult;
import io.intellixity.polydata.provider.ProviderKind;
import io.intellixity.polydata.query.OrderBy;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.query.QueryKind;
import io.intellixity.polydata.schema.FieldDef;
import io.intellixity.polydata.schema.IndexDef;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SchemaResult;
import io.intellixity.polydata.schema.SemanticType;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcExecutorTest {
  private static final SchemaDescriptor USERS = SchemaDescriptor.builder("users")
      .field(FieldDef.of("id", SemanticType.STRING).withPrimaryKey())
      .field(FieldDef.of("name", SemanticType.STRING).notNull())
      .field(FieldDef.of("email", SemanticType.STRING).withUnique())
      .field(FieldDef.of("status", SemanticType.STRING))
      .index(IndexDef.on("status"))
      .build();

  private JdbcExecutor executor;

  @BeforeEach
  void setUp() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:jdbc_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1");
    executor = new JdbcExecutor(new JdbcHandle("h2", ds, "test"), ProviderKind.RELATIONAL_A, new H2TestDialect(false));
    executor.ping();
  }

  private static QueryDescriptor q(QueryKind kind) {
    return QueryDescriptor.empty().withKind(kind).withTarget("users");
  }

  private void insert(String id, String name, String email, String status) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("id", id);
    data.put("name", name);
    data.put("email", email);
    data.put("status", status);
    executor.execute(q(QueryKind.INSERT).withData(data));
  }

  @Test
  void ensureSchemaIsIdempotent() {
    SchemaResult first = executor.ensureSchema(USERS);
    SchemaResult second = executor.ensureSchema(USERS);
    assertEquals(new SchemaResult("users", true), first);
    assertEquals(first, second);
  }

  @Test
  void insertWithoutReturningSupportAnswersWithPayload() {
    executor.ensureSchema(USERS);
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("id", "u1");
    data.put("name", "Ada");
    QueryResult r = executor.execute(q(QueryKind.INSERT).withData(data).withReturning(List.of("*")));

    assertEquals(1, r.affected());
    assertEquals("u1", r.single().get("id"));
    assertEquals("Ada", r.single().get("name"));
  }

  @Test
  void selectFiltersOrdersAndPages() {
    executor.ensureSchema(USERS);
    insert("u1", "Ada", "ada@example.com", "active");
    insert("u2", "Bob", "bob@example.com", "active");
    insert("u3", "Cy", "cy@example.com", "blocked");

    QueryResult page = executor.execute(q(QueryKind.SELECT)
        .withWhere(Map.of("status", "active"))
        .withOrderBy(List.of(new OrderBy("name", OrderBy.Direction.DESC)))
        .withLimit(1)
        .withOffset(1));

    assertEquals(1, page.size());
    assertEquals("Ada", page.single().get("name"));
  }

  @Test
  void nullPredicateMatchesMissingValues() {
    executor.ensureSchema(USERS);
    insert("u1", "Ada", "ada@example.com", null);
    insert("u2", "Bob", "bob@example.com", "active");

    Map<String, Object> where = new LinkedHashMap<>();
    where.put("status", null);
    QueryResult r = executor.execute(q(QueryKind.SELECT).withColumns(List.of("id")).withWhere(where));
    assertEquals(List.of(Map.of("id", "u1")), r.rows());
  }

  @Test
  void singleDescriptorYieldsAtMostOneRow() {
    executor.ensureSchema(USERS);
    insert("u1", "Ada", "ada@example.com", "active");
    insert("u2", "Bob", "bob@example.com", "active");

    QueryResult r = executor.execute(q(QueryKind.SELECT).withSingle(true));
    assertEquals(1, r.size());

    QueryResult none = executor.execute(q(QueryKind.SELECT).withWhere(Map.of("email", "nobody@example.com")).withSingle(true).withLimit(1));
    assertNull(none.single());
  }

  @Test
  void updateAndDeleteReportAffectedCounts() {
    executor.ensureSchema(USERS);
    insert("u1", "Ada", "ada@example.com", "active");

    QueryResult upd = executor.execute(q(QueryKind.UPDATE).withData(Map.of("name", "Ada L")).withWhere(Map.of("id", "u1")));
    assertEquals(1, upd.affected());
    assertEquals("Ada L", executor.execute(q(QueryKind.SELECT).withWhere(Map.of("id", "u1"))).single().get("name"));

    assertEquals(0, executor.execute(q(QueryKind.DELETE).withWhere(Map.of("id", "missing"))).affected());
    assertEquals(1, executor.execute(q(QueryKind.DELETE).withWhere(Map.of("id", "u1"))).affected());
  }

  @Test
  void uniqueViolationIsValidationError() {
    executor.ensureSchema(USERS);
    insert("u1", "Ada", "ada@example.com", "active");
    assertThrows(ValidationException.class, () -> insert("u2", "Other", "ada@example.com", "active"));
  }

  @Test
  void groupByWithHaving() {
    executor.ensureSchema(USERS);
    insert("u1", "Ada", "ada@example.com", "active");
    insert("u2", "Bob", "bob@example.com", "active");
    insert("u3", "Cy", "cy@example.com", "blocked");

    QueryResult r = executor.execute(q(QueryKind.SELECT)
        .withColumns(List.of("status", "COUNT(*) AS n"))
        .withGroupBy(List.of("status"))
        .withHaving(Map.of("COUNT(*)", 2)));

    assertEquals(1, r.size());
    assertEquals("active", r.single().get("status"));
    assertEquals(2L, ((Number) r.single().get("N")).longValue());
  }

  @Test
  void nativeSqlAcceptsNumberedPlaceholders() {
    executor.ensureSchema(USERS);
    insert("u1", "Ada", "ada@example.com", "active");

    QueryResult r = executor.executeNative("SELECT \"name\" FROM \"users\" WHERE \"id\" = $1", List.of("u1"));
    assertEquals("Ada", r.single().get("name"));

    QueryResult upd = executor.executeNative("UPDATE \"users\" SET \"status\" = ? WHERE \"id\" = ?", List.of("blocked", "u1"));
    assertEquals(1, upd.affected());
  }
}
