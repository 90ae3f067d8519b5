package io.intellixity.polydata.mongo;

import com.mongodb.MongoCommandException;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.polydata.error.DriverException;
import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.provider.ProviderKind;
import io.intellixity.polydata.query.Join;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.query.QueryKind;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/** Paths that fail before any server round trip; the client connects lazily and never reaches a server. */
final class MongoExecutorTest {
  private MongoClient client;
  private MongoExecutor executor;

  @BeforeEach
  void open() {
    client = MongoClients.create("mongodb://127.0.0.1:1/?serverSelectionTimeoutMS=50");
    executor = new MongoExecutor(new MongoHandle("docs", client, "pwa_app"), ProviderKind.DOCUMENT);
  }

  @AfterEach
  void close() {
    executor.close();
  }

  @Test
  void capabilitiesExcludeJoinsAndReturning() {
    assertFalse(executor.capabilities().joins());
    assertFalse(executor.capabilities().returning());
    assertTrue(executor.capabilities().aggregation());
    assertEquals("pwa_app", executor.handle().namespace());
  }

  @Test
  void joinsFailBeforeExecution() {
    QueryDescriptor q = QueryDescriptor.empty().withKind(QueryKind.SELECT).withTarget("users")
        .withJoins(List.of(new Join(Join.Type.INNER, "orders", "orders.user_id = users.id")));
    assertThrows(UnsupportedQueryException.class, () -> executor.execute(q));
  }

  @Test
  void nativeOperationsRejectPositionalParams() {
    Map<String, Object> op = Map.of("collection", "users", "action", "find");
    assertThrows(UnsupportedQueryException.class, () -> executor.executeNative(op, List.of(1)));
    assertThrows(UnsupportedQueryException.class, () -> executor.executeNative("db.users.find()", List.of()));
  }

  @Test
  void nativeOperationMapIsParsed() {
    MongoStatement st = executor.toNative(Map.of("collection", "users", "action", "deleteMany"), List.of());
    assertEquals(MongoStatement.Action.DELETE_MANY, st.action());
  }

  @Test
  void duplicateKeyTranslatesToValidation() {
    BsonDocument response = new BsonDocument("ok", new BsonInt32(0))
        .append("code", new BsonInt32(11000))
        .append("errmsg", new BsonString("E11000 duplicate key error"));
    MongoCommandException dup = new MongoCommandException(response, new ServerAddress());
    assertTrue(MongoExecutor.isDuplicateKey(dup));
    assertInstanceOf(ValidationException.class, executor.translate("INSERT", dup));

    assertInstanceOf(DriverException.class, executor.translate("INSERT", new IllegalStateException("boom")));
  }
}
