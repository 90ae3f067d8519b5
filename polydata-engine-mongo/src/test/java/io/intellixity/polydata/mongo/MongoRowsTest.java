package io.intellixity.polydata.mongo;

import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MongoRowsTest {

  @Test
  void driverTypesBecomePlainValues() {
    ObjectId oid = new ObjectId();
    Document d = new Document("_id", oid)
        .append("price", new Decimal128(new BigDecimal("9.99")))
        .append("address", new Document("city", "Oslo"))
        .append("tags", List.of(new ObjectId(oid.toHexString()), "x"))
        .append("note", null);

    Map<String, Object> row = MongoRows.toRow(d);

    assertEquals(oid.toHexString(), row.get("_id"));
    assertEquals(new BigDecimal("9.99"), row.get("price"));
    assertEquals(Map.of("city", "Oslo"), row.get("address"));
    assertFalse(row.get("address") instanceof Document);
    assertEquals(List.of(oid.toHexString(), "x"), row.get("tags"));
    assertTrue(row.containsKey("note"));
    assertEquals(List.of("_id", "price", "address", "tags", "note"), List.copyOf(row.keySet()));
  }
}
