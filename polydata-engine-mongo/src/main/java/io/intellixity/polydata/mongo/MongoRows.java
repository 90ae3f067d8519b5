package io.intellixity.polydata.mongo;

import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts driver documents into plain row maps.
 * <p>
 * ObjectIds become their hex string, nested documents become maps and Decimal128 becomes
 * BigDecimal; everything else is passed through.
 */
final class MongoRows {
  private MongoRows() {}

  static List<Map<String, Object>> toRows(Iterable<Document> docs) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (Document d : docs) out.add(toRow(d));
    return out;
  }

  static Map<String, Object> toRow(Map<String, Object> d) {
    Map<String, Object> row = new LinkedHashMap<>(d.size());
    for (Map.Entry<String, Object> e : d.entrySet()) row.put(e.getKey(), toJava(e.getValue()));
    return row;
  }

  @SuppressWarnings("unchecked")
  static Object toJava(Object v) {
    if (v instanceof ObjectId oid) return oid.toHexString();
    if (v instanceof Decimal128 dec) return dec.bigDecimalValue();
    if (v instanceof Map<?, ?> m) return toRow((Map<String, Object>) m);
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object x : l) out.add(toJava(x));
      return out;
    }
    return v;
  }
}
