package io.intellixity.polydata.dynamo;

import io.intellixity.polydata.error.ValidationException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Plain Java values to and from DynamoDB attribute values.
 * <p>
 * Numbers read back as {@link Long} when integral and within range, else {@link BigDecimal}.
 * UUIDs, enums and temporals are written as strings.
 */
public final class AttributeValues {
  private AttributeValues() {}

  public static Map<String, AttributeValue> toItem(Map<String, ?> values) {
    Map<String, AttributeValue> out = new LinkedHashMap<>();
    if (values == null) return out;
    for (Map.Entry<String, ?> e : values.entrySet()) out.put(e.getKey(), toAttribute(e.getValue()));
    return out;
  }

  public static Map<String, Object> fromItem(Map<String, AttributeValue> item) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (item == null) return out;
    for (Map.Entry<String, AttributeValue> e : item.entrySet()) out.put(e.getKey(), toJava(e.getValue()));
    return out;
  }

  public static AttributeValue toAttribute(Object v) {
    if (v == null) return AttributeValue.fromNul(true);
    if (v instanceof AttributeValue av) return av;
    if (v instanceof CharSequence s) return AttributeValue.fromS(s.toString());
    if (v instanceof Boolean b) return AttributeValue.fromBool(b);
    if (v instanceof BigDecimal d) return AttributeValue.fromN(d.toPlainString());
    if (v instanceof Number n) return AttributeValue.fromN(n.toString());
    if (v instanceof byte[] bytes) return AttributeValue.fromB(SdkBytes.fromByteArray(bytes));
    if (v instanceof UUID || v instanceof Enum<?> || v instanceof TemporalAccessor) {
      return AttributeValue.fromS(v.toString());
    }
    if (v instanceof Map<?, ?> m) {
      Map<String, AttributeValue> out = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), toAttribute(e.getValue()));
      return AttributeValue.fromM(out);
    }
    if (v instanceof Collection<?> c) {
      List<AttributeValue> out = new ArrayList<>(c.size());
      for (Object x : c) out.add(toAttribute(x));
      return AttributeValue.fromL(out);
    }
    throw new ValidationException("Unsupported attribute value type: " + v.getClass().getName());
  }

  public static Object toJava(AttributeValue av) {
    if (av == null) return null;
    return switch (av.type()) {
      case S -> av.s();
      case N -> number(av.n());
      case BOOL -> av.bool();
      case NUL -> null;
      case B -> av.b().asByteArray();
      case M -> fromItem(av.m());
      case L -> {
        List<Object> out = new ArrayList<>(av.l().size());
        for (AttributeValue x : av.l()) out.add(toJava(x));
        yield out;
      }
      case SS -> List.copyOf(av.ss());
      case NS -> {
        List<Object> out = new ArrayList<>(av.ns().size());
        for (String n : av.ns()) out.add(number(n));
        yield out;
      }
      case BS -> {
        List<Object> out = new ArrayList<>(av.bs().size());
        for (SdkBytes b : av.bs()) out.add(b.asByteArray());
        yield out;
      }
      default -> throw new ValidationException("Unknown attribute value type: " + av.type());
    };
  }

  static Number number(String n) {
    BigDecimal d = new BigDecimal(n);
    if (d.stripTrailingZeros().scale() <= 0) {
      BigInteger i = d.toBigInteger();
      if (i.bitLength() < 64) return i.longValue();
    }
    return d;
  }
}
