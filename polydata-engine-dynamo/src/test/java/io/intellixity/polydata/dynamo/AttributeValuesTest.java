package io.intellixity.polydata.dynamo;

import io.intellixity.polydata.error.ValidationException;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class AttributeValuesTest {

  @Test
  void scalarsMapToAttributeTypes() {
    assertEquals(AttributeValue.fromS("x"), AttributeValues.toAttribute("x"));
    assertEquals(AttributeValue.fromN("42"), AttributeValues.toAttribute(42));
    assertEquals(AttributeValue.fromN("0.10"), AttributeValues.toAttribute(new BigDecimal("0.10")));
    assertEquals(AttributeValue.fromBool(true), AttributeValues.toAttribute(true));
    assertEquals(AttributeValue.fromNul(true), AttributeValues.toAttribute(null));
    UUID id = UUID.randomUUID();
    assertEquals(AttributeValue.fromS(id.toString()), AttributeValues.toAttribute(id));
  }

  @Test
  void nestedValuesRoundTripAsPlainCollections() {
    Map<String, Object> item = Map.of("address", Map.of("city", "Oslo", "zip", 150), "tags", List.of("a", 2));

    Map<String, Object> back = AttributeValues.fromItem(AttributeValues.toItem(item));

    assertEquals(Map.of("city", "Oslo", "zip", 150L), back.get("address"));
    assertEquals(List.of("a", 2L), back.get("tags"));
  }

  @Test
  void numbersReadBackAsLongOrDecimal() {
    assertEquals(7L, AttributeValues.number("7"));
    assertEquals(100L, AttributeValues.number("1E+2"));
    assertEquals(new BigDecimal("2.5"), AttributeValues.number("2.5"));
    assertEquals(new BigDecimal("99999999999999999999"), AttributeValues.number("99999999999999999999"));
  }

  @Test
  void setsBecomeLists() {
    assertEquals(List.of("a", "b"), AttributeValues.toJava(AttributeValue.fromSs(List.of("a", "b"))));
    assertEquals(List.of(1L, 2L), AttributeValues.toJava(AttributeValue.fromNs(List.of("1", "2"))));
  }

  @Test
  void unknownTypesAreRejected() {
    assertThrows(ValidationException.class, () -> AttributeValues.toAttribute(new Object()));
  }
}
