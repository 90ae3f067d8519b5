package io.intellixity.polydata.schema;

import io.intellixity.polydata.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaDescriptorTest {

  @Test
  void rejectsDuplicateFieldNames() {
    SchemaDescriptor s = SchemaDescriptor.builder("users")
        .field("name", SemanticType.STRING)
        .field("name", SemanticType.TEXT)
        .build();
    assertThrows(ValidationException.class, s::validate);
  }

  @Test
  void rejectsSeveralFieldKeysWithoutCompositeKey() {
    SchemaDescriptor.Builder b = SchemaDescriptor.builder("memberships")
        .field(FieldDef.of("user_id", SemanticType.UUID).withPrimaryKey())
        .field(FieldDef.of("team_id", SemanticType.UUID).withPrimaryKey());
    assertThrows(ValidationException.class, () -> b.build().validate());
    assertDoesNotThrow(() -> b.primaryKey("user_id", "team_id").build().validate());
  }

  @Test
  void rejectsIndexesOnUnknownColumns() {
    SchemaDescriptor s = SchemaDescriptor.builder("users")
        .field("email", SemanticType.STRING)
        .index(IndexDef.on("mail"))
        .build();
    assertThrows(ValidationException.class, s::validate);
  }

  @Test
  void keyFieldsPreferCompositeKey() {
    SchemaDescriptor single = SchemaDescriptor.builder("users")
        .field(FieldDef.of("uid", SemanticType.UUID).withPrimaryKey())
        .build();
    assertEquals(List.of("uid"), single.keyFields());
    assertEquals("uid", single.idField());
    assertFalse(single.field("uid").nullable());

    SchemaDescriptor none = SchemaDescriptor.builder("logs").field("line", SemanticType.TEXT).build();
    assertEquals("id", none.idField());
    assertEquals("idx_logs_line", IndexDef.on("line").nameFor("logs"));
  }

  @Test
  void parsesSemanticTypesCaseInsensitively() {
    assertEquals(SemanticType.DATETIME, SemanticType.parse("DateTime"));
    assertEquals("uuid", SemanticType.UUID.id());
    assertThrows(IllegalArgumentException.class, () -> SemanticType.parse("money"));
  }
}
