package io.intellixity.polydata.web.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.schema.FieldDef;
import io.intellixity.polydata.schema.IndexDef;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SemanticType;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entities served by the host, read from a JSON document:
 * <pre>
 * {"schemas": [
 *   {"name": "users", "provider": "postgresql",
 *    "fields": [{"name": "id", "type": "uuid", "primaryKey": true},
 *               {"name": "email", "type": "string", "unique": true, "nullable": false}],
 *    "indexes": [{"fields": ["email"]}]}
 * ]}
 * </pre>
 * {@code provider} is optional and defaults to the engine's default provider.
 */
public final class SchemaCatalog {
  private final List<Entry> entries;

  public SchemaCatalog(List<Entry> entries) {
    this.entries = List.copyOf(entries);
  }

  public static SchemaCatalog empty() {
    return new SchemaCatalog(List.of());
  }

  public List<Entry> entries() {
    return entries;
  }

  public static SchemaCatalog read(InputStream in, ObjectMapper mapper) throws IOException {
    Objects.requireNonNull(in, "in");
    CatalogDocument doc = mapper.readValue(in, CatalogDocument.class);
    List<Entry> out = new ArrayList<>();
    if (doc.schemas() != null) {
      for (SchemaDocument s : doc.schemas()) out.add(new Entry(s.provider(), s.toDescriptor()));
    }
    return new SchemaCatalog(out);
  }

  /** One entity; {@code provider} is {@code null} for the default provider. */
  public record Entry(String provider, SchemaDescriptor schema) {
    public Entry {
      Objects.requireNonNull(schema, "schema");
    }
  }

  record CatalogDocument(List<SchemaDocument> schemas) {}

  record SchemaDocument(
      String name,
      String provider,
      List<FieldDocument> fields,
      List<IndexDocument> indexes,
      List<String> constraints,
      List<String> primaryKey
  ) {
    SchemaDescriptor toDescriptor() {
      if (name == null || name.isBlank()) throw new ValidationException("Schema without a name in catalog");
      SchemaDescriptor.Builder b = SchemaDescriptor.builder(name);
      if (fields != null) for (FieldDocument f : fields) b.field(f.toField(name));
      if (indexes != null) for (IndexDocument i : indexes) b.index(i.toIndex(name));
      if (constraints != null) constraints.forEach(b::constraint);
      if (primaryKey != null) b.primaryKey(primaryKey.toArray(String[]::new));
      SchemaDescriptor d = b.build();
      d.validate();
      return d;
    }
  }

  record FieldDocument(
      String name,
      String type,
      Boolean nullable,
      boolean unique,
      boolean primaryKey,
      boolean autoIncrement,
      @JsonProperty("default") Object defaultValue
  ) {
    FieldDef toField(String schema) {
      if (name == null || type == null) {
        throw new ValidationException("Field of '" + schema + "' needs a name and a type");
      }
      SemanticType t;
      try {
        t = SemanticType.parse(type);
      } catch (IllegalArgumentException e) {
        throw new ValidationException("Unknown type '" + type + "' for " + schema + "." + name, e);
      }
      FieldDef f = FieldDef.of(name, t);
      if (Boolean.FALSE.equals(nullable)) f = f.notNull();
      if (unique) f = f.withUnique();
      if (primaryKey) f = f.withPrimaryKey();
      if (autoIncrement) f = f.withAutoIncrement();
      if (defaultValue != null) f = f.withDefault(defaultValue);
      return f;
    }
  }

  record IndexDocument(String name, List<String> fields, boolean unique) {
    IndexDef toIndex(String schema) {
      if (fields == null || fields.isEmpty()) throw new ValidationException("Index of '" + schema + "' lists no fields");
      return new IndexDef(name, fields, unique);
    }
  }
}
