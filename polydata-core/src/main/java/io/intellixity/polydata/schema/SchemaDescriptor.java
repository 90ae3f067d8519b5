package io.intellixity.polydata.schema;

import io.intellixity.polydata.error.ValidationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Abstract definition of an entity: ordered fields, indexes, raw constraints and an optional
 * composite primary key.
 */
public record SchemaDescriptor(
    String name,
    List<FieldDef> fields,
    List<IndexDef> indexes,
    List<String> constraints,
    List<String> primaryKey
) {
  public SchemaDescriptor {
    Objects.requireNonNull(name, "name");
    fields = (fields == null) ? List.of() : List.copyOf(fields);
    indexes = (indexes == null) ? List.of() : List.copyOf(indexes);
    constraints = (constraints == null) ? List.of() : List.copyOf(constraints);
    primaryKey = (primaryKey == null) ? List.of() : List.copyOf(primaryKey);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * @throws ValidationException on blank names, no fields, duplicate field names, several
   *     field-level primary keys without a composite key, or index/key columns that are not fields
   */
  public void validate() {
    if (name.isBlank()) throw new ValidationException("Schema name is blank");
    if (fields.isEmpty()) throw new ValidationException("Schema '" + name + "' declares no fields");
    Set<String> seen = new HashSet<>();
    int fieldPks = 0;
    for (FieldDef f : fields) {
      if (!seen.add(f.name())) throw new ValidationException("Duplicate field '" + f.name() + "' in schema '" + name + "'");
      if (f.primaryKey()) fieldPks++;
    }
    if (fieldPks > 1 && primaryKey.isEmpty()) {
      throw new ValidationException("Schema '" + name + "' declares " + fieldPks
          + " primary key fields; declare a composite primary key instead");
    }
    for (String k : primaryKey) {
      if (!seen.contains(k)) throw new ValidationException("Primary key column '" + k + "' is not a field of '" + name + "'");
    }
    for (IndexDef idx : indexes) {
      for (String c : idx.fields()) {
        if (!seen.contains(c)) throw new ValidationException("Index column '" + c + "' is not a field of '" + name + "'");
      }
    }
  }

  public FieldDef field(String fieldName) {
    for (FieldDef f : fields) if (f.name().equals(fieldName)) return f;
    return null;
  }

  public boolean hasField(String fieldName) {
    return field(fieldName) != null;
  }

  /** Composite key when declared, else the single field-level key, else empty. */
  public List<String> keyFields() {
    if (!primaryKey.isEmpty()) return primaryKey;
    for (FieldDef f : fields) if (f.primaryKey()) return List.of(f.name());
    return List.of();
  }

  /** Single key column used by generated APIs; falls back to {@code id}. */
  public String idField() {
    List<String> k = keyFields();
    return k.isEmpty() ? "id" : k.get(0);
  }

  public boolean compositeKey() {
    return primaryKey.size() > 1;
  }

  public static final class Builder {
    private final String name;
    private final List<FieldDef> fields = new ArrayList<>();
    private final List<IndexDef> indexes = new ArrayList<>();
    private final List<String> constraints = new ArrayList<>();
    private final List<String> primaryKey = new ArrayList<>();

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder field(FieldDef f) { fields.add(Objects.requireNonNull(f, "field")); return this; }
    public Builder field(String fieldName, SemanticType type) { return field(FieldDef.of(fieldName, type)); }
    public Builder index(IndexDef idx) { indexes.add(Objects.requireNonNull(idx, "index")); return this; }
    public Builder constraint(String sql) { constraints.add(Objects.requireNonNull(sql, "constraint")); return this; }
    public Builder primaryKey(String... columns) { primaryKey.addAll(List.of(columns)); return this; }

    public SchemaDescriptor build() {
      return new SchemaDescriptor(name, fields, indexes, constraints, primaryKey);
    }
  }
}
