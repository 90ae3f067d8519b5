package io.intellixity.polydata.schema;

import java.util.Objects;

/**
 * One field of a {@link SchemaDescriptor}.
 * <p>
 * {@code defaultValue} is rendered as a quoted literal for strings, raw for numbers and booleans,
 * and verbatim for {@link Expression} (e.g. {@code CURRENT_TIMESTAMP}).
 */
public record FieldDef(
    String name,
    SemanticType type,
    boolean nullable,
    boolean unique,
    Object defaultValue,
    boolean primaryKey,
    boolean autoIncrement
) {
  public FieldDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) throw new IllegalArgumentException("field name is blank");
  }

  public static FieldDef of(String name, SemanticType type) {
    return new FieldDef(name, type, true, false, null, false, false);
  }

  public FieldDef notNull() {
    return new FieldDef(name, type, false, unique, defaultValue, primaryKey, autoIncrement);
  }

  public FieldDef withUnique() {
    return new FieldDef(name, type, nullable, true, defaultValue, primaryKey, autoIncrement);
  }

  public FieldDef withDefault(Object value) {
    return new FieldDef(name, type, nullable, unique, value, primaryKey, autoIncrement);
  }

  /** Primary keys are implicitly NOT NULL. */
  public FieldDef withPrimaryKey() {
    return new FieldDef(name, type, false, unique, defaultValue, true, autoIncrement);
  }

  public FieldDef withAutoIncrement() {
    return new FieldDef(name, type, nullable, unique, defaultValue, primaryKey, true);
  }

  /** Default rendered verbatim. */
  public record Expression(String sql) {
    public Expression {
      Objects.requireNonNull(sql, "sql");
    }
  }
}
