package io.intellixity.polydata.jdbc.postgres;

import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.jdbc.SqlDialect;
import io.intellixity.polydata.schema.FieldDef;
import io.intellixity.polydata.schema.SemanticType;
import org.postgresql.util.PGobject;

import java.util.EnumMap;
import java.util.Map;

/**
 * PostgreSQL dialect.
 *
 * Keeps only Postgres-specific overrides: {@code $n} placeholders, double-quoted identifiers,
 * RETURNING, and SERIAL/BIGSERIAL for auto-increment keys. Generic SQL rendering lives in
 * {@link SqlDialect}.
 */
public final class PostgresDialect extends SqlDialect {
  private static final Map<SemanticType, String> TYPES = new EnumMap<>(SemanticType.class);

  static {
    TYPES.put(SemanticType.STRING, "VARCHAR(255)");
    TYPES.put(SemanticType.TEXT, "TEXT");
    TYPES.put(SemanticType.INTEGER, "INTEGER");
    TYPES.put(SemanticType.BIGINT, "BIGINT");
    TYPES.put(SemanticType.FLOAT, "REAL");
    TYPES.put(SemanticType.DOUBLE, "DOUBLE PRECISION");
    TYPES.put(SemanticType.BOOLEAN, "BOOLEAN");
    TYPES.put(SemanticType.DATE, "DATE");
    TYPES.put(SemanticType.DATETIME, "TIMESTAMP");
    TYPES.put(SemanticType.JSON, "JSONB");
    TYPES.put(SemanticType.UUID, "UUID");
  }

  @Override public String id() { return "postgres"; }

  @Override public boolean supportsReturning() { return true; }

  @Override
  protected String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String placeholder(int n) {
    return "$" + n;
  }

  @Override
  protected String nativeType(SemanticType type) {
    return TYPES.getOrDefault(type, "VARCHAR(255)");
  }

  @Override
  protected String columnType(FieldDef f) {
    if (!f.autoIncrement()) return nativeType(f.type());
    return switch (f.type()) {
      case INTEGER -> "SERIAL";
      case BIGINT -> "BIGSERIAL";
      default -> throw new ValidationException("Auto-increment requires an integer or bigint field: " + f.name());
    };
  }

  @Override
  public Object fromJdbcValue(Object v) {
    // json/jsonb and other extension types come back as PGobject
    if (v instanceof PGobject pg) return pg.getValue();
    return v;
  }
}
