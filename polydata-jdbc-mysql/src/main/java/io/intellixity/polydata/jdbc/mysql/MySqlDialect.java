package io.intellixity.polydata.jdbc.mysql;

import io.intellixity.polydata.jdbc.SqlDialect;
import io.intellixity.polydata.schema.FieldDef;
import io.intellixity.polydata.schema.SemanticType;

import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * MySQL dialect: {@code ?} placeholders, backtick identifiers, AUTO_INCREMENT, no RETURNING.
 * <p>
 * Inserts ask the driver for generated keys instead; {@code CREATE INDEX} has no
 * {@code IF NOT EXISTS}, so the executor consults JDBC metadata before creating indexes.
 */
public final class MySqlDialect extends SqlDialect {
  /** MySQL's documented "no limit" value for OFFSET without LIMIT. */
  static final String MAX_ROWS = "18446744073709551615";

  private static final Map<SemanticType, String> TYPES = new EnumMap<>(SemanticType.class);

  static {
    TYPES.put(SemanticType.STRING, "VARCHAR(255)");
    TYPES.put(SemanticType.TEXT, "TEXT");
    TYPES.put(SemanticType.INTEGER, "INT");
    TYPES.put(SemanticType.BIGINT, "BIGINT");
    TYPES.put(SemanticType.FLOAT, "FLOAT");
    TYPES.put(SemanticType.DOUBLE, "DOUBLE");
    TYPES.put(SemanticType.BOOLEAN, "BOOLEAN");
    TYPES.put(SemanticType.DATE, "DATE");
    TYPES.put(SemanticType.DATETIME, "DATETIME");
    TYPES.put(SemanticType.JSON, "JSON");
    TYPES.put(SemanticType.UUID, "CHAR(36)");
  }

  @Override public String id() { return "mysql"; }

  @Override public boolean supportsReturning() { return false; }

  @Override public boolean supportsCreateIndexIfNotExists() { return false; }

  @Override
  protected String quoteIdent(String ident) {
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  protected String placeholder(int n) {
    return "?";
  }

  @Override
  protected String nativeType(SemanticType type) {
    return TYPES.getOrDefault(type, "VARCHAR(255)");
  }

  @Override
  protected String autoIncrementClause(FieldDef f) {
    return " AUTO_INCREMENT";
  }

  @Override
  protected void appendLimitOffset(StringBuilder sb, Integer limit, Integer offset) {
    if (limit == null && offset == null) return;
    sb.append(" LIMIT ").append(limit == null ? MAX_ROWS : String.valueOf(nonNegative("limit", limit)));
    if (offset != null) sb.append(" OFFSET ").append(nonNegative("offset", offset));
  }

  @Override
  public Object toJdbcValue(Object v) {
    // CHAR(36) columns
    if (v instanceof UUID u) return u.toString();
    return super.toJdbcValue(v);
  }
}
