package io.intellixity.polydata.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.jdbc.SqlStatement.ExecKind;
import io.intellixity.polydata.query.Join;
import io.intellixity.polydata.query.OrderBy;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.schema.FieldDef;
import io.intellixity.polydata.schema.IndexDef;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SemanticType;
import io.intellixity.polydata.spi.Dialect;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Relational dialect base.
 * <p>
 * Provides common rendering for:
 * <ul>
 *   <li>SELECT with projection, joins, equality WHERE, GROUP BY, HAVING, ORDER BY, LIMIT/OFFSET</li>
 *   <li>INSERT / UPDATE / DELETE with optional RETURNING</li>
 *   <li>CREATE TABLE / CREATE INDEX from a {@link SchemaDescriptor}</li>
 * </ul>
 * Engine dialects override hooks for quoting, placeholders, native types, auto-increment and
 * RETURNING support.
 */
public abstract class SqlDialect implements Dialect<SqlStatement> {
  private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern AGGREGATE =
      Pattern.compile("([A-Za-z_]+)\\(\\s*(\\*|[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)?)\\s*\\)");
  private static final JsonMapper JSON = JsonMapper.builder().findAndAddModules().build();

  protected final class RenderCtx {
    private final List<Object> binds = new ArrayList<>();

    public String add(Object value) {
      binds.add(value);
      return placeholder(binds.size());
    }

    public List<Object> binds() { return binds; }
  }

  /** Quote a single identifier part (already validated). */
  protected abstract String quoteIdent(String ident);

  /** Marker for the n-th (1-based) bind. */
  protected abstract String placeholder(int n);

  /** Native column type for a semantic type. */
  protected abstract String nativeType(SemanticType type);

  public abstract boolean supportsReturning();

  /** Whether {@code CREATE INDEX IF NOT EXISTS} is available; otherwise the executor checks metadata first. */
  public boolean supportsCreateIndexIfNotExists() { return true; }

  public String pingSql() { return "SELECT 1"; }

  @Override
  public final SqlStatement compile(QueryDescriptor q) {
    if (q.kind() == null) throw new UnsupportedQueryException("Operation kind must be set before compilation");
    return switch (q.kind()) {
      case SELECT -> renderSelect(q);
      case INSERT -> renderInsert(q);
      case UPDATE -> renderUpdate(q);
      case DELETE -> renderDelete(q);
    };
  }

  protected SqlStatement renderSelect(QueryDescriptor q) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sb = new StringBuilder("SELECT ");
    sb.append(projection(q.columns()));
    sb.append(" FROM ").append(qualified(q.target()));

    for (Join j : q.joins()) {
      sb.append(j.type() == Join.Type.LEFT ? " LEFT JOIN " : " INNER JOIN ")
          .append(qualified(j.table()))
          .append(" ON ")
          .append(j.on());
    }

    appendPredicates(sb, " WHERE ", q.where(), ctx, false);

    if (!q.groupBy().isEmpty()) {
      List<String> cols = new ArrayList<>();
      for (String g : q.groupBy()) cols.add(qualified(g));
      sb.append(" GROUP BY ").append(String.join(", ", cols));
    }

    appendPredicates(sb, " HAVING ", q.having(), ctx, true);

    if (!q.orderBy().isEmpty()) {
      List<String> parts = new ArrayList<>();
      for (OrderBy o : q.orderBy()) parts.add(qualified(o.field()) + " " + o.direction().name());
      sb.append(" ORDER BY ").append(String.join(", ", parts));
    }

    appendLimitOffset(sb, q.limit(), q.offset());
    return new SqlStatement(sb.toString(), ctx.binds(), ExecKind.QUERY);
  }

  protected SqlStatement renderInsert(QueryDescriptor q) {
    RenderCtx ctx = new RenderCtx();
    List<String> cols = new ArrayList<>();
    List<String> vals = new ArrayList<>();
    for (Map.Entry<String, Object> e : q.data().entrySet()) {
      cols.add(qualified(e.getKey()));
      vals.add(ctx.add(e.getValue()));
    }
    String sql = "INSERT INTO " + qualified(q.target())
        + " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", vals) + ")";
    if (q.hasReturning() && supportsReturning()) {
      return new SqlStatement(sql + returningClause(q.returning()), ctx.binds(), ExecKind.QUERY_RETURNING);
    }
    return new SqlStatement(sql, ctx.binds(), supportsReturning() ? ExecKind.UPDATE : ExecKind.UPDATE_GENERATED_KEYS);
  }

  protected SqlStatement renderUpdate(QueryDescriptor q) {
    RenderCtx ctx = new RenderCtx();
    List<String> sets = new ArrayList<>();
    for (Map.Entry<String, Object> e : q.data().entrySet()) {
      sets.add(qualified(e.getKey()) + " = " + ctx.add(e.getValue()));
    }
    StringBuilder sb = new StringBuilder("UPDATE ").append(qualified(q.target()))
        .append(" SET ").append(String.join(", ", sets));
    appendPredicates(sb, " WHERE ", q.where(), ctx, false);
    return dmlWithReturning(q, sb, ctx);
  }

  protected SqlStatement renderDelete(QueryDescriptor q) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sb = new StringBuilder("DELETE FROM ").append(qualified(q.target()));
    appendPredicates(sb, " WHERE ", q.where(), ctx, false);
    return dmlWithReturning(q, sb, ctx);
  }

  private SqlStatement dmlWithReturning(QueryDescriptor q, StringBuilder sb, RenderCtx ctx) {
    if (q.hasReturning() && supportsReturning()) {
      sb.append(returningClause(q.returning()));
      return new SqlStatement(sb.toString(), ctx.binds(), ExecKind.QUERY_RETURNING);
    }
    return new SqlStatement(sb.toString(), ctx.binds(), ExecKind.UPDATE);
  }

  protected String returningClause(List<String> returning) {
    return " RETURNING " + projection(returning);
  }

  /** LIMIT/OFFSET rendered as validated integer literals. */
  protected void appendLimitOffset(StringBuilder sb, Integer limit, Integer offset) {
    if (limit != null) sb.append(" LIMIT ").append(nonNegative("limit", limit));
    if (offset != null) sb.append(" OFFSET ").append(nonNegative("offset", offset));
  }

  protected static int nonNegative(String what, Integer v) {
    if (v < 0) throw new UnsupportedQueryException(what + " must be >= 0: " + v);
    return v;
  }

  private void appendPredicates(StringBuilder sb, String keyword, Map<String, Object> preds, RenderCtx ctx,
                                boolean allowAggregates) {
    if (preds.isEmpty()) return;
    List<String> parts = new ArrayList<>();
    for (Map.Entry<String, Object> e : preds.entrySet()) {
      String lhs = allowAggregates ? aggregateOrColumn(e.getKey()) : qualified(e.getKey());
      if (e.getValue() == null) parts.add(lhs + " IS NULL");
      else parts.add(lhs + " = " + ctx.add(e.getValue()));
    }
    sb.append(keyword).append(String.join(" AND ", parts));
  }

  /** Column list; plain or dotted identifiers are quoted, anything else is emitted verbatim. */
  protected String projection(List<String> columns) {
    if (columns.isEmpty()) return "*";
    List<String> out = new ArrayList<>();
    for (String c : columns) {
      String t = c.trim();
      out.add(isIdentifierPath(t) ? qualified(t) : t);
    }
    return String.join(", ", out);
  }

  private String aggregateOrColumn(String key) {
    var m = AGGREGATE.matcher(key.trim());
    if (m.matches()) {
      String arg = m.group(2);
      return m.group(1).toUpperCase(Locale.ROOT) + "(" + ("*".equals(arg) ? "*" : qualified(arg)) + ")";
    }
    return qualified(key);
  }

  /**
   * Validate and quote a possibly dotted identifier ({@code table.column}, {@code table.*}).
   *
   * @throws UnsupportedQueryException on anything that is not an identifier path
   */
  public final String qualified(String name) {
    String n = name == null ? "" : name.trim();
    if ("*".equals(n)) return "*";
    String[] parts = n.split("\\.", -1);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < parts.length; i++) {
      String p = parts[i];
      if (i > 0) sb.append('.');
      if (i == parts.length - 1 && i > 0 && "*".equals(p)) {
        sb.append('*');
        continue;
      }
      if (!IDENT.matcher(p).matches()) throw new UnsupportedQueryException("Invalid identifier: '" + name + "'");
      sb.append(quoteIdent(p));
    }
    return sb.toString();
  }

  private static boolean isIdentifierPath(String s) {
    if ("*".equals(s)) return true;
    String[] parts = s.split("\\.", -1);
    for (int i = 0; i < parts.length; i++) {
      if (i == parts.length - 1 && i > 0 && "*".equals(parts[i])) continue;
      if (!IDENT.matcher(parts[i]).matches()) return false;
    }
    return true;
  }

  // ---------------------------------------------------------------- DDL

  public String renderCreateTable(SchemaDescriptor schema) {
    List<String> defs = new ArrayList<>();
    boolean tableKey = !schema.primaryKey().isEmpty();
    for (FieldDef f : schema.fields()) defs.add(columnDefinition(f, tableKey));
    if (tableKey) {
      List<String> keyCols = new ArrayList<>();
      for (String k : schema.primaryKey()) keyCols.add(qualified(k));
      defs.add("PRIMARY KEY (" + String.join(", ", keyCols) + ")");
    }
    defs.addAll(schema.constraints());
    return "CREATE TABLE IF NOT EXISTS " + qualified(schema.name()) + " (" + String.join(", ", defs) + ")";
  }

  public String renderCreateIndex(String table, IndexDef index) {
    List<String> cols = new ArrayList<>();
    for (String c : index.fields()) cols.add(qualified(c));
    return "CREATE " + (index.unique() ? "UNIQUE " : "") + "INDEX "
        + (supportsCreateIndexIfNotExists() ? "IF NOT EXISTS " : "")
        + qualified(index.nameFor(table)) + " ON " + qualified(table) + " (" + String.join(", ", cols) + ")";
  }

  protected String columnDefinition(FieldDef f, boolean tableKey) {
    boolean inlineKey = f.primaryKey() && !tableKey;
    StringBuilder sb = new StringBuilder(qualified(f.name())).append(' ').append(columnType(f));
    if (f.autoIncrement()) sb.append(autoIncrementClause(f));
    if (f.defaultValue() != null) sb.append(" DEFAULT ").append(defaultLiteral(f.defaultValue()));
    if (!f.nullable() && !inlineKey) sb.append(" NOT NULL");
    if (inlineKey) sb.append(" PRIMARY KEY");
    if (f.unique() && !inlineKey) sb.append(" UNIQUE");
    return sb.toString();
  }

  /** Column type; dialects with serial pseudo-types override for auto-increment fields. */
  protected String columnType(FieldDef f) {
    return nativeType(f.type());
  }

  protected String autoIncrementClause(FieldDef f) {
    return "";
  }

  protected String defaultLiteral(Object v) {
    if (v instanceof FieldDef.Expression e) return e.sql();
    if (v instanceof Number || v instanceof Boolean) return String.valueOf(v);
    if (v instanceof CharSequence || v instanceof UUID) return "'" + v.toString().replace("'", "''") + "'";
    throw new ValidationException("Unsupported default value type: " + v.getClass().getName());
  }

  // ---------------------------------------------------------------- values

  /** Driver-facing representation of a bind value. */
  public Object toJdbcValue(Object v) {
    if (v instanceof Map<?, ?> || v instanceof List<?>) {
      try {
        return JSON.writeValueAsString(v);
      } catch (JsonProcessingException e) {
        throw new ValidationException("Value is not JSON-serializable", e);
      }
    }
    if (v instanceof Instant i) return Timestamp.from(i);
    if (v instanceof Enum<?> e) return e.name();
    return v;
  }

  /** Plain Java representation of a column value read from a result set. */
  public Object fromJdbcValue(Object v) {
    return v;
  }
}
