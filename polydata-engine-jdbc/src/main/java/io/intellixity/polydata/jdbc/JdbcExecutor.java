package io.intellixity.polydata.jdbc;

import io.intellixity.polydata.error.DriverException;
import io.intellixity.polydata.error.PolydataException;
import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.exec.QueryResult;
import io.intellixity.polydata.jdbc.SqlStatement.ExecKind;
import io.intellixity.polydata.provider.Capabilities;
import io.intellixity.polydata.provider.ProviderKind;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.query.QueryKind;
import io.intellixity.polydata.schema.FieldDef;
import io.intellixity.polydata.schema.IndexDef;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SchemaResult;
import io.intellixity.polydata.spi.AbstractProviderExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Relational executor: runs compiled {@link SqlStatement}s on a pooled {@link DataSource}.
 * <p>
 * Each call borrows one connection in auto-commit mode and returns it before completing.
 * Providers without RETURNING answer inserts with the written payload merged with the
 * generated keys, and updates/deletes with the affected count.
 */
public final class JdbcExecutor extends AbstractProviderExecutor<SqlStatement, JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcExecutor.class);

  private final SqlDialect sql;
  private final DataSource ds;
  private final AutoCloseable pool;
  private final JdbcRowReader rows;
  private final Map<String, SchemaDescriptor> schemas = new ConcurrentHashMap<>();

  public JdbcExecutor(JdbcHandle handle, ProviderKind kind, SqlDialect dialect) {
    this(handle, kind, dialect, null);
  }

  /** @param pool closed with the executor; {@code null} when the caller owns the data source */
  public JdbcExecutor(JdbcHandle handle, ProviderKind kind, SqlDialect dialect, AutoCloseable pool) {
    super(handle, kind, dialect, Capabilities.of(true, dialect.supportsReturning(), true, true));
    this.sql = dialect;
    this.ds = handle.client();
    this.pool = pool;
    this.rows = new JdbcRowReader(dialect);
  }

  @Override
  public void ping() {
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.execute(sql.pingSql());
    } catch (SQLException e) {
      throw translate("PING", e);
    }
  }

  @Override
  protected QueryResult run(QueryDescriptor query, SqlStatement stmt) {
    String op = query.kind().name();
    try {
      return exec(op, stmt, query);
    } catch (SQLException e) {
      throw translate(op, e);
    }
  }

  @Override
  protected QueryResult runNative(SqlStatement stmt) {
    try {
      return exec("NATIVE", stmt, null);
    } catch (SQLException e) {
      throw translate("NATIVE", e);
    }
  }

  @Override
  protected SqlStatement toNative(Object statement, List<Object> params) {
    if (statement instanceof SqlStatement s) {
      return params.isEmpty() ? s : new SqlStatement(s.sql(), params, s.execKind());
    }
    if (statement instanceof CharSequence text) {
      String t = text.toString();
      return new SqlStatement(t, params, returnsRows(t) ? ExecKind.QUERY : ExecKind.UPDATE);
    }
    throw new UnsupportedQueryException("Relational providers accept SQL text or SqlStatement, got "
        + statement.getClass().getName());
  }

  @Override
  protected SchemaResult doEnsureSchema(SchemaDescriptor schema) {
    String table = schema.name();
    try (Connection c = ds.getConnection()) {
      executeDdl(c, "CREATE_TABLE", sql.renderCreateTable(schema));
      for (IndexDef idx : schema.indexes()) {
        if (!sql.supportsCreateIndexIfNotExists() && indexExists(c, table, idx.nameFor(table))) continue;
        executeDdl(c, "CREATE_INDEX", sql.renderCreateIndex(table, idx));
      }
    } catch (SQLException e) {
      throw translate("ENSURE_SCHEMA", e);
    }
    schemas.put(table, schema);
    return new SchemaResult(table, true);
  }

  @Override
  protected PolydataException translate(String operation, Exception e) {
    if (e instanceof SQLException se && isConstraintViolation(se)) {
      return new ValidationException("Constraint violation on " + operation
          + " (provider=" + id() + " sqlState=" + se.getSQLState() + ")", e);
    }
    return super.translate(operation, e);
  }

  @Override
  public void close() {
    if (pool == null) return;
    try {
      pool.close();
    } catch (Exception e) {
      throw new DriverException(id(), "CLOSE", e);
    }
  }

  private QueryResult exec(String op, SqlStatement stmt, QueryDescriptor query) throws SQLException {
    SqlStatement jdbc = PlaceholderCompiler.toJdbc(stmt);
    long start = System.nanoTime();
    debugSql(op, jdbc);
    try (Connection c = ds.getConnection()) {
      QueryResult r = switch (jdbc.execKind()) {
        case QUERY, QUERY_RETURNING -> {
          try (PreparedStatement ps = c.prepareStatement(jdbc.sql())) {
            bindAll(ps, jdbc);
            try (ResultSet rs = ps.executeQuery()) {
              yield QueryResult.ofRows(rows.readAll(rs));
            }
          }
        }
        case UPDATE -> {
          try (PreparedStatement ps = c.prepareStatement(jdbc.sql())) {
            bindAll(ps, jdbc);
            yield QueryResult.ofCount(ps.executeUpdate());
          }
        }
        case UPDATE_GENERATED_KEYS -> {
          try (PreparedStatement ps = c.prepareStatement(jdbc.sql(), Statement.RETURN_GENERATED_KEYS)) {
            bindAll(ps, jdbc);
            int n = ps.executeUpdate();
            List<Map<String, Object>> keys;
            try (ResultSet rs = ps.getGeneratedKeys()) {
              keys = (rs == null) ? List.of() : rows.readAll(rs);
            }
            yield writtenPayload(query, n, keys);
          }
        }
      };
      debugDone(op, jdbc, r, System.nanoTime() - start);
      return r;
    }
  }

  private QueryResult writtenPayload(QueryDescriptor query, int affected, List<Map<String, Object>> keys) {
    if (query == null || query.kind() != QueryKind.INSERT || !query.hasReturning()) {
      return QueryResult.ofCount(affected);
    }
    Map<String, Object> row = new LinkedHashMap<>(query.data());
    if (!keys.isEmpty()) {
      for (Map.Entry<String, Object> k : keys.get(0).entrySet()) {
        String name = generatedKeyName(query.target(), k.getKey());
        if (!containsIgnoreCase(row, name)) row.put(name, k.getValue());
      }
    }
    return QueryResult.of(List.of(row), affected);
  }

  /** Drivers label generated keys inconsistently (MySQL: GENERATED_KEY); map them onto schema fields. */
  private String generatedKeyName(String table, String label) {
    SchemaDescriptor s = schemas.get(table);
    if (s != null) {
      for (FieldDef f : s.fields()) if (f.name().equalsIgnoreCase(label)) return f.name();
      for (FieldDef f : s.fields()) if (f.autoIncrement()) return f.name();
      return s.idField();
    }
    return "GENERATED_KEY".equalsIgnoreCase(label) ? "id" : label;
  }

  private static boolean containsIgnoreCase(Map<String, Object> row, String key) {
    for (String k : row.keySet()) if (k.equalsIgnoreCase(key)) return true;
    return false;
  }

  private void bindAll(PreparedStatement ps, SqlStatement stmt) throws SQLException {
    List<Object> binds = stmt.binds();
    for (int i = 0; i < binds.size(); i++) {
      Object v = sql.toJdbcValue(binds.get(i));
      if (v == null) ps.setNull(i + 1, Types.NULL);
      else ps.setObject(i + 1, v);
    }
  }

  private void executeDdl(Connection c, String op, String ddl) throws SQLException {
    long start = System.nanoTime();
    if (log.isDebugEnabled()) log.debug("polydata.jdbc op={} provider={} sql={}", op, id(), ddl);
    try (Statement st = c.createStatement()) {
      st.execute(ddl);
    }
    if (log.isDebugEnabled()) {
      log.debug("polydata.jdbc_done op={} provider={} durationMs={}", op, id(), (System.nanoTime() - start) / 1_000_000.0);
    }
  }

  private static boolean indexExists(Connection c, String table, String indexName) throws SQLException {
    DatabaseMetaData md = c.getMetaData();
    try (ResultSet rs = md.getIndexInfo(c.getCatalog(), null, table, false, false)) {
      while (rs.next()) {
        if (indexName.equalsIgnoreCase(rs.getString("INDEX_NAME"))) return true;
      }
    }
    return false;
  }

  private static boolean isConstraintViolation(SQLException e) {
    if (e instanceof SQLIntegrityConstraintViolationException) return true;
    String state = e.getSQLState();
    return state != null && state.startsWith("23");
  }

  private static boolean returnsRows(String text) {
    String t = text.stripLeading().toLowerCase(Locale.ROOT);
    return t.startsWith("select") || t.startsWith("with") || t.startsWith("show") || t.startsWith("values")
        || t.startsWith("explain") || t.startsWith("describe") || t.contains(" returning ");
  }

  private void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    JdbcHandle h = handle();
    log.debug("polydata.jdbc op={} execKind={} bindCount={} provider={} database={} sql={}",
        op, ss.execKind(), ss.binds().size(), h.id(), h.namespace(), ss.sql());

    // TRACE: bind types only, never values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : ss.binds()) {
        log.trace("polydata.jdbc bind index={} valueType={} valueLen={}",
            idx++, v == null ? "null" : v.getClass().getName(), v instanceof CharSequence cs ? cs.length() : -1);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, QueryResult r, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("polydata.jdbc_done op={} execKind={} durationMs={} rows={} affected={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, r.size(), r.affected());
  }
}
