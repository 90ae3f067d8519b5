package io.intellixity.polydata.spi;

import io.intellixity.polydata.error.DriverException;
import io.intellixity.polydata.error.PolydataException;
import io.intellixity.polydata.error.UnsupportedQueryException;
import io.intellixity.polydata.exec.NativeStatement;
import io.intellixity.polydata.exec.ProviderExecutor;
import io.intellixity.polydata.exec.ProviderHandle;
import io.intellixity.polydata.exec.QueryResult;
import io.intellixity.polydata.provider.Capabilities;
import io.intellixity.polydata.provider.ProviderKind;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.query.QueryKind;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SchemaResult;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Template-method executor shared by the provider families.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>validate descriptors against this provider's {@link Capabilities}</li>
 *   <li>compile them through the {@link Dialect}</li>
 *   <li>delegate execution to backend hooks</li>
 *   <li>translate driver failures into the error taxonomy</li>
 * </ul>
 */
public abstract class AbstractProviderExecutor<S extends NativeStatement, H extends ProviderHandle<?>>
    implements ProviderExecutor {
  private final H handle;
  private final ProviderKind kind;
  private final Dialect<S> dialect;
  private final Capabilities capabilities;

  protected AbstractProviderExecutor(H handle, ProviderKind kind, Dialect<S> dialect, Capabilities capabilities) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
  }

  @Override public final String id() { return handle.id(); }
  @Override public final ProviderKind kind() { return kind; }
  @Override public final Capabilities capabilities() { return capabilities; }
  @Override public final H handle() { return handle; }
  protected final Dialect<S> dialect() { return dialect; }

  /** Run the compiled statement; {@code query} is the descriptor it came from. */
  protected abstract QueryResult run(QueryDescriptor query, S stmt);

  /** Run a caller-supplied native statement. */
  protected abstract QueryResult runNative(S stmt);

  /** Convert a caller-supplied statement (and positional params) into this backend's statement type. */
  protected abstract S toNative(Object statement, List<Object> params);

  /** Backend hook for {@link #ensureSchema(SchemaDescriptor)}. */
  protected abstract SchemaResult doEnsureSchema(SchemaDescriptor schema);

  /**
   * Map a backend failure to the taxonomy. The default wraps everything in {@link DriverException};
   * executors override to recognize constraint violations.
   */
  protected PolydataException translate(String operation, Exception e) {
    return new DriverException(id(), operation, e);
  }

  @Override
  public final QueryResult execute(QueryDescriptor query) {
    Objects.requireNonNull(query, "query");
    query.validate();
    checkCapabilities(query);
    S stmt = dialect.compile(query);
    QueryResult r = guarded(query.kind().name(), () -> run(query, stmt));
    return query.single() ? r.firstOnly() : r;
  }

  @Override
  public final QueryResult executeNative(Object statement, List<Object> params) {
    Objects.requireNonNull(statement, "statement");
    S stmt = toNative(statement, params == null ? List.of() : params);
    return guarded("NATIVE", () -> runNative(stmt));
  }

  @Override
  public final SchemaResult ensureSchema(SchemaDescriptor schema) {
    Objects.requireNonNull(schema, "schema");
    return guarded("ENSURE_SCHEMA", () -> doEnsureSchema(schema));
  }

  protected final <T> T guarded(String operation, Supplier<T> work) {
    try {
      return work.get();
    } catch (PolydataException e) {
      throw e;
    } catch (RuntimeException e) {
      throw translate(operation, e);
    }
  }

  private void checkCapabilities(QueryDescriptor q) {
    if (!q.joins().isEmpty() && !capabilities.joins()) {
      throw new UnsupportedQueryException("Joins are not supported by provider " + id() + " (" + kind + ")");
    }
    if (!q.groupBy().isEmpty() && !capabilities.aggregation()) {
      throw new UnsupportedQueryException("Group by is not supported by provider " + id() + " (" + kind + ")");
    }
    if (q.kind() != QueryKind.SELECT && (!q.joins().isEmpty() || !q.groupBy().isEmpty())) {
      throw new UnsupportedQueryException("Joins and group by apply to SELECT only");
    }
  }
}
