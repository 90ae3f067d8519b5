package io.intellixity.polydata.exec;

import io.intellixity.polydata.provider.Capabilities;
import io.intellixity.polydata.provider.ProviderKind;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SchemaResult;

import java.util.List;

/**
 * Capability interface of one connected provider.
 * <p>
 * Selected once at connect time by the {@link ConnectionRegistry}; callers dispatch through it and
 * never switch on the provider kind.
 */
public interface ProviderExecutor extends AutoCloseable {
  /** Configured provider id. */
  String id();

  ProviderKind kind();

  Capabilities capabilities();

  ProviderHandle<?> handle();

  /** Liveness check; throws when the provider cannot serve requests. */
  void ping();

  /** Compile the descriptor through this provider's dialect and run it. */
  QueryResult execute(QueryDescriptor query);

  /**
   * Run a provider-native statement: SQL text (with {@code $n} or {@code ?} placeholders), or the
   * executor's own statement record.
   */
  QueryResult executeNative(Object statement, List<Object> params);

  /** Idempotently ensure the container (table/collection) described by {@code schema} exists. */
  SchemaResult ensureSchema(SchemaDescriptor schema);

  /** Release the native client. */
  @Override
  void close();
}
