package io.intellixity.polydata.schema;

import io.intellixity.polydata.exec.ConnectionRegistry;
import io.intellixity.polydata.exec.ProviderExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Validates and registers schema descriptors, then asks the provider's executor to ensure the
 * backing container. Safe to call repeatedly with the same descriptor.
 */
public final class SchemaManager {
  private static final Logger log = LoggerFactory.getLogger(SchemaManager.class);

  private final ConnectionRegistry connections;
  private final SchemaRegistry schemas;

  public SchemaManager(ConnectionRegistry connections, SchemaRegistry schemas) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.schemas = Objects.requireNonNull(schemas, "schemas");
  }

  public SchemaResult createSchema(String providerId, SchemaDescriptor schema) {
    Objects.requireNonNull(schema, "schema");
    schema.validate();
    ProviderExecutor executor = connections.executor(providerId);
    long start = System.nanoTime();
    SchemaResult result = executor.ensureSchema(schema);
    schemas.register(providerId, schema);
    log.debug("polydata.schema op=ensure provider={} name={} created={} durationMs={}",
        providerId, schema.name(), result.created(), (System.nanoTime() - start) / 1_000_000.0);
    return result;
  }

  public SchemaDescriptor schema(String providerId, String name) {
    return schemas.get(providerId, name);
  }

  public SchemaRegistry registry() { return schemas; }
}
