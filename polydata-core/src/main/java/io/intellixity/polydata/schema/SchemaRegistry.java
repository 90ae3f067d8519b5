package io.intellixity.polydata.schema;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** Registered schema descriptors keyed by {@code provider:name}, retained for the process lifetime. */
public final class SchemaRegistry {
  private final Map<String, SchemaDescriptor> schemas = new ConcurrentHashMap<>();

  public void register(String providerId, SchemaDescriptor schema) {
    Objects.requireNonNull(providerId, "providerId");
    Objects.requireNonNull(schema, "schema");
    schemas.put(key(providerId, schema.name()), schema);
  }

  public SchemaDescriptor get(String providerId, String name) {
    return schemas.get(key(providerId, name));
  }

  public List<SchemaDescriptor> forProvider(String providerId) {
    String prefix = providerId + ":";
    return schemas.entrySet().stream()
        .filter(e -> e.getKey().startsWith(prefix))
        .map(Map.Entry::getValue)
        .toList();
  }

  private static String key(String providerId, String name) {
    return providerId + ":" + name;
  }
}
