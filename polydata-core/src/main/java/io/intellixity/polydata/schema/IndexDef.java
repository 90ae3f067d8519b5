package io.intellixity.polydata.schema;

import java.util.List;
import java.util.Objects;

public record IndexDef(String name, List<String> fields, boolean unique) {
  public IndexDef {
    Objects.requireNonNull(fields, "fields");
    fields = List.copyOf(fields);
    if (fields.isEmpty()) throw new IllegalArgumentException("index requires at least one field");
  }

  public static IndexDef on(String... fields) {
    return new IndexDef(null, List.of(fields), false);
  }

  public static IndexDef uniqueOn(String... fields) {
    return new IndexDef(null, List.of(fields), true);
  }

  /** Explicit name, or {@code idx_<table>_<fields>}. */
  public String nameFor(String table) {
    if (name != null && !name.isBlank()) return name;
    return "idx_" + table + "_" + String.join("_", fields);
  }
}
