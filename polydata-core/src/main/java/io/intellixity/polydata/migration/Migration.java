package io.intellixity.polydata.migration;

import java.time.Instant;
import java.util.Objects;

/** Named forward change with an optional reverse action, applied at most once per target store. */
public record Migration(String id, String name, MigrationAction up, MigrationAction down, Instant registeredAt) {
  public Migration {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(up, "up");
    if (id.isBlank()) throw new IllegalArgumentException("migration id is blank");
    name = (name == null || name.isBlank()) ? id : name;
    registeredAt = (registeredAt == null) ? Instant.now() : registeredAt;
  }

  public static Migration of(String id, String name, MigrationAction up) {
    return new Migration(id, name, up, null, null);
  }

  public static Migration of(String id, String name, MigrationAction up, MigrationAction down) {
    return new Migration(id, name, up, down, null);
  }

  public boolean reversible() { return down != null; }
}
