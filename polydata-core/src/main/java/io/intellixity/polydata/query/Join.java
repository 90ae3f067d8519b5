package io.intellixity.polydata.query;

import java.util.Objects;

/** Join of {@code table} on a developer-authored condition; the condition text is trusted. */
public record Join(Type type, String table, String on) {
  public Join {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(on, "on");
  }

  public enum Type { INNER, LEFT }
}
