package io.intellixity.polydata.notify;

import java.util.Objects;

/** Channel names: {@code <entity>:<created|updated|deleted>}. */
public final class Channels {
  private Channels() {}

  public static String of(String entity, ChangeType type) {
    Objects.requireNonNull(entity, "entity");
    Objects.requireNonNull(type, "type");
    return entity + ":" + type.id();
  }
}
