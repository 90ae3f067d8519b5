package io.intellixity.polydata.exec;

import java.util.Objects;

/** One provider's failure during a multi-provider operation (close, initialize). */
public record ProviderFailure(String providerId, String operation, Throwable cause) {
  public ProviderFailure {
    Objects.requireNonNull(providerId, "providerId");
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(cause, "cause");
  }
}
