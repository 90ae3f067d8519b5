package io.intellixity.polydata.error;

import java.util.Objects;

/**
 * Root of the engine's exception hierarchy.
 * <p>
 * All engine exceptions are unchecked; checked driver exceptions are wrapped at the executor boundary.
 */
public abstract class PolydataException extends RuntimeException {
  private final ErrorCategory category;

  protected PolydataException(ErrorCategory category, String message) {
    super(message);
    this.category = Objects.requireNonNull(category, "category");
  }

  protected PolydataException(ErrorCategory category, String message, Throwable cause) {
    super(message, cause);
    this.category = Objects.requireNonNull(category, "category");
  }

  public ErrorCategory category() { return category; }
}
