package io.intellixity.polydata.error;

/** Opaque failure of an underlying driver, wrapped with the provider and operation that triggered it. */
public final class DriverException extends PolydataException {
  private final String providerId;
  private final String operation;

  public DriverException(String providerId, String operation, Throwable cause) {
    super(ErrorCategory.DRIVER_ERROR,
        "Driver failure on provider '" + providerId + "' during " + operation
            + (cause == null ? "" : ": " + cause.getClass().getSimpleName()),
        cause);
    this.providerId = providerId;
    this.operation = operation;
  }

  public String providerId() { return providerId; }
  public String operation() { return operation; }
}
