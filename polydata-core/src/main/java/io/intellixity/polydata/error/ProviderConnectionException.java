package io.intellixity.polydata.error;

/** A single provider could not be connected or failed its liveness check. */
public final class ProviderConnectionException extends PolydataException {
  private final String providerId;

  public ProviderConnectionException(String providerId, String message, Throwable cause) {
    super(ErrorCategory.CONNECTION_ERROR, "Failed to connect provider '" + providerId + "': " + message, cause);
    this.providerId = providerId;
  }

  public String providerId() { return providerId; }
}
