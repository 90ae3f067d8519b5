package io.intellixity.polydata.error;

/** The operation targets a provider that is unknown or was excluded at startup. */
public final class NoConnectionException extends PolydataException {
  private final String providerId;

  public NoConnectionException(String providerId) {
    super(ErrorCategory.NO_CONNECTION, "No connection for provider: " + providerId);
    this.providerId = providerId;
  }

  public String providerId() { return providerId; }
}
