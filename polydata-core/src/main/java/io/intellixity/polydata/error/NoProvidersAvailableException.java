package io.intellixity.polydata.error;

/** Raised by registry initialization when not a single configured provider could be connected. */
public final class NoProvidersAvailableException extends PolydataException {
  public NoProvidersAvailableException(String message) {
    super(ErrorCategory.NO_PROVIDERS_AVAILABLE, message);
  }
}
