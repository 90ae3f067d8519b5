package io.intellixity.polydata.error;

/** Machine-readable error category carried by every {@link PolydataException}. */
public enum ErrorCategory {
  CONNECTION_ERROR,
  NO_PROVIDERS_AVAILABLE,
  UNSUPPORTED_OPERATION,
  NO_CONNECTION,
  NOT_FOUND,
  VALIDATION_ERROR,
  MIGRATION_FAILURE,
  DRIVER_ERROR,
  INTERNAL_ERROR
}
