package io.intellixity.polydata.error;

/**
 * Invalid input: schema descriptor violations, unknown fields, constraint violations reported by a store.
 */
public final class ValidationException extends PolydataException {
  public ValidationException(String message) {
    super(ErrorCategory.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(ErrorCategory.VALIDATION_ERROR, message, cause);
  }
}
