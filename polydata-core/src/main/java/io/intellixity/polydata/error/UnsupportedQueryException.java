package io.intellixity.polydata.error;

/** Malformed descriptor or an operation the target provider family cannot express. Not retried. */
public final class UnsupportedQueryException extends PolydataException {
  public UnsupportedQueryException(String message) {
    super(ErrorCategory.UNSUPPORTED_OPERATION, message);
  }
}
