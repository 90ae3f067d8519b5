package io.intellixity.polydata.error;

public final class NotFoundException extends PolydataException {
  public NotFoundException(String message) {
    super(ErrorCategory.NOT_FOUND, message);
  }
}
