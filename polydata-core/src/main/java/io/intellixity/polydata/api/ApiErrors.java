package io.intellixity.polydata.api;

import io.intellixity.polydata.error.ErrorCategory;
import io.intellixity.polydata.error.PolydataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures to {@code {error: {category, message}}} responses.
 * <p>
 * Only not-found, validation and unsupported-operation messages reach clients; everything else is
 * reported as {@code INTERNAL_ERROR} with a generic message and logged server-side.
 */
public final class ApiErrors {
  private static final Logger log = LoggerFactory.getLogger(ApiErrors.class);

  private ApiErrors() {}

  public static int status(ErrorCategory category) {
    return switch (category) {
      case NOT_FOUND -> 404;
      case VALIDATION_ERROR, UNSUPPORTED_OPERATION -> 400;
      default -> 500;
    };
  }

  public static RestResponse toResponse(RuntimeException e) {
    if (e instanceof PolydataException pe) {
      int status = status(pe.category());
      if (status < 500) return error(status, pe.category().name(), pe.getMessage());
    }
    log.error("polydata.api status=500 reason={}", e.toString(), e);
    return error(500, ErrorCategory.INTERNAL_ERROR.name(), "Internal error");
  }

  public static RestResponse error(int status, String category, String message) {
    Map<String, Object> err = new LinkedHashMap<>();
    err.put("category", category);
    err.put("message", message);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", err);
    return new RestResponse(status, body);
  }
}
