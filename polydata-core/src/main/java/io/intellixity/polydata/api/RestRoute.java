package io.intellixity.polydata.api;

import java.util.Objects;

/** One generated endpoint; {@code path} uses {@code :id} style variables. */
public record RestRoute(HttpMethod method, String path, RestHandler handler) {
  public RestRoute {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(handler, "handler");
  }

  /** {@code "GET /api/users/:id"} */
  public String key() {
    return method + " " + path;
  }
}
