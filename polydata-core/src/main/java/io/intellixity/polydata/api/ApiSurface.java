package io.intellixity.polydata.api;

import java.util.List;

/** Everything generated for one entity; either part may be absent when disabled. */
public record ApiSurface(String entity, List<RestRoute> routes, GraphQlSurface graphQl) {
  public ApiSurface {
    routes = (routes == null) ? List.of() : List.copyOf(routes);
  }

  public RestRoute route(HttpMethod method, String path) {
    for (RestRoute r : routes) {
      if (r.method() == method && r.path().equals(path)) return r;
    }
    return null;
  }
}
