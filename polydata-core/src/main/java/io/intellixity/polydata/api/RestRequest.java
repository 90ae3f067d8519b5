package io.intellixity.polydata.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Transport-neutral request: path variables, query string and decoded JSON body. */
public record RestRequest(Map<String, String> pathParams, Map<String, String> queryParams, Map<String, Object> body) {
  public RestRequest {
    pathParams = (pathParams == null) ? Map.of() : Map.copyOf(pathParams);
    queryParams = (queryParams == null) ? Map.of() : Map.copyOf(queryParams);
    body = (body == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(body));
  }

  public static RestRequest of(Map<String, String> pathParams, Map<String, String> queryParams, Map<String, Object> body) {
    return new RestRequest(pathParams, queryParams, body);
  }
}
