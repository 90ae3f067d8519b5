package io.intellixity.polydata.api;

import java.util.LinkedHashMap;
import java.util.Map;

/** Status code plus JSON-serializable body ({@code null} for 204). */
public record RestResponse(int status, Object body) {
  public static RestResponse ok(Object body) { return new RestResponse(200, body); }
  public static RestResponse created(Object body) { return new RestResponse(201, body); }
  public static RestResponse noContent() { return new RestResponse(204, null); }

  public static RestResponse data(int status, Object data) {
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("data", data);
    return new RestResponse(status, b);
  }
}
