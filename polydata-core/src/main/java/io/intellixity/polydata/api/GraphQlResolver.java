package io.intellixity.polydata.api;

import java.util.Map;

@FunctionalInterface
public interface GraphQlResolver {
  Object resolve(Map<String, Object> args);
}
