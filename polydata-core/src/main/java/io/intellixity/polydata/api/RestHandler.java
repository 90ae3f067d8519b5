package io.intellixity.polydata.api;

@FunctionalInterface
public interface RestHandler {
  RestResponse handle(RestRequest request);
}
