package io.intellixity.polydata.api;

public enum HttpMethod {
  GET,
  POST,
  PUT,
  DELETE
}
