package io.intellixity.polydata.query;

public enum QueryKind {
  SELECT,
  INSERT,
  UPDATE,
  DELETE
}
