package io.intellixity.polydata.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Provider-neutral field types; each dialect maps them to a native type. */
public enum SemanticType {
  STRING,
  TEXT,
  INTEGER,
  BIGINT,
  FLOAT,
  DOUBLE,
  BOOLEAN,
  DATE,
  DATETIME,
  JSON,
  UUID;

  @JsonValue
  public String id() { return name().toLowerCase(Locale.ROOT); }

  @JsonCreator
  public static SemanticType parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("type is blank");
    return SemanticType.valueOf(s.trim().toUpperCase(Locale.ROOT));
  }

  public boolean numeric() {
    return this == INTEGER || this == BIGINT || this == FLOAT || this == DOUBLE;
  }
}
