package io.intellixity.polydata.query;

import java.util.Locale;
import java.util.Objects;

public record OrderBy(String field, Direction direction) {
  public OrderBy {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction {
    ASC, DESC;

    public static Direction parse(String s) {
      if (s == null || s.isBlank()) return ASC;
      return Direction.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
  }
}
