package io.intellixity.polydata.notify;

import java.util.Locale;

public enum ChangeType {
  CREATED,
  UPDATED,
  DELETED;

  public String id() { return name().toLowerCase(Locale.ROOT); }
}
