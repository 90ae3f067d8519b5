package io.intellixity.polydata.provider;

/** Executor family a provider kind is served by. */
public enum ProviderFamily {
  RELATIONAL,
  DOCUMENT,
  WIDE_COLUMN
}
