package io.intellixity.polydata.migration;

public enum MigrationState {
  PENDING,
  RUNNING,
  APPLIED,
  FAILED
}
