package io.intellixity.polydata.error;

/** A forward migration failed; the run was aborted and later migrations were not attempted. */
public final class MigrationFailureException extends PolydataException {
  private final String migrationId;

  public MigrationFailureException(String migrationId, String message, Throwable cause) {
    super(ErrorCategory.MIGRATION_FAILURE, message, cause);
    this.migrationId = migrationId;
  }

  public String migrationId() { return migrationId; }
}
