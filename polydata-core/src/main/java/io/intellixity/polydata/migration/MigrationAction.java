package io.intellixity.polydata.migration;

@FunctionalInterface
public interface MigrationAction {
  void run(MigrationContext ctx) throws Exception;
}
