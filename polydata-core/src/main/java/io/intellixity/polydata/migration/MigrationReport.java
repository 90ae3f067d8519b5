package io.intellixity.polydata.migration;

import java.util.List;

/** Outcome of one run: ids executed now and ids found already applied. */
public record MigrationReport(List<String> applied, List<String> skipped) {
  public MigrationReport {
    applied = List.copyOf(applied);
    skipped = List.copyOf(skipped);
  }
}
