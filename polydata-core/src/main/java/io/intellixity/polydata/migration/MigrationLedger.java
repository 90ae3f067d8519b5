package io.intellixity.polydata.migration;

import java.util.List;

/** Applied-set of migration ids for one target store. */
public interface MigrationLedger {
  boolean isApplied(String id);

  void markApplied(LedgerEntry entry);

  void markReverted(String id);

  List<LedgerEntry> entries();
}
