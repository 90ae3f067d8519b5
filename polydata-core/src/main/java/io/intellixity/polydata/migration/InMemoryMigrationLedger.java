package io.intellixity.polydata.migration;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Process-lifetime ledger; used when no store-backed ledger is configured. */
public final class InMemoryMigrationLedger implements MigrationLedger {
  private final Map<String, LedgerEntry> applied = new ConcurrentHashMap<>();

  @Override public boolean isApplied(String id) { return applied.containsKey(id); }
  @Override public void markApplied(LedgerEntry entry) { applied.put(entry.id(), entry); }
  @Override public void markReverted(String id) { applied.remove(id); }

  @Override
  public List<LedgerEntry> entries() {
    return applied.values().stream()
        .sorted((a, b) -> a.appliedAt().compareTo(b.appliedAt()))
        .toList();
  }
}
