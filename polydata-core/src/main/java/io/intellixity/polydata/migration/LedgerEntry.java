package io.intellixity.polydata.migration;

import java.time.Instant;

public record LedgerEntry(String id, String name, Instant appliedAt) {
}
