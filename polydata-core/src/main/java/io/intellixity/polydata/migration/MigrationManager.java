package io.intellixity.polydata.migration;

import io.intellixity.polydata.error.MigrationFailureException;
import io.intellixity.polydata.error.NotFoundException;
import io.intellixity.polydata.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs registered migrations strictly in registration order, each forward action at most once per
 * ledger. A failure marks the migration {@link MigrationState#FAILED} and aborts the run; later
 * migrations stay {@link MigrationState#PENDING}. Reverse actions only run through
 * {@link #revert(String, MigrationContext)}.
 */
public final class MigrationManager {
  private static final Logger log = LoggerFactory.getLogger(MigrationManager.class);

  private final MigrationLedger ledger;
  private final Clock clock;
  private final Map<String, Migration> migrations = new LinkedHashMap<>();
  private final Map<String, MigrationState> states = new LinkedHashMap<>();

  public MigrationManager(MigrationLedger ledger, Clock clock) {
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.clock = (clock == null) ? Clock.systemUTC() : clock;
  }

  /** @throws ValidationException when the id is already registered */
  public synchronized void register(Migration migration) {
    Objects.requireNonNull(migration, "migration");
    if (migrations.containsKey(migration.id())) {
      throw new ValidationException("Duplicate migration id: " + migration.id());
    }
    migrations.put(migration.id(), migration);
    states.put(migration.id(), MigrationState.PENDING);
  }

  public synchronized List<Migration> migrations() {
    return List.copyOf(migrations.values());
  }

  public synchronized MigrationState state(String id) {
    MigrationState s = states.get(id);
    if (s == null) throw new NotFoundException("Unknown migration: " + id);
    return s;
  }

  public MigrationLedger ledger() { return ledger; }

  /**
   * Apply every pending migration in order.
   *
   * @throws MigrationFailureException on the first failing forward action
   */
  public synchronized MigrationReport run(MigrationContext ctx) {
    Objects.requireNonNull(ctx, "ctx");
    List<String> applied = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    for (Migration m : migrations.values()) {
      if (ledger.isApplied(m.id())) {
        states.put(m.id(), MigrationState.APPLIED);
        skipped.add(m.id());
        continue;
      }
      states.put(m.id(), MigrationState.RUNNING);
      long start = System.nanoTime();
      try {
        m.up().run(ctx);
      } catch (Exception e) {
        states.put(m.id(), MigrationState.FAILED);
        log.error("polydata.migration op=apply id={} name={} status=failed reason={}", m.id(), m.name(), e.toString());
        throw new MigrationFailureException(m.id(), "Migration '" + m.id() + "' failed", e);
      }
      ledger.markApplied(new LedgerEntry(m.id(), m.name(), clock.instant()));
      states.put(m.id(), MigrationState.APPLIED);
      applied.add(m.id());
      log.info("polydata.migration op=apply id={} name={} durationMs={}",
          m.id(), m.name(), (System.nanoTime() - start) / 1_000_000.0);
    }
    return new MigrationReport(applied, skipped);
  }

  /**
   * Run the reverse action of an applied migration and remove it from the ledger.
   *
   * @throws NotFoundException for unknown ids
   * @throws ValidationException when the migration is not applied or has no reverse action
   */
  public synchronized void revert(String id, MigrationContext ctx) {
    Migration m = migrations.get(id);
    if (m == null) throw new NotFoundException("Unknown migration: " + id);
    if (!m.reversible()) throw new ValidationException("Migration '" + id + "' has no reverse action");
    if (!ledger.isApplied(id)) throw new ValidationException("Migration '" + id + "' is not applied");
    try {
      m.down().run(ctx);
    } catch (Exception e) {
      log.error("polydata.migration op=revert id={} status=failed reason={}", id, e.toString());
      throw new MigrationFailureException(id, "Reverting migration '" + id + "' failed", e);
    }
    ledger.markReverted(id);
    states.put(id, MigrationState.PENDING);
    log.info("polydata.migration op=revert id={}", id);
  }
}
