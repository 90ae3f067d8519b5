package io.intellixity.polydata.migration;

import io.intellixity.polydata.query.OrderBy;
import io.intellixity.polydata.query.QueryBuilder;
import io.intellixity.polydata.schema.FieldDef;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SchemaManager;
import io.intellixity.polydata.schema.SemanticType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Ledger persisted in the {@value #TABLE} table/collection of one provider, created on first use
 * through the schema manager.
 */
public final class StoreMigrationLedger implements MigrationLedger {
  public static final String TABLE = "polydata_migrations";

  static final SchemaDescriptor SCHEMA = SchemaDescriptor.builder(TABLE)
      .field(FieldDef.of("id", SemanticType.STRING).withPrimaryKey())
      .field(FieldDef.of("name", SemanticType.STRING).notNull())
      .field(FieldDef.of("applied_at", SemanticType.BIGINT).notNull())
      .build();

  private final String providerId;
  private final SchemaManager schemas;
  private final Function<String, QueryBuilder> queries;
  private volatile boolean ensured;

  public StoreMigrationLedger(String providerId, SchemaManager schemas, Function<String, QueryBuilder> queries) {
    this.providerId = Objects.requireNonNull(providerId, "providerId");
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.queries = Objects.requireNonNull(queries, "queries");
  }

  private QueryBuilder q() {
    if (!ensured) {
      synchronized (this) {
        if (!ensured) {
          schemas.createSchema(providerId, SCHEMA);
          ensured = true;
        }
      }
    }
    return queries.apply(providerId);
  }

  @Override
  public boolean isApplied(String id) {
    return q().select("id").from(TABLE).where("id", id).first().executeFirst() != null;
  }

  @Override
  public void markApplied(LedgerEntry entry) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", entry.id());
    row.put("name", entry.name());
    row.put("applied_at", entry.appliedAt().toEpochMilli());
    q().insertInto(TABLE, row).execute();
  }

  @Override
  public void markReverted(String id) {
    q().deleteFrom(TABLE).where("id", id).execute();
  }

  @Override
  public List<LedgerEntry> entries() {
    List<LedgerEntry> out = new ArrayList<>();
    for (Map<String, Object> r : q().select("*").from(TABLE).orderBy("applied_at", OrderBy.Direction.ASC).execute().rows()) {
      Object at = r.get("applied_at");
      long millis = (at instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(at));
      out.add(new LedgerEntry(String.valueOf(r.get("id")), String.valueOf(r.get("name")), Instant.ofEpochMilli(millis)));
    }
    return out;
  }
}
