package io.intellixity.polydata.jdbc;

import io.intellixity.polydata.exec.ProviderHandle;

import javax.sql.DataSource;
import java.util.Objects;

/** Relational handle: a pooled {@link DataSource} plus the database it points at. */
public final class JdbcHandle implements ProviderHandle<DataSource> {
  private final String id;
  private final DataSource client;
  private final String database;

  public JdbcHandle(String id, DataSource client, String database) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = (database == null || database.isBlank()) ? null : database;
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
  @Override public String namespace() { return database; }
}
