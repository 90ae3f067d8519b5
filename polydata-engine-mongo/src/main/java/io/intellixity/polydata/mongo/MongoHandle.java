package io.intellixity.polydata.mongo;

import com.mongodb.client.MongoClient;
import io.intellixity.polydata.exec.ProviderHandle;

import java.util.Objects;

/** Document handle: a pooled {@link MongoClient} plus the database collections live in. */
public final class MongoHandle implements ProviderHandle<MongoClient> {
  private final String id;
  private final MongoClient client;
  private final String database;

  public MongoHandle(String id, MongoClient client, String database) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = Objects.requireNonNull(database, "database");
  }

  @Override public String id() { return id; }
  @Override public MongoClient client() { return client; }
  @Override public String namespace() { return database; }
}
