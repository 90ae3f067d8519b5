package io.intellixity.polydata.dynamo;

import io.intellixity.polydata.exec.ProviderHandle;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.util.Objects;

/** Wide-column handle: one {@link DynamoDbClient}; the namespace is its region. */
public final class DynamoHandle implements ProviderHandle<DynamoDbClient> {
  private final String id;
  private final DynamoDbClient client;
  private final String region;

  public DynamoHandle(String id, DynamoDbClient client, String region) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.region = region;
  }

  @Override public String id() { return id; }
  @Override public DynamoDbClient client() { return client; }
  @Override public String namespace() { return region; }
}
