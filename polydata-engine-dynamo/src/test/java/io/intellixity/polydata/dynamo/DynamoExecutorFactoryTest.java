package io.intellixity.polydata.dynamo;

import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.exec.ProviderExecutor;
import io.intellixity.polydata.provider.ProviderConfig;
import io.intellixity.polydata.provider.ProviderKind;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;

import java.net.URI;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class DynamoExecutorFactoryTest {
  private final DynamoExecutorFactory factory = new DynamoExecutorFactory();

  private static ProviderConfig.Builder base() {
    return ProviderConfig.builder(ProviderKind.WIDE_COLUMN).username("AKIDEXAMPLE").password("secret");
  }

  @Test
  void servesWideColumnOnly() {
    assertEquals(Set.of(ProviderKind.WIDE_COLUMN), factory.kinds());
  }

  @Test
  void regionDefaultsToUsEast1() {
    assertEquals(Region.US_EAST_1, DynamoExecutorFactory.region(base().build()));
    assertEquals(Region.EU_WEST_1, DynamoExecutorFactory.region(base().region("eu-west-1").build()));
  }

  @Test
  void staticCredentialsWhenKeysAreConfigured() {
    assertInstanceOf(StaticCredentialsProvider.class, DynamoExecutorFactory.credentials(base().build()));
    assertInstanceOf(DefaultCredentialsProvider.class,
        DynamoExecutorFactory.credentials(ProviderConfig.builder(ProviderKind.WIDE_COLUMN).build()));
  }

  @Test
  void urlBecomesEndpointOverride() {
    assertNull(DynamoExecutorFactory.endpoint(base().build()));
    assertEquals(URI.create("http://localhost:8000"),
        DynamoExecutorFactory.endpoint(base().url("http://localhost:8000").build()));
    assertThrows(ValidationException.class, () -> DynamoExecutorFactory.endpoint(base().url("localhost:8000").build()));
  }

  @Test
  void createOpensExecutorWithoutContactingService() {
    ProviderExecutor ex = factory.create(base().id("ddb").url("http://localhost:8000").region("eu-west-1").build());
    try {
      assertEquals("ddb", ex.id());
      assertEquals(ProviderKind.WIDE_COLUMN, ex.kind());
      assertEquals("eu-west-1", ex.handle().namespace());
      assertFalse(ex.capabilities().joins());
    } finally {
      ex.close();
    }
  }
}
