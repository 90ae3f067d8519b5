package io.intellixity.polydata.provider;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ProviderConfigsTest {

  @Test
  void selfHostedProvidersAlwaysPresentManagedOnesNeedCredentials() {
    List<ProviderConfig> cfgs = ProviderConfigs.fromEnvironment(Map.of("PG_HOST", "db.internal", "PG_PORT", "6543"));
    assertEquals(List.of(ProviderKind.RELATIONAL_A, ProviderKind.RELATIONAL_B, ProviderKind.DOCUMENT),
        cfgs.stream().map(ProviderConfig::kind).toList());
    ProviderConfig pg = cfgs.get(0);
    assertEquals("postgresql", pg.id());
    assertEquals("db.internal", pg.host());
    assertEquals(6543, pg.port());
    assertEquals("pwa_app", pg.database());
    assertEquals(100, pg.poolSize());
    assertEquals(Duration.ofSeconds(30), pg.connectTimeout());
  }

  @Test
  void managedProvidersAppearWhenConfigured() {
    List<ProviderConfig> cfgs = ProviderConfigs.fromEnvironment(Map.of(
        "AWS_ACCESS_KEY_ID", "AKIA", "AWS_SECRET_ACCESS_KEY", "secret", "DYNAMODB_ENDPOINT", "http://localhost:8000",
        "COSMOS_ENDPOINT", "mongodb://cosmos:10255/?ssl=true", "COSMOS_KEY", "k",
        "FIREBASE_PROJECT_ID", "demo", "FIREBASE_DATABASE_URL", "mongodb+srv://demo.firestore.example.com/"));
    ProviderConfig dynamo = cfgs.stream().filter(c -> c.kind() == ProviderKind.WIDE_COLUMN).findFirst().orElseThrow();
    assertEquals("us-east-1", dynamo.region());
    assertEquals("http://localhost:8000", dynamo.url());
    assertTrue(cfgs.stream().anyMatch(c -> c.id().equals("cosmosdb")));
    assertTrue(cfgs.stream().anyMatch(c -> c.id().equals("firestore")));
  }

  @Test
  void nativeManagedEndpointsAreSkipped() {
    List<ProviderConfig> cfgs = ProviderConfigs.fromEnvironment(Map.of(
        "COSMOS_ENDPOINT", "https://acme.documents.azure.com:443/", "COSMOS_KEY", "k",
        "FIREBASE_PROJECT_ID", "demo", "FIREBASE_DATABASE_URL", "https://demo.firebaseio.com"));
    assertEquals(List.of(ProviderKind.RELATIONAL_A, ProviderKind.RELATIONAL_B, ProviderKind.DOCUMENT),
        cfgs.stream().map(ProviderConfig::kind).toList());

    List<ProviderConfig> projectOnly = ProviderConfigs.fromEnvironment(Map.of("FIREBASE_PROJECT_ID", "demo"));
    assertTrue(projectOnly.stream().noneMatch(c -> c.kind() == ProviderKind.GRAPH_DOCUMENT));
  }

  @Test
  void toStringNeverIncludesCredentials() {
    ProviderConfig c = ProviderConfig.builder(ProviderKind.RELATIONAL_B).username("root").password("hunter2").build();
    assertFalse(c.toString().contains("hunter2"));
    assertEquals(3306, c.port());
  }

  @Test
  void kindsParseFromIdOrName() {
    assertEquals(ProviderKind.WIDE_COLUMN, ProviderKind.parse("dynamodb"));
    assertEquals(ProviderKind.MANAGED_DOCUMENT, ProviderKind.parse("managed-document"));
    assertThrows(IllegalArgumentException.class, () -> ProviderKind.parse("oracle"));
  }
}
