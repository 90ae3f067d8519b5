package io.intellixity.polydata.web.config;

import io.intellixity.polydata.PolydataSettings;
import io.intellixity.polydata.provider.ProviderConfig;
import io.intellixity.polydata.provider.ProviderKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PolydataPropertiesTest {

  @Test
  void settingsCarryTheBoundValues() {
    PolydataProperties props = new PolydataProperties();
    props.setDefaultProvider("mongodb");
    props.setCacheTimeout(Duration.ofSeconds(30));
    props.setEnableGraphql(false);
    props.setLedger(PolydataSettings.LedgerMode.IN_MEMORY);

    PolydataSettings s = props.toSettings();
    assertEquals("mongodb", s.defaultProvider());
    assertEquals(Duration.ofSeconds(30), s.cacheTimeout());
    assertFalse(s.enableGraphQl());
    assertTrue(s.enableRestApi());
    assertTrue(s.enableCaching());
    assertEquals(PolydataSettings.LedgerMode.IN_MEMORY, s.ledger());
  }

  @Test
  void declaredProvidersTakeTheirIdFromTheKey() {
    PolydataProperties props = new PolydataProperties();
    PolydataProperties.Provider reporting = new PolydataProperties.Provider();
    reporting.setKind("mysql");
    reporting.setHost("reports.internal");
    reporting.setDatabase("reports");
    reporting.setPoolSize(8);
    reporting.setTls(false);
    reporting.getOptions().put("serverTimezone", "UTC");
    props.getProviders().put("reporting", reporting);
    props.getProviders().put("mongodb", new PolydataProperties.Provider());

    List<ProviderConfig> configs = props.toProviderConfigs(Map.of("PG_HOST", "ignored"));
    assertEquals(2, configs.size());

    ProviderConfig r = configs.get(0);
    assertEquals("reporting", r.id());
    assertEquals(ProviderKind.RELATIONAL_B, r.kind());
    assertEquals("reports.internal", r.host());
    assertEquals(3306, r.port());
    assertEquals(8, r.poolSize());
    assertFalse(r.tls());
    assertEquals("UTC", r.option("serverTimezone"));

    ProviderConfig m = configs.get(1);
    assertEquals(ProviderKind.DOCUMENT, m.kind());
    assertEquals("localhost", m.host());
    assertEquals(ProviderConfig.DEFAULT_POOL_SIZE, m.poolSize());
    assertTrue(m.tls());
  }

  @Test
  void environmentIsUsedOnlyWithoutDeclaredProviders() {
    PolydataProperties props = new PolydataProperties();
    List<ProviderConfig> configs = props.toProviderConfigs(Map.of("PG_HOST", "pg.internal"));
    ProviderConfig pg = configs.stream().filter(c -> c.kind() == ProviderKind.RELATIONAL_A).findFirst().orElseThrow();
    assertEquals("pg.internal", pg.host());

    props.setFromEnvironment(false);
    assertEquals(List.of(), props.toProviderConfigs(Map.of("PG_HOST", "pg.internal")));
  }

  @Test
  void unknownKindIsRejected() {
    PolydataProperties props = new PolydataProperties();
    PolydataProperties.Provider p = new PolydataProperties.Provider();
    p.setKind("oracle");
    props.getProviders().put("legacy", p);
    assertThrows(IllegalArgumentException.class, () -> props.toProviderConfigs(Map.of()));
  }
}
