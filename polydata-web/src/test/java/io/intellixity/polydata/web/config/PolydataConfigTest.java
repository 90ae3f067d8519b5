package io.intellixity.polydata.web.config;

import io.intellixity.polydata.Polydata;
import io.intellixity.polydata.api.HttpMethod;
import io.intellixity.polydata.error.NoConnectionException;
import io.intellixity.polydata.testing.InMemoryExecutorFactory;
import io.intellixity.polydata.web.WebFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PolydataConfigTest {

  @Test
  void openCreatesCatalogSchemasAndTheirApis() {
    try (Polydata db = WebFixtures.engine()) {
      assertNotNull(db.api("users"));
      assertNotNull(db.api("users").route(HttpMethod.GET, "/api/users/:id"));
      assertNotNull(db.api("users").graphQl());
      assertEquals("users", db.schema("postgresql", "users").name());
    }
  }

  @Test
  void entriesMayTargetAnotherProvider() {
    PolydataProperties props = WebFixtures.properties();
    props.getProviders().put("mongodb", new PolydataProperties.Provider());
    InMemoryExecutorFactory factory = new InMemoryExecutorFactory(true);
    SchemaCatalog catalog = new SchemaCatalog(List.of(new SchemaCatalog.Entry("mongodb", WebFixtures.USERS)));

    try (Polydata db = PolydataConfig.open(props, Map.of(), false, List.of(factory), catalog)) {
      assertEquals(1, factory.opened("mongodb").ensures());
      assertEquals(0, factory.opened("postgresql").ensures());
    }
  }

  @Test
  void failedBootstrapShutsTheEngineDown() {
    InMemoryExecutorFactory factory = new InMemoryExecutorFactory(true);
    SchemaCatalog catalog = new SchemaCatalog(List.of(new SchemaCatalog.Entry("dynamodb", WebFixtures.USERS)));

    assertThrows(NoConnectionException.class,
        () -> PolydataConfig.open(WebFixtures.properties(), Map.of(), false, List.of(factory), catalog));
    assertTrue(factory.opened("postgresql").isClosed());
  }
}
