package io.intellixity.polydata.web.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.polydata.Polydata;
import io.intellixity.polydata.exec.ProviderExecutorFactory;
import io.intellixity.polydata.exec.ProviderFailure;
import io.intellixity.polydata.schema.SchemaResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(PolydataProperties.class)
public class PolydataConfig {
  private static final Logger log = LoggerFactory.getLogger(PolydataConfig.class);

  @Bean
  public SchemaCatalog schemaCatalog(PolydataProperties props, ResourceLoader resources, ObjectMapper mapper) throws IOException {
    Resource r = resources.getResource(props.getSchemas());
    if (!r.exists()) {
      log.warn("polydata.web schemas={} status=missing", props.getSchemas());
      return SchemaCatalog.empty();
    }
    try (InputStream in = r.getInputStream()) {
      SchemaCatalog catalog = SchemaCatalog.read(in, mapper);
      log.info("polydata.web schemas={} entities={}", props.getSchemas(), catalog.entries().size());
      return catalog;
    }
  }

  /** Beans of type {@link ProviderExecutorFactory} override discovered factories for their kinds. */
  @Bean(destroyMethod = "shutdown")
  public Polydata polydata(PolydataProperties props, SchemaCatalog catalog,
                           ObjectProvider<ProviderExecutorFactory> factories) {
    return open(props, System.getenv(), true, factories.orderedStream().toList(), catalog);
  }

  /**
   * Build and connect the engine, then create every catalog schema and generate its API.
   * The engine is shut down again when any of this fails.
   */
  public static Polydata open(PolydataProperties props, Map<String, String> env, boolean discoverFactories,
                              List<ProviderExecutorFactory> factories, SchemaCatalog catalog) {
    Polydata.Builder b = Polydata.builder()
        .settings(props.toSettings())
        .providers(props.toProviderConfigs(env))
        .discoverFactories(discoverFactories);
    factories.forEach(b::factory);
    Polydata db = b.build();
    try {
      List<ProviderFailure> failures = db.initialize();
      for (ProviderFailure f : failures) {
        log.warn("polydata.web provider_excluded provider={} op={} reason={}", f.providerId(), f.operation(), f.cause().toString());
      }
      for (SchemaCatalog.Entry e : catalog.entries()) {
        String provider = (e.provider() == null) ? db.defaultProvider() : e.provider();
        SchemaResult created = db.createSchema(provider, e.schema());
        db.generateApi(provider, e.schema());
        log.info("polydata.web entity={} provider={} table={}", e.schema().name(), provider, created.table());
      }
      return db;
    } catch (RuntimeException ex) {
      db.shutdown();
      throw ex;
    }
  }
}
