package io.intellixity.polydata.jdbc.postgres;

import com.zaxxer.hikari.HikariConfig;
import io.intellixity.polydata.jdbc.JdbcExecutorFactory;
import io.intellixity.polydata.jdbc.SqlDialect;
import io.intellixity.polydata.provider.ProviderConfig;
import io.intellixity.polydata.provider.ProviderKind;

import java.util.Set;

/**
 * Opens PostgreSQL providers.
 * <p>
 * Strings are sent untyped ({@code stringtype=unspecified}) so ids and filters taken from request
 * paths bind to uuid, integer and jsonb columns; an explicit {@code jdbc.stringtype} option wins.
 */
public final class PostgresExecutorFactory extends JdbcExecutorFactory {
  private final PostgresDialect dialect = new PostgresDialect();

  @Override public Set<ProviderKind> kinds() { return Set.of(ProviderKind.RELATIONAL_A); }

  @Override protected SqlDialect dialect() { return dialect; }

  @Override
  protected String jdbcUrl(ProviderConfig config) {
    String db = config.database() == null ? "" : config.database();
    return "jdbc:postgresql://" + config.host() + ":" + config.port() + "/" + db;
  }

  @Override
  protected void configure(HikariConfig hc, ProviderConfig config) {
    if (config.option("jdbc.stringtype") == null) hc.addDataSourceProperty("stringtype", "unspecified");
    if (config.option("jdbc.sslmode") == null) hc.addDataSourceProperty("sslmode", config.tls() ? "require" : "disable");
    hc.addDataSourceProperty("ApplicationName", "polydata");
  }
}
