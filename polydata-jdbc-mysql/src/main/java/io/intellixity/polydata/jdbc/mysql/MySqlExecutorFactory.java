package io.intellixity.polydata.jdbc.mysql;

import com.zaxxer.hikari.HikariConfig;
import io.intellixity.polydata.jdbc.JdbcExecutorFactory;
import io.intellixity.polydata.jdbc.SqlDialect;
import io.intellixity.polydata.provider.ProviderConfig;
import io.intellixity.polydata.provider.ProviderKind;

import java.util.Set;

/** Opens MySQL providers with Connector/J statement caching enabled. */
public final class MySqlExecutorFactory extends JdbcExecutorFactory {
  private final MySqlDialect dialect = new MySqlDialect();

  @Override public Set<ProviderKind> kinds() { return Set.of(ProviderKind.RELATIONAL_B); }

  @Override protected SqlDialect dialect() { return dialect; }

  @Override
  protected String jdbcUrl(ProviderConfig config) {
    String db = config.database() == null ? "" : config.database();
    return "jdbc:mysql://" + config.host() + ":" + config.port() + "/" + db;
  }

  @Override
  protected void configure(HikariConfig hc, ProviderConfig config) {
    if (config.option("jdbc.sslMode") == null) hc.addDataSourceProperty("sslMode", config.tls() ? "REQUIRED" : "DISABLED");
    hc.addDataSourceProperty("cachePrepStmts", "true");
    hc.addDataSourceProperty("prepStmtCacheSize", "250");
    hc.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
  }
}
