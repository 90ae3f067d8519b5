package io.intellixity.polydata.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.polydata.error.ProviderConnectionException;
import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.exec.ProviderExecutor;
import io.intellixity.polydata.exec.ProviderExecutorFactory;
import io.intellixity.polydata.provider.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Base factory for relational providers: one HikariCP pool per configured provider.
 * <p>
 * Provider options prefixed with {@code jdbc.} are passed to the driver as data source properties
 * ({@code jdbc.stringtype=unspecified} becomes {@code stringtype=unspecified}); {@code minIdle}
 * sets the pool's minimum idle connections (default 1).
 */
public abstract class JdbcExecutorFactory implements ProviderExecutorFactory {
  private static final Logger log = LoggerFactory.getLogger(JdbcExecutorFactory.class);
  static final String DRIVER_OPTION_PREFIX = "jdbc.";

  protected abstract SqlDialect dialect();

  /** JDBC URL built from host/port/database; used when the config carries no explicit url. */
  protected abstract String jdbcUrl(ProviderConfig config);

  /** Engine-specific pool/driver settings, applied after the common ones. */
  protected void configure(HikariConfig hc, ProviderConfig config) {}

  @Override
  public ProviderExecutor create(ProviderConfig config) {
    HikariConfig hc = poolConfig(config);
    HikariDataSource ds;
    try {
      ds = new HikariDataSource(hc);
    } catch (RuntimeException e) {
      throw new ProviderConnectionException(config.id(), "Pool initialization failed", e);
    }
    log.info("polydata.jdbc op=pool_open provider={} kind={} maxPoolSize={} minIdle={}",
        config.id(), config.kind(), hc.getMaximumPoolSize(), hc.getMinimumIdle());
    return new JdbcExecutor(new JdbcHandle(config.id(), ds, config.database()), config.kind(), dialect(), ds);
  }

  /** Pool settings derived from {@code config}; no connection is opened. */
  public HikariConfig poolConfig(ProviderConfig config) {
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("polydata-" + config.id());
    hc.setJdbcUrl(config.url() != null && !config.url().isBlank() ? config.url() : jdbcUrl(config));
    if (config.username() != null) hc.setUsername(config.username());
    if (config.password() != null) hc.setPassword(config.password());
    hc.setMaximumPoolSize(config.poolSize());
    hc.setMinimumIdle(Math.min(config.poolSize(), minIdle(config)));
    hc.setConnectionTimeout(config.connectTimeout().toMillis());
    hc.setIdleTimeout(config.idleTimeout().toMillis());
    for (Map.Entry<String, String> e : config.options().entrySet()) {
      if (e.getKey().startsWith(DRIVER_OPTION_PREFIX)) {
        hc.addDataSourceProperty(e.getKey().substring(DRIVER_OPTION_PREFIX.length()), e.getValue());
      }
    }
    configure(hc, config);
    return hc;
  }

  private static int minIdle(ProviderConfig config) {
    String v = config.option("minIdle", "1");
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new ValidationException("Option minIdle must be an integer for provider " + config.id(), e);
    }
  }
}
