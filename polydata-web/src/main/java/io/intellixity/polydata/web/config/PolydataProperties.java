package io.intellixity.polydata.web.config;

import io.intellixity.polydata.PolydataSettings;
import io.intellixity.polydata.provider.ProviderConfig;
import io.intellixity.polydata.provider.ProviderConfigs;
import io.intellixity.polydata.provider.ProviderKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code polydata.*} settings.
 * <pre>
 * polydata:
 *   default-provider: postgresql
 *   providers:
 *     postgresql:
 *       kind: postgresql
 *       host: db
 *       database: pwa_app
 * </pre>
 * With no {@code providers} entries and {@code from-environment} set, providers are read from the
 * process environment ({@code PG_HOST}, {@code MONGO_URL}, ...).
 */
@ConfigurationProperties(prefix = "polydata")
public class PolydataProperties {
  private String defaultProvider = PolydataSettings.DEFAULT_PROVIDER;
  private Duration cacheTimeout = PolydataSettings.DEFAULT_CACHE_TIMEOUT;
  private boolean enableCaching = true;
  private boolean enableRestApi = true;
  private boolean enableGraphql = true;
  private boolean enableRealtime = true;
  private PolydataSettings.LedgerMode ledger = PolydataSettings.LedgerMode.STORE;
  private int ioThreads;
  private boolean fromEnvironment = true;
  private String schemas = "classpath:polydata/schemas.json";
  private final Map<String, Provider> providers = new LinkedHashMap<>();

  public String getDefaultProvider() { return defaultProvider; }
  public void setDefaultProvider(String defaultProvider) { this.defaultProvider = defaultProvider; }
  public Duration getCacheTimeout() { return cacheTimeout; }
  public void setCacheTimeout(Duration cacheTimeout) { this.cacheTimeout = cacheTimeout; }
  public boolean isEnableCaching() { return enableCaching; }
  public void setEnableCaching(boolean enableCaching) { this.enableCaching = enableCaching; }
  public boolean isEnableRestApi() { return enableRestApi; }
  public void setEnableRestApi(boolean enableRestApi) { this.enableRestApi = enableRestApi; }
  public boolean isEnableGraphql() { return enableGraphql; }
  public void setEnableGraphql(boolean enableGraphql) { this.enableGraphql = enableGraphql; }
  public boolean isEnableRealtime() { return enableRealtime; }
  public void setEnableRealtime(boolean enableRealtime) { this.enableRealtime = enableRealtime; }
  public PolydataSettings.LedgerMode getLedger() { return ledger; }
  public void setLedger(PolydataSettings.LedgerMode ledger) { this.ledger = ledger; }
  public int getIoThreads() { return ioThreads; }
  public void setIoThreads(int ioThreads) { this.ioThreads = ioThreads; }
  public boolean isFromEnvironment() { return fromEnvironment; }
  public void setFromEnvironment(boolean fromEnvironment) { this.fromEnvironment = fromEnvironment; }
  public String getSchemas() { return schemas; }
  public void setSchemas(String schemas) { this.schemas = schemas; }
  public Map<String, Provider> getProviders() { return providers; }

  public PolydataSettings toSettings() {
    return PolydataSettings.builder()
        .defaultProvider(defaultProvider)
        .cacheTimeout(cacheTimeout)
        .enableCaching(enableCaching)
        .enableRestApi(enableRestApi)
        .enableGraphQl(enableGraphql)
        .enableRealtime(enableRealtime)
        .ledger(ledger)
        .ioThreads(ioThreads)
        .build();
  }

  /** Declared providers keyed by id; the environment only when none are declared. */
  public List<ProviderConfig> toProviderConfigs(Map<String, String> env) {
    if (providers.isEmpty()) {
      return fromEnvironment ? ProviderConfigs.fromEnvironment(env) : List.of();
    }
    List<ProviderConfig> out = new ArrayList<>();
    for (Map.Entry<String, Provider> e : providers.entrySet()) {
      out.add(e.getValue().toConfig(e.getKey()));
    }
    return out;
  }

  public static class Provider {
    /** Provider kind, either the enum name or the provider id ({@code mysql}); defaults to the entry key. */
    private String kind;
    private String url;
    private String host;
    private Integer port;
    private String database;
    private String username;
    private String password;
    private String region;
    private Integer poolSize;
    private Duration connectTimeout;
    private Duration idleTimeout;
    private Boolean tls;
    private final Map<String, String> options = new LinkedHashMap<>();

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public Integer getPort() { return port; }
    public void setPort(Integer port) { this.port = port; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }
    public Integer getPoolSize() { return poolSize; }
    public void setPoolSize(Integer poolSize) { this.poolSize = poolSize; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public Duration getIdleTimeout() { return idleTimeout; }
    public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }
    public Boolean getTls() { return tls; }
    public void setTls(Boolean tls) { this.tls = tls; }
    public Map<String, String> getOptions() { return options; }

    ProviderConfig toConfig(String id) {
      ProviderKind k = ProviderKind.parse(kind == null ? id : kind);
      ProviderConfig.Builder b = ProviderConfig.builder(k)
          .id(id)
          .url(url)
          .database(database)
          .username(username)
          .password(password)
          .region(region);
      if (host != null) b.host(host);
      if (port != null) b.port(port);
      if (poolSize != null) b.poolSize(poolSize);
      if (connectTimeout != null) b.connectTimeout(connectTimeout);
      if (idleTimeout != null) b.idleTimeout(idleTimeout);
      if (tls != null) b.tls(tls);
      options.forEach(b::option);
      return b.build();
    }
  }
}
