package io.intellixity.polydata.provider;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Connection configuration of one provider.
 * <p>
 * {@code url} takes precedence over host/port/database where a driver accepts a connection string
 * (JDBC URL, Mongo connection string, DynamoDB endpoint override).
 */
public record ProviderConfig(
    String id,
    ProviderKind kind,
    String url,
    String host,
    int port,
    String database,
    String username,
    String password,
    String region,
    int poolSize,
    Duration connectTimeout,
    Duration idleTimeout,
    boolean tls,
    Map<String, String> options
) {
  public static final int DEFAULT_POOL_SIZE = 100;
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(30);

  public ProviderConfig {
    Objects.requireNonNull(kind, "kind");
    id = (id == null || id.isBlank()) ? kind.id() : id.trim();
    port = (port <= 0) ? kind.defaultPort() : port;
    if (poolSize <= 0) poolSize = DEFAULT_POOL_SIZE;
    connectTimeout = (connectTimeout == null) ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    idleTimeout = (idleTimeout == null) ? DEFAULT_IDLE_TIMEOUT : idleTimeout;
    if (connectTimeout.isNegative() || connectTimeout.isZero()) {
      throw new IllegalArgumentException("connectTimeout must be > 0 for provider " + id);
    }
    options = (options == null) ? Map.of() : Map.copyOf(options);
  }

  public String option(String name) { return options.get(name); }

  public String option(String name, String defaultValue) {
    String v = options.get(name);
    return (v == null || v.isBlank()) ? defaultValue : v;
  }

  /** Safe for logs: never includes credentials. */
  @Override
  public String toString() {
    return "ProviderConfig[id=" + id + ", kind=" + kind + ", host=" + host + ", port=" + port
        + ", database=" + database + ", tls=" + tls + ", poolSize=" + poolSize + "]";
  }

  public static Builder builder(ProviderKind kind) {
    return new Builder(kind);
  }

  public static final class Builder {
    private final ProviderKind kind;
    private String id;
    private String url;
    private String host = "localhost";
    private int port;
    private String database;
    private String username;
    private String password;
    private String region;
    private int poolSize = DEFAULT_POOL_SIZE;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private Duration idleTimeout = DEFAULT_IDLE_TIMEOUT;
    private boolean tls = true;
    private final Map<String, String> options = new LinkedHashMap<>();

    private Builder(ProviderKind kind) {
      this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Builder id(String id) { this.id = id; return this; }
    public Builder url(String url) { this.url = url; return this; }
    public Builder host(String host) { this.host = host; return this; }
    public Builder port(int port) { this.port = port; return this; }
    public Builder database(String database) { this.database = database; return this; }
    public Builder username(String username) { this.username = username; return this; }
    public Builder password(String password) { this.password = password; return this; }
    public Builder region(String region) { this.region = region; return this; }
    public Builder poolSize(int poolSize) { this.poolSize = poolSize; return this; }
    public Builder connectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; return this; }
    public Builder idleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; return this; }
    public Builder tls(boolean tls) { this.tls = tls; return this; }
    public Builder option(String name, String value) {
      if (value != null) this.options.put(name, value);
      return this;
    }

    public ProviderConfig build() {
      return new ProviderConfig(id, kind, url, host, port, database, username, password, region,
          poolSize, connectTimeout, idleTimeout, tls, options);
    }
  }
}
