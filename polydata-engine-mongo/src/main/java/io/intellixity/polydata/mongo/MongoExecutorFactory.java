package io.intellixity.polydata.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.polydata.error.ProviderConnectionException;
import io.intellixity.polydata.exec.ProviderExecutor;
import io.intellixity.polydata.exec.ProviderExecutorFactory;
import io.intellixity.polydata.provider.ProviderConfig;
import io.intellixity.polydata.provider.ProviderKind;
import org.bson.UuidRepresentation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Opens document providers over the MongoDB wire protocol.
 * <p>
 * A {@code mongodb://} or {@code mongodb+srv://} url is used as given. Otherwise the connection
 * string is built from the endpoint: managed-document endpoints ({@code https://<account>.documents.azure.com})
 * map to the account's MongoDB API host with the account name as user, and document providers use
 * host/port. Graph-document providers need a MongoDB-compatible connection string. Credentials
 * from the config are attached when the connection string has none.
 * Pool size and timeouts from the config override those of the connection string.
 */
public final class MongoExecutorFactory implements ProviderExecutorFactory {
  private static final Logger log = LoggerFactory.getLogger(MongoExecutorFactory.class);
  static final String DEFAULT_DATABASE = "pwa_app";

  @Override
  public Set<ProviderKind> kinds() {
    return Set.of(ProviderKind.DOCUMENT, ProviderKind.MANAGED_DOCUMENT, ProviderKind.GRAPH_DOCUMENT);
  }

  @Override
  public ProviderExecutor create(ProviderConfig config) {
    MongoClientSettings settings = settings(config);
    MongoClient client;
    try {
      client = MongoClients.create(settings);
    } catch (RuntimeException e) {
      throw new ProviderConnectionException(config.id(), "Client initialization failed", e);
    }
    String database = databaseName(config);
    log.info("polydata.mongo op=client_open provider={} kind={} database={} maxPoolSize={}",
        config.id(), config.kind(), database, settings.getConnectionPoolSettings().getMaxSize());
    return new MongoExecutor(new MongoHandle(config.id(), client, database), config.kind());
  }

  /** Client settings derived from {@code config}; nothing is connected. */
  public MongoClientSettings settings(ProviderConfig config) {
    ConnectionString cs = new ConnectionString(connectionString(config));
    MongoClientSettings.Builder b = MongoClientSettings.builder()
        .applyConnectionString(cs)
        .applicationName(cs.getApplicationName() == null ? "polydata" : cs.getApplicationName())
        .uuidRepresentation(UuidRepresentation.STANDARD)
        .applyToConnectionPoolSettings(p -> p
            .maxSize(config.poolSize())
            .maxConnectionIdleTime(config.idleTimeout().toMillis(), TimeUnit.MILLISECONDS))
        .applyToSocketSettings(s -> s.connectTimeout((int) config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS))
        .applyToClusterSettings(c -> c.serverSelectionTimeout(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS));
    if (cs.getCredential() == null && present(config.password())) {
      String user = present(config.username()) ? config.username() : accountName(config);
      b.credential(MongoCredential.createCredential(user, config.option("authSource", "admin"),
          config.password().toCharArray()));
    }
    return b.build();
  }

  /** Connection string without credentials unless the configured url already carries them. */
  public String connectionString(ProviderConfig config) {
    String url = config.url();
    if (present(url) && url.trim().startsWith("mongodb")) return url.trim();
    return switch (config.kind()) {
      case MANAGED_DOCUMENT -> "mongodb://" + accountName(config) + ".mongo.cosmos.azure.com:" + config.port()
          + "/?ssl=true&replicaSet=globaldb&retryWrites=false&maxIdleTimeMS=120000&appName=@"
          + accountName(config) + "@";
      case GRAPH_DOCUMENT -> throw new ProviderConnectionException(config.id(),
          "Graph-document providers need a MongoDB-compatible connection string, got " + (present(url) ? url : "none"), null);
      default -> "mongodb://" + host(config) + ":" + config.port() + "/" + (config.tls() ? "?tls=true" : "");
    };
  }

  /** Database from the connection string path, else the configured database, else {@value #DEFAULT_DATABASE}. */
  public String databaseName(ProviderConfig config) {
    String fromUrl = new ConnectionString(connectionString(config)).getDatabase();
    if (present(fromUrl)) return fromUrl;
    String db = config.option("databaseName", config.database());
    return present(db) ? db : DEFAULT_DATABASE;
  }

  /** First label of the endpoint host ({@code acct} in {@code https://acct.documents.azure.com:443/}). */
  static String accountName(ProviderConfig config) {
    String h = host(config);
    int dot = h.indexOf('.');
    return dot < 0 ? h : h.substring(0, dot);
  }

  private static String host(ProviderConfig config) {
    String url = config.url();
    if (!present(url)) return config.host();
    String u = url.trim();
    String h = u.contains("://") ? URI.create(u).getHost() : u;
    if (h == null) return config.host();
    int colon = h.indexOf(':');
    int slash = h.indexOf('/');
    int end = colon >= 0 ? colon : (slash >= 0 ? slash : h.length());
    return h.substring(0, end);
  }

  private static boolean present(String s) {
    return s != null && !s.isBlank();
  }
}
