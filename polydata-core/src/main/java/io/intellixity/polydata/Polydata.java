package io.intellixity.polydata;

import io.intellixity.polydata.api.ApiSurface;
import io.intellixity.polydata.api.ApiSurfaceGenerator;
import io.intellixity.polydata.api.GraphQlSurface;
import io.intellixity.polydata.api.RestRoute;
import io.intellixity.polydata.cache.CacheKeys;
import io.intellixity.polydata.cache.ResultCache;
import io.intellixity.polydata.exec.ConnectionRegistry;
import io.intellixity.polydata.exec.ExecutorFactoryIndex;
import io.intellixity.polydata.exec.ProviderExecutor;
import io.intellixity.polydata.exec.ProviderExecutorFactory;
import io.intellixity.polydata.exec.ProviderFailure;
import io.intellixity.polydata.exec.QueryResult;
import io.intellixity.polydata.migration.InMemoryMigrationLedger;
import io.intellixity.polydata.migration.Migration;
import io.intellixity.polydata.migration.MigrationAction;
import io.intellixity.polydata.migration.MigrationContext;
import io.intellixity.polydata.migration.MigrationLedger;
import io.intellixity.polydata.migration.MigrationManager;
import io.intellixity.polydata.migration.MigrationReport;
import io.intellixity.polydata.migration.StoreMigrationLedger;
import io.intellixity.polydata.notify.ChangeNotifier;
import io.intellixity.polydata.notify.RealtimeTransport;
import io.intellixity.polydata.notify.Subscription;
import io.intellixity.polydata.provider.ProviderConfig;
import io.intellixity.polydata.query.QueryBuilder;
import io.intellixity.polydata.query.QueryDescriptor;
import io.intellixity.polydata.query.QueryKind;
import io.intellixity.polydata.query.QueryRunner;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SchemaManager;
import io.intellixity.polydata.schema.SchemaRegistry;
import io.intellixity.polydata.schema.SchemaResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Entry point of the engine: owns the connection registry, schema registry, result cache, change
 * notifier, migrations and generated API surfaces of one application.
 * <pre>
 * Polydata db = Polydata.builder()
 *     .providers(ProviderConfigs.fromEnvironment())
 *     .build();
 * db.addMigration("001", "users", ctx -> ctx.createSchema(ctx.defaultProvider(), USERS));
 * db.initialize();
 * Map&lt;String, Object&gt; ada = db.query().select("*").from("users").where("email", email).first().executeFirst();
 * </pre>
 */
public final class Polydata implements QueryRunner, MigrationContext, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Polydata.class);

  private final PolydataSettings settings;
  private final List<ProviderConfig> providers;
  private final ExecutorService io;
  private final ScheduledExecutorService timers;
  private final ConnectionRegistry connections;
  private final SchemaManager schemas;
  private final ResultCache cache;
  private final ChangeNotifier notifier = new ChangeNotifier();
  private final MigrationManager migrations;
  private final ApiSurfaceGenerator apiGenerator;
  private final Map<String, ApiSurface> surfaces = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private Polydata(Builder b) {
    this.settings = b.settings;
    this.providers = List.copyOf(b.providers);
    this.io = Executors.newFixedThreadPool(settings.ioThreads(), daemonThreads("polydata-io"));
    this.timers = Executors.newSingleThreadScheduledExecutor(daemonThreads("polydata-cache-expiry"));

    ExecutorFactoryIndex factories = b.discoverFactories ? ExecutorFactoryIndex.discover() : ExecutorFactoryIndex.empty();
    b.factories.forEach(factories::override);
    this.connections = new ConnectionRegistry(factories, io);
    this.schemas = new SchemaManager(connections, new SchemaRegistry());
    this.cache = new ResultCache(settings.cacheTimeout(), timers, b.cacheClock);

    MigrationLedger ledger = b.ledger;
    if (ledger == null) {
      ledger = (settings.ledger() == PolydataSettings.LedgerMode.STORE)
          ? new StoreMigrationLedger(settings.defaultProvider(), schemas, this::query)
          : new InMemoryMigrationLedger();
    }
    this.migrations = new MigrationManager(ledger, b.clock);
    this.apiGenerator = new ApiSurfaceGenerator(this::query, notifier);
  }

  public static Builder builder() {
    return new Builder();
  }

  public PolydataSettings settings() { return settings; }
  public ConnectionRegistry connections() { return connections; }
  public ChangeNotifier notifier() { return notifier; }
  public ResultCache cache() { return cache; }
  public MigrationManager migrations() { return migrations; }

  @Override
  public String defaultProvider() { return settings.defaultProvider(); }

  /**
   * Connect every configured provider, then apply registered migrations.
   *
   * @return providers that failed to connect and were excluded
   * @throws io.intellixity.polydata.error.NoProvidersAvailableException when none connected
   * @throws io.intellixity.polydata.error.MigrationFailureException when a migration fails
   */
  public List<ProviderFailure> initialize() {
    List<ProviderFailure> failures = connections.initialize(providers);
    log.info("polydata.init providers={} excluded={}", connections.availableProviders(), failures.size());
    if (!migrations.migrations().isEmpty()) runMigrations();
    return failures;
  }

  // --- queries ---

  @Override
  public QueryBuilder query(String providerId) {
    return new QueryBuilder(this, providerId);
  }

  public QueryBuilder query() {
    return query(settings.defaultProvider());
  }

  @Override
  public QueryResult run(String providerId, QueryDescriptor query, boolean cached) {
    ProviderExecutor executor = connections.executor(providerId);
    if (cached && settings.enableCaching() && query.kind() == QueryKind.SELECT) {
      String key = CacheKeys.of(providerId, query, List.of());
      return cache.getOrCompute(key, () -> executor.execute(query));
    }
    return executor.execute(query);
  }

  @Override
  public CompletableFuture<QueryResult> runAsync(String providerId, QueryDescriptor query, boolean cached) {
    return CompletableFuture.supplyAsync(() -> run(providerId, query, cached), io);
  }

  @Override
  public QueryResult nativeQuery(String providerId, Object statement, List<Object> params) {
    return nativeQuery(providerId, statement, params, false);
  }

  /** Run a provider-native statement, optionally through the result cache. */
  public QueryResult nativeQuery(String providerId, Object statement, List<Object> params, boolean cached) {
    Objects.requireNonNull(statement, "statement");
    ProviderExecutor executor = connections.executor(providerId);
    List<Object> p = (params == null) ? List.of() : params;
    if (cached && settings.enableCaching()) {
      String key = CacheKeys.of(providerId, String.valueOf(statement), p);
      return cache.getOrCompute(key, () -> executor.executeNative(statement, p));
    }
    return executor.executeNative(statement, p);
  }

  // --- schemas ---

  @Override
  public SchemaResult createSchema(String providerId, SchemaDescriptor schema) {
    return schemas.createSchema(providerId, schema);
  }

  public SchemaResult createSchema(SchemaDescriptor schema) {
    return createSchema(settings.defaultProvider(), schema);
  }

  public SchemaDescriptor schema(String providerId, String name) {
    return schemas.schema(providerId, name);
  }

  // --- migrations ---

  public void addMigration(String id, String name, MigrationAction up) {
    addMigration(id, name, up, null);
  }

  public void addMigration(String id, String name, MigrationAction up, MigrationAction down) {
    migrations.register(new Migration(id, name, up, down, null));
  }

  public MigrationReport runMigrations() {
    return migrations.run(this);
  }

  public void revertMigration(String id) {
    migrations.revert(id, this);
  }

  // --- notifications ---

  public void publish(String channel, Object payload) {
    notifier.publish(channel, payload);
  }

  public Subscription subscribe(String channel) {
    return notifier.subscribe(channel);
  }

  /** Ignored when real-time delivery is disabled. */
  public void addRealtimeTransport(RealtimeTransport transport) {
    if (!settings.enableRealtime()) {
      log.info("polydata.realtime status=disabled transport={}", transport.getClass().getSimpleName());
      return;
    }
    notifier.addTransport(transport);
  }

  // --- generated API ---

  /** Generate (and retain) the REST and GraphQL surfaces enabled in the settings. */
  public ApiSurface generateApi(String providerId, SchemaDescriptor schema) {
    Objects.requireNonNull(schema, "schema");
    List<RestRoute> routes = settings.enableRestApi() ? apiGenerator.rest(providerId, schema) : List.of();
    GraphQlSurface graphQl = settings.enableGraphQl() ? apiGenerator.graphQl(providerId, schema) : null;
    ApiSurface surface = new ApiSurface(schema.name(), routes, graphQl);
    surfaces.put(schema.name(), surface);
    return surface;
  }

  public ApiSurface generateApi(SchemaDescriptor schema) {
    return generateApi(settings.defaultProvider(), schema);
  }

  public List<RestRoute> generateRestApi(SchemaDescriptor schema) {
    return generateApi(schema).routes();
  }

  public GraphQlSurface generateGraphQl(SchemaDescriptor schema) {
    return generateApi(schema).graphQl();
  }

  public ApiSurface api(String entity) {
    return surfaces.get(entity);
  }

  public Map<String, ApiSurface> apis() {
    return Map.copyOf(surfaces);
  }

  // --- lifecycle ---

  /**
   * Close providers independently, cancel cache timers, end subscriptions and stop worker threads.
   * Idempotent.
   *
   * @return providers whose close failed
   */
  public List<ProviderFailure> shutdown() {
    if (!closed.compareAndSet(false, true)) return List.of();
    List<ProviderFailure> failures = connections.closeAll();
    cache.close();
    notifier.closeAll();
    timers.shutdownNow();
    io.shutdown();
    log.info("polydata.close failures={}", failures.size());
    return failures;
  }

  @Override
  public void close() {
    shutdown();
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  public static final class Builder {
    private PolydataSettings settings = PolydataSettings.defaults();
    private final List<ProviderConfig> providers = new ArrayList<>();
    private final List<ProviderExecutorFactory> factories = new ArrayList<>();
    private boolean discoverFactories = true;
    private MigrationLedger ledger;
    private Clock clock = Clock.systemUTC();
    private LongSupplier cacheClock = System::currentTimeMillis;

    private Builder() {}

    public Builder settings(PolydataSettings settings) { this.settings = Objects.requireNonNull(settings, "settings"); return this; }
    public Builder provider(ProviderConfig config) { this.providers.add(Objects.requireNonNull(config, "config")); return this; }
    public Builder providers(List<ProviderConfig> configs) { configs.forEach(this::provider); return this; }
    /** Registered after discovered factories, so it wins for the kinds it declares. */
    public Builder factory(ProviderExecutorFactory factory) { this.factories.add(Objects.requireNonNull(factory, "factory")); return this; }
    public Builder discoverFactories(boolean discover) { this.discoverFactories = discover; return this; }
    public Builder ledger(MigrationLedger ledger) { this.ledger = ledger; return this; }
    public Builder clock(Clock clock) { this.clock = Objects.requireNonNull(clock, "clock"); return this; }
    public Builder cacheClock(LongSupplier nowMillis) { this.cacheClock = Objects.requireNonNull(nowMillis, "nowMillis"); return this; }

    public Polydata build() {
      return new Polydata(this);
    }
  }
}
