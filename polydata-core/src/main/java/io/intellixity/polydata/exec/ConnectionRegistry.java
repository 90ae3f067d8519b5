package io.intellixity.polydata.exec;

import io.intellixity.polydata.error.NoConnectionException;
import io.intellixity.polydata.error.NoProvidersAvailableException;
import io.intellixity.polydata.error.ProviderConnectionException;
import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.provider.ProviderConfig;
import io.intellixity.polydata.provider.ProviderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Holds one executor per connected provider for the lifetime of a {@code Polydata} instance.
 * <p>
 * Connect failures are tolerated per provider: the provider is excluded from routing and startup
 * continues. Operations against an excluded or unknown provider fail with
 * {@link NoConnectionException}.
 */
public final class ConnectionRegistry implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final ExecutorFactoryIndex factories;
  private final Map<String, ProviderExecutor> executors = new LinkedHashMap<>();
  private final ExecutorService io;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public ConnectionRegistry(ExecutorFactoryIndex factories, ExecutorService io) {
    this.factories = Objects.requireNonNull(factories, "factories");
    this.io = Objects.requireNonNull(io, "io");
  }

  /** Later factories win for the kinds they declare. */
  public ConnectionRegistry(List<? extends ProviderExecutorFactory> factories, ExecutorService io) {
    this(ExecutorFactoryIndex.of(factories), io);
  }

  public Set<ProviderKind> supportedKinds() {
    return factories.kinds();
  }

  /**
   * Open the provider and ping it within its connect timeout. A client that opens after the timeout
   * has elapsed is closed.
   *
   * @throws ProviderConnectionException when no factory serves the kind, the driver fails, the ping
   *     fails or the timeout elapses
   */
  public ProviderExecutor connect(ProviderConfig config) {
    Objects.requireNonNull(config, "config");
    synchronized (this) {
      if (closed.get()) throw new IllegalStateException("ConnectionRegistry is closed");
      if (executors.containsKey(config.id())) {
        throw new ValidationException("Provider already connected: " + config.id());
      }
    }
    ProviderExecutorFactory factory = factories.factoryFor(config);

    long start = System.nanoTime();
    Handoff handoff = new Handoff();
    Future<ProviderExecutor> pending = io.submit(() -> {
      ProviderExecutor opened = openAndPing(factory, config);
      if (handoff.deliver()) return opened;
      closeLate(config, opened);
      return null;
    });
    ProviderExecutor executor;
    try {
      executor = await(pending, handoff, config);
    } catch (ExecutionException e) {
      Throwable cause = (e.getCause() == null) ? e : e.getCause();
      throw new ProviderConnectionException(config.id(), "Connect failed: " + cause.getClass().getSimpleName(), cause);
    }

    synchronized (this) {
      executors.put(config.id(), executor);
    }
    log.info("polydata.registry op=connect provider={} kind={} durationMs={}",
        config.id(), config.kind(), (System.nanoTime() - start) / 1_000_000.0);
    return executor;
  }

  private static ProviderExecutor await(Future<ProviderExecutor> pending, Handoff handoff, ProviderConfig config)
      throws ExecutionException {
    long timeoutMs = config.connectTimeout().toMillis();
    boolean interrupted = false;
    try {
      return pending.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      if (handoff.abandon()) {
        pending.cancel(true);
        throw new ProviderConnectionException(config.id(), "Connect timed out after " + timeoutMs + "ms", e);
      }
    } catch (InterruptedException e) {
      if (handoff.abandon()) {
        pending.cancel(true);
        Thread.currentThread().interrupt();
        throw new ProviderConnectionException(config.id(), "Interrupted while connecting", e);
      }
      interrupted = true;
    }
    // Handed over as the wait ended; the task is returning it.
    try {
      while (true) {
        try {
          return pending.get();
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) Thread.currentThread().interrupt();
    }
  }

  private static void closeLate(ProviderConfig config, ProviderExecutor executor) {
    log.warn("polydata.registry op=connect provider={} kind={} status=late_close", config.id(), config.kind());
    try {
      executor.close();
    } catch (RuntimeException e) {
      log.warn("polydata.registry op=close provider={} status=failed reason={}", config.id(), e.toString());
    }
  }

  /** Decides whether a client opened near the deadline goes to the caller or is closed. */
  private static final class Handoff {
    private boolean abandoned;
    private boolean delivered;

    synchronized boolean abandon() {
      if (delivered) return false;
      abandoned = true;
      return true;
    }

    synchronized boolean deliver() {
      if (abandoned) return false;
      delivered = true;
      return true;
    }
  }

  private static ProviderExecutor openAndPing(ProviderExecutorFactory factory, ProviderConfig config) {
    ProviderExecutor executor = factory.create(config);
    try {
      executor.ping();
    } catch (RuntimeException e) {
      try {
        executor.close();
      } catch (RuntimeException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    return executor;
  }

  /**
   * Connect every provider; failures are logged and returned, the rest stay available.
   *
   * @throws NoProvidersAvailableException when no provider could be connected
   */
  public List<ProviderFailure> initialize(List<ProviderConfig> configs) {
    Objects.requireNonNull(configs, "configs");
    List<ProviderFailure> failures = new ArrayList<>();
    for (ProviderConfig cfg : configs) {
      try {
        connect(cfg);
      } catch (ProviderConnectionException | ValidationException e) {
        log.warn("polydata.registry op=connect provider={} kind={} status=excluded reason={}",
            cfg.id(), cfg.kind(), e.getMessage());
        failures.add(new ProviderFailure(cfg.id(), "connect", e));
      }
    }
    if (availableProviders().isEmpty()) {
      throw new NoProvidersAvailableException("No providers available (" + failures.size() + " failed to connect)");
    }
    return failures;
  }

  /** @throws NoConnectionException when the provider is unknown or was excluded */
  public synchronized ProviderExecutor executor(String providerId) {
    ProviderExecutor e = (providerId == null) ? null : executors.get(providerId);
    if (e == null) throw new NoConnectionException(providerId);
    return e;
  }

  public synchronized boolean isAvailable(String providerId) {
    return providerId != null && executors.containsKey(providerId);
  }

  /** Connected provider ids in connection order. */
  public synchronized List<String> availableProviders() {
    return List.copyOf(executors.keySet());
  }

  /**
   * Close every executor independently. Idempotent; a second call returns an empty list.
   *
   * @return per-provider close failures (also logged)
   */
  public List<ProviderFailure> closeAll() {
    if (!closed.compareAndSet(false, true)) return List.of();
    Map<String, ProviderExecutor> snapshot;
    synchronized (this) {
      snapshot = new LinkedHashMap<>(executors);
      executors.clear();
    }
    List<ProviderFailure> failures = new ArrayList<>();
    for (var e : snapshot.entrySet()) {
      try {
        e.getValue().close();
        log.info("polydata.registry op=close provider={}", e.getKey());
      } catch (RuntimeException ex) {
        log.warn("polydata.registry op=close provider={} status=failed reason={}", e.getKey(), ex.toString());
        failures.add(new ProviderFailure(e.getKey(), "close", ex));
      }
    }
    return failures;
  }

  @Override
  public void close() {
    closeAll();
  }
}
