package io.intellixity.polydata.cache;

import io.intellixity.polydata.exec.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Read-through TTL cache of query results.
 * <p>
 * Entries expire lazily on access once {@code now > expiresAt}; when a scheduler is supplied an
 * expiry timer also removes them proactively. Concurrent writers race with last-write-wins.
 * <p>
 * There is no invalidation on mutation: a cached read may be stale for up to the TTL after a write
 * through any path. Callers that need fresher data use {@link #invalidate(String)},
 * {@link #invalidateProvider(String)} or skip caching.
 */
public final class ResultCache implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

  private final long ttlMillis;
  private final LongSupplier nowMillis;
  private final ScheduledExecutorService scheduler;

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();
  private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private record Entry(QueryResult value, long expiresAt) {}

  public ResultCache(Duration ttl, ScheduledExecutorService scheduler) {
    this(ttl, scheduler, System::currentTimeMillis);
  }

  public ResultCache(Duration ttl, ScheduledExecutorService scheduler, LongSupplier nowMillis) {
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("ttl must be > 0");
    this.ttlMillis = ttl.toMillis();
    this.scheduler = scheduler;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public Duration ttl() { return Duration.ofMillis(ttlMillis); }

  /** Cached value, or {@code null} on miss or expiry. */
  public QueryResult get(String key) {
    Objects.requireNonNull(key, "key");
    Entry e = entries.get(key);
    if (e == null) return null;
    if (nowMillis.getAsLong() > e.expiresAt()) {
      entries.remove(key, e);
      return null;
    }
    return e.value();
  }

  /** Ignored once the cache is closed. */
  public void put(String key, QueryResult value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    if (closed.get()) {
      log.debug("polydata.cache op=put key={} status=closed", key);
      return;
    }
    Entry e = new Entry(value, nowMillis.getAsLong() + ttlMillis);
    entries.put(key, e);
    scheduleExpiry(key, e);
  }

  public QueryResult getOrCompute(String key, Supplier<QueryResult> loader) {
    Objects.requireNonNull(loader, "loader");
    QueryResult hit = get(key);
    if (hit != null) {
      log.debug("polydata.cache op=hit key={}", key);
      return hit;
    }
    log.debug("polydata.cache op=miss key={}", key);
    QueryResult loaded = loader.get();
    put(key, loaded);
    return loaded;
  }

  public void invalidate(String key) {
    entries.remove(key);
    cancelTimer(key);
  }

  /** Drop every entry whose key belongs to {@code providerId}. */
  public void invalidateProvider(String providerId) {
    String prefix = providerId + ":";
    for (String k : entries.keySet()) {
      if (k.startsWith(prefix)) invalidate(k);
    }
  }

  public void invalidateAll() {
    entries.clear();
    timers.values().forEach(f -> f.cancel(false));
    timers.clear();
  }

  public int size() { return entries.size(); }

  public boolean isClosed() { return closed.get(); }

  /** Cancels outstanding expiry timers and clears the cache; later reads compute without caching. */
  @Override
  public void close() {
    closed.set(true);
    int pending = timers.size();
    invalidateAll();
    log.debug("polydata.cache op=close cancelledTimers={}", pending);
  }

  private void scheduleExpiry(String key, Entry e) {
    if (scheduler == null) return;
    ScheduledFuture<?> f = scheduler.schedule(() -> {
      entries.remove(key, e);
      timers.remove(key);
    }, ttlMillis, TimeUnit.MILLISECONDS);
    ScheduledFuture<?> prev = timers.put(key, f);
    if (prev != null) prev.cancel(false);
  }

  private void cancelTimer(String key) {
    ScheduledFuture<?> f = timers.remove(key);
    if (f != null) f.cancel(false);
  }
}
