package io.intellixity.polydata.cache;

import io.intellixity.polydata.error.ValidationException;
import io.intellixity.polydata.exec.QueryResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class ResultCacheTest {

  @Test
  void servesHitsUntilTtlElapsesThenReloads() {
    AtomicLong now = new AtomicLong(1_000);
    ResultCache cache = new ResultCache(Duration.ofSeconds(10), null, now::get);
    AtomicInteger loads = new AtomicInteger();

    cache.getOrCompute("pg:k", () -> { loads.incrementAndGet(); return QueryResult.ofCount(1); });
    now.addAndGet(10_000);
    cache.getOrCompute("pg:k", () -> { loads.incrementAndGet(); return QueryResult.ofCount(1); });
    assertEquals(1, loads.get());

    now.addAndGet(1);
    cache.getOrCompute("pg:k", () -> { loads.incrementAndGet(); return QueryResult.ofCount(1); });
    assertEquals(2, loads.get());
  }

  @Test
  void invalidatesByKeyProviderAndAll() {
    ResultCache cache = new ResultCache(Duration.ofMinutes(5), null, () -> 0L);
    cache.put("pg:a", QueryResult.ofCount(1));
    cache.put("pg:b", QueryResult.ofCount(2));
    cache.put("mongo:a", QueryResult.ofCount(3));

    cache.invalidate("pg:a");
    assertNull(cache.get("pg:a"));
    cache.invalidateProvider("pg");
    assertNull(cache.get("pg:b"));
    assertNotNull(cache.get("mongo:a"));
    cache.invalidateAll();
    assertEquals(0, cache.size());
  }

  @Test
  void keysIgnoreMapInsertionOrder() {
    Map<String, Object> a = new LinkedHashMap<>();
    a.put("x", 1);
    a.put("y", "two");
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("y", "two");
    b.put("x", 1);
    assertEquals(CacheKeys.of("pg", a, List.of()), CacheKeys.of("pg", b, List.of()));
    assertNotEquals(CacheKeys.of("pg", a, List.of()), CacheKeys.of("mysql", a, List.of()));
    assertTrue(CacheKeys.of("pg", a, List.of()).startsWith("pg:"));
  }

  @Test
  void rejectsCyclicParameters() {
    Map<String, Object> self = new HashMap<>();
    self.put("self", self);
    assertThrows(ValidationException.class, () -> CacheKeys.of("pg", "select 1", List.of(self)));
  }

  private static final class Opaque {
    private final int value;

    Opaque(int value) {
      this.value = value;
    }
  }

  @Test
  void rejectsParametersWithoutSerializableProperties() {
    ValidationException e = assertThrows(ValidationException.class,
        () -> CacheKeys.of("pg", "select * from t where v = ?", List.of(new Opaque(1))));
    assertTrue(e.getMessage().startsWith("Cache key inputs are not serializable"));
  }

  @Test
  void computesWithoutCachingOnceClosed() {
    ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor();
    ResultCache cache = new ResultCache(Duration.ofMinutes(5), timers);
    cache.close();
    timers.shutdown();
    AtomicInteger loads = new AtomicInteger();

    cache.getOrCompute("pg:k", () -> { loads.incrementAndGet(); return QueryResult.ofCount(1); });
    cache.getOrCompute("pg:k", () -> { loads.incrementAndGet(); return QueryResult.ofCount(1); });

    assertTrue(cache.isClosed());
    assertEquals(2, loads.get());
    assertEquals(0, cache.size());
  }
}
