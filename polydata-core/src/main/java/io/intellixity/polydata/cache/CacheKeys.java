package io.intellixity.polydata.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.intellixity.polydata.error.ValidationException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic cache keys: {@code providerId + ":" + sha256(json(operation, params))}.
 * <p>
 * Map entries and bean properties are serialized in sorted order so that logically equal inputs
 * produce the same key. Cyclic inputs and objects without serializable properties are rejected.
 */
public final class CacheKeys {
  private static final ObjectMapper JSON = JsonMapper.builder()
      .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
      .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
      .findAndAddModules()
      .build();

  private CacheKeys() {}

  public static String of(String providerId, Object operation, Object params) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("operation", operation);
    payload.put("params", params);
    rejectCycles(payload, Collections.newSetFromMap(new IdentityHashMap<>()));
    String json;
    try {
      json = JSON.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Cache key inputs are not serializable: " + e.getOriginalMessage(), e);
    }
    return providerId + ":" + sha256(json);
  }

  private static void rejectCycles(Object o, Set<Object> path) {
    if (o == null) return;
    boolean container = o instanceof Map<?, ?> || o instanceof Iterable<?> || o instanceof Object[];
    if (!container) return;
    if (!path.add(o)) throw new ValidationException("Cache key inputs contain a cycle");
    if (o instanceof Map<?, ?> m) {
      for (var e : m.entrySet()) rejectCycles(e.getValue(), path);
    } else if (o instanceof Iterable<?> it) {
      for (Object v : it) rejectCycles(v, path);
    } else {
      for (Object v : (Object[]) o) rejectCycles(v, path);
    }
    path.remove(o);
  }

  private static String sha256(String s) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      byte[] d = md.digest(s.getBytes(StandardCharsets.UTF_8));
      StringBuilder sb = new StringBuilder(d.length * 2);
      for (byte b : d) sb.append(String.format("%02x", b));
      return sb.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
