package io.intellixity.polydata.exec;

import io.intellixity.polydata.error.ProviderConnectionException;
import io.intellixity.polydata.provider.ProviderConfig;
import io.intellixity.polydata.provider.ProviderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * The executor factory serving each {@link ProviderKind}.
 * <p>
 * Engine modules register their factory in {@code META-INF/polydata.factories}:
 * <pre>
 * io.intellixity.polydata.exec.ProviderExecutorFactory=io.intellixity.polydata.mongo.MongoExecutorFactory
 * </pre>
 * Two discovered factories may not serve the same kind. Factories passed to
 * {@link #override(ProviderExecutorFactory)} replace whatever serves their kinds.
 */
public final class ExecutorFactoryIndex {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactoryIndex.class);

  public static final String RESOURCE = "META-INF/polydata.factories";
  static final String KEY = ProviderExecutorFactory.class.getName();

  private final Map<ProviderKind, ProviderExecutorFactory> byKind = new EnumMap<>(ProviderKind.class);

  public static ExecutorFactoryIndex empty() {
    return new ExecutorFactoryIndex();
  }

  public static ExecutorFactoryIndex of(List<? extends ProviderExecutorFactory> factories) {
    ExecutorFactoryIndex index = new ExecutorFactoryIndex();
    if (factories != null) factories.forEach(index::override);
    return index;
  }

  /** Factories registered by every engine module visible to the context class loader. */
  public static ExecutorFactoryIndex discover() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    return discover(cl == null ? ExecutorFactoryIndex.class.getClassLoader() : cl);
  }

  public static ExecutorFactoryIndex discover(ClassLoader cl) {
    Objects.requireNonNull(cl, "cl");
    try {
      return fromResources(Collections.list(cl.getResources(RESOURCE)), cl);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot list " + RESOURCE, e);
    }
  }

  static ExecutorFactoryIndex fromResources(List<URL> resources, ClassLoader cl) {
    Set<String> classNames = new LinkedHashSet<>();
    for (URL url : resources) classNames.addAll(factoryClassNames(url));
    ExecutorFactoryIndex index = new ExecutorFactoryIndex();
    for (String name : classNames) index.add(instantiate(name, cl));
    return index;
  }

  private static List<String> factoryClassNames(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + url, e);
    }
    String value = p.getProperty(KEY, "");
    return value.isBlank() ? List.of() : List.of(value.trim().split("\\s*,\\s*"));
  }

  private static ProviderExecutorFactory instantiate(String className, ClassLoader cl) {
    Class<?> type;
    try {
      type = Class.forName(className, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Executor factory class not found: " + className, e);
    }
    if (!ProviderExecutorFactory.class.isAssignableFrom(type)) {
      throw new IllegalStateException(className + " is not a " + ProviderExecutorFactory.class.getSimpleName());
    }
    try {
      return (ProviderExecutorFactory) type.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot create executor factory " + className, e);
    }
  }

  private void add(ProviderExecutorFactory factory) {
    for (ProviderKind kind : factory.kinds()) {
      ProviderExecutorFactory existing = byKind.get(kind);
      if (existing != null) {
        throw new IllegalStateException("Kind " + kind + " is served by both "
            + existing.getClass().getName() + " and " + factory.getClass().getName());
      }
      byKind.put(kind, factory);
    }
    log.debug("polydata.factories op=discover factory={} kinds={}", factory.getClass().getName(), factory.kinds());
  }

  /** Register {@code factory} for its kinds, replacing any earlier factory. */
  public synchronized void override(ProviderExecutorFactory factory) {
    Objects.requireNonNull(factory, "factory");
    for (ProviderKind kind : factory.kinds()) byKind.put(kind, factory);
  }

  /** @throws ProviderConnectionException when no factory serves the provider's kind */
  public synchronized ProviderExecutorFactory factoryFor(ProviderConfig config) {
    ProviderExecutorFactory f = byKind.get(config.kind());
    if (f == null) {
      throw new ProviderConnectionException(config.id(),
          "No executor factory available for kind " + config.kind(), null);
    }
    return f;
  }

  public synchronized ProviderExecutorFactory get(ProviderKind kind) {
    return byKind.get(kind);
  }

  public synchronized Set<ProviderKind> kinds() {
    return Set.copyOf(byKind.keySet());
  }
}
