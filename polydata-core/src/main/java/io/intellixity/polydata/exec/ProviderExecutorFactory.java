package io.intellixity.polydata.exec;

import io.intellixity.polydata.provider.ProviderConfig;
import io.intellixity.polydata.provider.ProviderKind;

import java.util.Set;

/**
 * Opens executors for one provider family.
 * <p>
 * Implementations are listed in {@code META-INF/polydata.factories} under this interface's name and
 * must have a public no-arg constructor.
 */
public interface ProviderExecutorFactory {
  Set<ProviderKind> kinds();

  /** Open the native client; connectivity is verified afterwards with {@link ProviderExecutor#ping()}. */
  ProviderExecutor create(ProviderConfig config);
}
