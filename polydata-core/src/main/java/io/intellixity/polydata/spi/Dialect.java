package io.intellixity.polydata.spi;

import io.intellixity.polydata.exec.NativeStatement;
import io.intellixity.polydata.query.QueryDescriptor;

/** Backend-specific SPI: compiles a provider-agnostic descriptor into a native statement. */
public interface Dialect<S extends NativeStatement> {
  String id();

  /**
   * @throws io.intellixity.polydata.error.UnsupportedQueryException when the descriptor uses
   *     something this backend cannot express
   */
  S compile(QueryDescriptor query);
}
