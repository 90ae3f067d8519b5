package io.intellixity.polydata.exec;

/** Marker for provider-native compiled statements (SQL text + binds, document operation, ...). */
public interface NativeStatement {
}
