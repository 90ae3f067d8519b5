package io.intellixity.polydata.schema;

/** {@code created} is true when the store holds the container afterwards, new or pre-existing. */
public record SchemaResult(String table, boolean created) {
}
