package io.intellixity.polydata.migration;

import io.intellixity.polydata.exec.QueryResult;
import io.intellixity.polydata.query.QueryBuilder;
import io.intellixity.polydata.schema.SchemaDescriptor;
import io.intellixity.polydata.schema.SchemaResult;

import java.util.List;

/** Operations available to migration actions. */
public interface MigrationContext {
  String defaultProvider();

  SchemaResult createSchema(String providerId, SchemaDescriptor schema);

  QueryBuilder query(String providerId);

  QueryResult nativeQuery(String providerId, Object statement, List<Object> params);
}
