package io.intellixity.polydata.query;

import io.intellixity.polydata.exec.QueryResult;

import java.util.concurrent.CompletableFuture;

/** Executes built descriptors; implemented by the engine facade. */
public interface QueryRunner {
  QueryResult run(String providerId, QueryDescriptor query, boolean cached);

  CompletableFuture<QueryResult> runAsync(String providerId, QueryDescriptor query, boolean cached);
}
