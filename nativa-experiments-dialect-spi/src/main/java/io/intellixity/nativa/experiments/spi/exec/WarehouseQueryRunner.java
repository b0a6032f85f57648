package io.intellixity.nativa.experiments.spi.exec;

import io.intellixity.nativa.experiments.error.UnsupportedCapabilityException;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Executes compiled SQL against a warehouse. Lives outside this library; the compiler never calls it.
 *
 * Failures complete the future exceptionally with a warehouse-specific error; an empty
 * result is never used to signal failure.
 */
public interface WarehouseQueryRunner {
  /** Engine id this runner talks to; matches {@code SqlDialect#id()}. */
  String id();

  /**
   * @param externalIdCallback receives the warehouse job id as soon as it is known, for engines that have one
   */
  CompletableFuture<QueryResponse> runQuery(String sql, Consumer<String> externalIdCallback);

  default CompletableFuture<QueryResponse> runQuery(String sql) {
    return runQuery(sql, id -> {});
  }

  default CompletableFuture<Void> cancelQuery(String externalId) {
    return CompletableFuture.failedFuture(UnsupportedCapabilityException.of(id(), "cancelQuery"));
  }
}
