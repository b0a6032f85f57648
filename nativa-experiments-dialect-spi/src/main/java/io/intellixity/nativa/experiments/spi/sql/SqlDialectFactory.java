package io.intellixity.nativa.experiments.spi.sql;

/**
 * Creates a {@link SqlDialect} bound to one datasource's connection parameters.
 * Implementations are registered in {@code META-INF/nativa.factories}.
 */
public interface SqlDialectFactory {
  /** Engine id, e.g. {@code bigquery}; unique across the classpath. */
  String id();

  SqlDialect create(ConnectionParams params);
}
