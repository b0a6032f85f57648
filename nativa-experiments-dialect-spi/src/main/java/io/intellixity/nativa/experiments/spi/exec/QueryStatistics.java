package io.intellixity.nativa.experiments.spi.exec;

/** Optional execution statistics a warehouse reports; any field may be {@code null}. */
public record QueryStatistics(Long executionDurationMs,
                              Long bytesProcessed,
                              Long bytesBilled,
                              Boolean warehouseCachedResult,
                              Long rowsInserted) {
}
