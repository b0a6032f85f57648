package io.intellixity.nativa.experiments.sql.stats;

import io.intellixity.nativa.experiments.sql.metric.DimensionColumn;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the statistics SELECT is built from.
 *
 * Table names are prefixes: the table for source index {@code i > 0} is the prefix followed by {@code i}.
 * {@code eventQuantileTable} is only joined when {@code hasEventQuantiles} is set.
 */
public record StatisticsRequest(List<DimensionColumn> dimensionCols,
                               List<FactMetricData> metricData,
                               boolean hasEventQuantiles,
                               String baseIdType,
                               String joinedMetricTable,
                               String eventQuantileTable,
                               String cupedMetricTable,
                               String capValueTable,
                               List<Integer> tableIndices,
                               Set<Integer> regressionAdjustedTableIndices,
                               Set<Integer> percentileTableIndices) {
  public StatisticsRequest {
    Objects.requireNonNull(baseIdType, "baseIdType");
    Objects.requireNonNull(joinedMetricTable, "joinedMetricTable");
    dimensionCols = List.copyOf(dimensionCols);
    metricData = List.copyOf(metricData);
    tableIndices = tableIndices == null || tableIndices.isEmpty() ? List.of(0) : List.copyOf(tableIndices);
    regressionAdjustedTableIndices = regressionAdjustedTableIndices == null ? Set.of() : Set.copyOf(regressionAdjustedTableIndices);
    percentileTableIndices = percentileTableIndices == null ? Set.of() : Set.copyOf(percentileTableIndices);
  }
}
