package io.intellixity.nativa.experiments.sql.metric;

import java.util.Map;

/**
 * Column expressions a metric row is read through, all qualified with the source alias.
 *
 * @param userIds   id type to the column holding it
 * @param timestamp event time column
 * @param value     value expression; {@code 1} for metrics that only record a conversion
 */
public record MetricColumns(Map<String, String> userIds, String timestamp, String value) {
  public MetricColumns {
    userIds = Map.copyOf(userIds);
  }
}
