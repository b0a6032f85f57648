package io.intellixity.nativa.experiments.sql.metric;

import io.intellixity.nativa.experiments.model.MetricSpec;

import java.util.Objects;

/** A fact metric and its position in the request; the position names its columns ({@code m<index>_value}). */
public record IndexedMetric(MetricSpec metric, int index) {
  public IndexedMetric {
    Objects.requireNonNull(metric, "metric");
  }

  public String alias() {
    return "m" + index;
  }
}
