package io.intellixity.nativa.experiments.sql.query;

import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.model.MetricType;

import java.util.List;
import java.util.Objects;

/**
 * One metric analysed over an experiment's units. {@code denominatorMetrics} are funnel steps
 * when the last one is binomial, otherwise the last one is a ratio denominator.
 */
public record ExperimentMetricRequest(ExperimentUnitsRequest units, MetricSpec metric, List<MetricSpec> denominatorMetrics) {
  public ExperimentMetricRequest {
    Objects.requireNonNull(units, "units");
    Objects.requireNonNull(metric, "metric");
    denominatorMetrics = denominatorMetrics == null ? List.of() : List.copyOf(denominatorMetrics);
  }

  public MetricSpec denominator() {
    return denominatorMetrics.isEmpty() ? null : denominatorMetrics.get(denominatorMetrics.size() - 1);
  }

  public boolean isFunnel() {
    MetricSpec d = denominator();
    return d != null && d.type() == MetricType.BINOMIAL;
  }

  public boolean isRatio() {
    MetricSpec d = denominator();
    return d != null && d.type() != MetricType.BINOMIAL;
  }
}
