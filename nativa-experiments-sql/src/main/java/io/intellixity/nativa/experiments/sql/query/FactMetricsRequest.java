package io.intellixity.nativa.experiments.sql.query;

import io.intellixity.nativa.experiments.model.MetricSpec;

import java.util.List;
import java.util.Objects;

/** Fact metrics analysed together over an experiment's units; metrics may span at most two fact tables. */
public record FactMetricsRequest(ExperimentUnitsRequest units, List<MetricSpec> metrics) {
  public FactMetricsRequest {
    Objects.requireNonNull(units, "units");
    metrics = metrics == null ? List.of() : List.copyOf(metrics);
  }
}
