package io.intellixity.nativa.experiments.sql.query;

import io.intellixity.nativa.experiments.model.ActivationDimension;
import io.intellixity.nativa.experiments.model.AnalysisSettings;
import io.intellixity.nativa.experiments.model.DimensionSpec;
import io.intellixity.nativa.experiments.model.FactTableSpec;
import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.model.SegmentSpec;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Which units an analysis covers: the phase settings plus the optional activation metric,
 * breakdown dimensions and segment. {@code factTables} resolves every fact table id the
 * request mentions.
 */
public record ExperimentUnitsRequest(AnalysisSettings settings,
                                     MetricSpec activationMetric,
                                     List<DimensionSpec> dimensions,
                                     SegmentSpec segment,
                                     Map<String, FactTableSpec> factTables) {
  public ExperimentUnitsRequest {
    Objects.requireNonNull(settings, "settings");
    dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    factTables = factTables == null ? Map.of() : Map.copyOf(factTables);
  }

  public static ExperimentUnitsRequest of(AnalysisSettings settings) {
    return new ExperimentUnitsRequest(settings, null, List.of(), null, Map.of());
  }

  public ExperimentUnitsRequest withActivationMetric(MetricSpec metric) {
    return new ExperimentUnitsRequest(settings, metric, dimensions, segment, factTables);
  }

  public ExperimentUnitsRequest withDimensions(List<DimensionSpec> dims) {
    return new ExperimentUnitsRequest(settings, activationMetric, dims, segment, factTables);
  }

  public ExperimentUnitsRequest withSegment(SegmentSpec s) {
    return new ExperimentUnitsRequest(settings, activationMetric, dimensions, s, factTables);
  }

  public ExperimentUnitsRequest withFactTables(Map<String, FactTableSpec> tables) {
    return new ExperimentUnitsRequest(settings, activationMetric, dimensions, segment, tables);
  }

  /** With an activation metric and no activation breakdown, only activated units are analysed. */
  public boolean activatedUnitsOnly() {
    return activationMetric != null && dimensions.stream().noneMatch(d -> d instanceof ActivationDimension);
  }
}
