package io.intellixity.nativa.experiments.sql.query;

import io.intellixity.nativa.experiments.model.ActivationDimension;
import io.intellixity.nativa.experiments.model.AnalysisSettings;
import io.intellixity.nativa.experiments.model.DatasourceSettings;
import io.intellixity.nativa.experiments.model.DimensionSpec;
import io.intellixity.nativa.experiments.model.ExperimentDimension;
import io.intellixity.nativa.experiments.model.ExposureQuery;
import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.model.UserDimension;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.sql.identity.IdentityPlan;
import io.intellixity.nativa.experiments.sql.metric.DimensionColumn;
import io.intellixity.nativa.experiments.sql.metric.DimensionCteBuilder;
import io.intellixity.nativa.experiments.sql.metric.MetricCteBuilder;
import io.intellixity.nativa.experiments.sql.metric.MetricExpressions;
import io.intellixity.nativa.experiments.sql.metric.SegmentCteBuilder;
import io.intellixity.nativa.experiments.template.SqlTemplateCompiler;
import io.intellixity.nativa.experiments.template.SqlTemplateVars;
import io.intellixity.nativa.experiments.time.TimeWindows;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CTEs that turn raw exposures into one row per analysed unit: {@code __rawExperiment},
 * {@code __experiment}, the optional {@code __activationMetric}, {@code __segment} and
 * {@code __dimension*} CTEs, and {@code __experimentUnits}.
 */
public final class ExperimentUnitsCteBuilder {
  private final SqlDialect dialect;
  private final DatasourceSettings datasource;
  private final SqlTemplateCompiler templates;
  private final MetricExpressions expr;
  private final MetricCteBuilder metrics;
  private final SegmentCteBuilder segments;
  private final DimensionCteBuilder dimensions;
  private final Clock clock;

  public ExperimentUnitsCteBuilder(SqlDialect dialect, DatasourceSettings datasource, SqlTemplateCompiler templates, Clock clock) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.datasource = datasource == null ? DatasourceSettings.EMPTY : datasource;
    this.templates = Objects.requireNonNull(templates, "templates");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.expr = new MetricExpressions(dialect);
    this.metrics = new MetricCteBuilder(expr, templates);
    this.segments = new SegmentCteBuilder(dialect, templates);
    this.dimensions = new DimensionCteBuilder(dialect);
  }

  public ExposureQuery exposureQuery(AnalysisSettings settings) {
    return datasource.exposureQuery(settings.exposureQueryId(), settings.userIdType());
  }

  /** Id types supplied by the unit-level participants: user dimensions, segment and activation metric. */
  public List<List<String>> idTypeObjects(ExperimentUnitsRequest req) {
    List<List<String>> objects = new ArrayList<>();
    for (UserDimension d : userDimensions(req)) objects.add(List.of(d.userIdType()));
    if (req.segment() != null) objects.add(List.of(req.segment().userIdType()));
    if (req.activationMetric() != null) {
      objects.add(MetricCteBuilder.userIdTypes(req.activationMetric(), req.factTables(), false));
    }
    return objects;
  }

  /** Breakdown columns of {@code __distinctUsers}; an activation breakdown needs an activation metric. */
  public List<DimensionColumn> dimensionColumns(ExperimentUnitsRequest req) {
    List<DimensionColumn> cols = new ArrayList<>();
    for (DimensionSpec d : req.dimensions()) {
      if (d instanceof ActivationDimension && req.activationMetric() == null) continue;
      cols.add(dimensions.dimensionColumn(d));
    }
    return cols;
  }

  /** Comma-separated CTE definitions, without a trailing comma. */
  public String build(ExperimentUnitsRequest req, IdentityPlan ids) {
    AnalysisSettings settings = req.settings();
    String base = ids.baseIdType();
    ExposureQuery exposure = exposureQuery(settings);
    SqlTemplateVars vars = SqlTemplateVars.forAnalysis(settings, settings.startDate(), settings.endDate());
    Instant endDate = TimeWindows.experimentEndDate(settings.endDate(), settings.skipPartialData(), 0, clock);
    List<ExperimentDimension> experimentDims = req.dimensions().stream()
        .filter(ExperimentDimension.class::isInstance).map(ExperimentDimension.class::cast).toList();
    List<UserDimension> userDims = userDimensions(req);
    MetricSpec activation = req.activationMetric();

    StringBuilder sb = new StringBuilder();
    sb.append("__rawExperiment AS (\n").append(templates.compile(exposure.query(), vars)).append("\n),\n");

    sb.append("__experiment AS (\n-- Viewed Experiment\nSELECT\n")
        .append("  e.").append(base).append(" as ").append(base).append('\n')
        .append("  , ").append(dialect.castToString("e.variation_id")).append(" as variation\n")
        .append("  , ").append(dialect.castUserDateCol("e.timestamp")).append(" as timestamp\n");
    for (ExperimentDimension d : experimentDims) {
      String value = d.specifiedSlices().isEmpty() ? "e." + d.id() : dimensions.specifiedSlices("e." + d.id(), d.specifiedSlices());
      sb.append("  , ").append(value).append(" AS dim_").append(d.id()).append('\n');
    }
    sb.append("FROM\n  __rawExperiment e\nWHERE\n")
        .append("  e.experiment_id = '").append(dialect.escapeStringLiteral(settings.experimentId())).append("'\n")
        .append("  AND e.timestamp >= ").append(dialect.toTimestamp(settings.startDate())).append('\n')
        .append("  AND e.timestamp <= ").append(dialect.toTimestamp(endDate)).append('\n');
    if (settings.queryFilter() != null && !settings.queryFilter().isBlank()) {
      sb.append("  AND (\n").append(settings.queryFilter()).append("\n  )\n");
    }
    sb.append(')');

    if (activation != null) {
      Instant start = TimeWindows.metricStart(settings.startDate(), TimeWindows.metricMinDelay(List.of(activation)), 0);
      Instant end = TimeWindows.metricEnd(List.of(activation), settings.endDate(), settings.overrideConversionWindows());
      sb.append(",\n__activationMetric AS (\n")
          .append(metrics.metricCte(activation, ids, start, end, vars, req.factTables(), false))
          .append("\n)");
    }
    if (req.segment() != null) {
      sb.append(",\n__segment AS (\n")
          .append(segments.segmentCte(req.segment(), ids, req.factTables(), vars))
          .append("\n)");
    }
    for (int i = 0; i < userDims.size(); i++) {
      sb.append(",\n").append(dimensionTable(i)).append(" AS (\n")
          .append(dimensions.dimensionCte(userDims.get(i), ids))
          .append("\n)");
    }

    sb.append(",\n__experimentUnits AS (\n-- One row per user\nSELECT\n")
        .append("  e.").append(base).append(" AS ").append(base).append('\n');
    if (settings.removeMultipleExposures()) {
      sb.append("  , ").append(dialect.ifElse("count(distinct e.variation) > 1", "'__multiple__'", "max(e.variation)"))
          .append(" AS variation\n");
    } else {
      sb.append("  , e.variation AS variation\n");
    }
    sb.append("  , MIN(e.timestamp) AS first_exposure_timestamp\n");
    for (int i = 0; i < userDims.size(); i++) {
      sb.append("  , ").append(dimensions.userDimensionValue(dimensionTable(i)))
          .append(" AS dim_unit_").append(userDims.get(i).id()).append('\n');
    }
    for (ExperimentDimension d : experimentDims) {
      sb.append("  , ").append(dimensions.experimentDimensionValue(d)).append(" AS dim_exp_").append(d.id()).append('\n');
    }
    if (activation != null) {
      String window = expr.conversionWindowClause("e.timestamp", "a.timestamp", activation, settings.endDate(),
          settings.overrideConversionWindows());
      sb.append("  , MIN(").append(dialect.ifElse(window, "a.timestamp", "NULL")).append(") AS first_activation_timestamp\n");
    }
    sb.append("FROM\n  __experiment e\n");
    if (req.segment() != null) {
      sb.append("  JOIN __segment s ON (s.").append(base).append(" = e.").append(base).append(")\n");
    }
    for (int i = 0; i < userDims.size(); i++) {
      String t = dimensionTable(i);
      sb.append("  LEFT JOIN ").append(t).append(' ').append(t).append(" ON (")
          .append(t).append('.').append(base).append(" = e.").append(base).append(")\n");
    }
    if (activation != null) {
      sb.append("  LEFT JOIN __activationMetric a ON (a.").append(base).append(" = e.").append(base).append(")\n");
    }
    if (req.segment() != null) {
      sb.append("WHERE s.date <= e.timestamp\n");
    }
    sb.append("GROUP BY\n  e.").append(base);
    if (!settings.removeMultipleExposures()) sb.append(", e.variation");
    sb.append("\n)");
    return sb.toString();
  }

  /** User dimensions with their SQL template-compiled against the analysis dates. */
  List<UserDimension> userDimensions(ExperimentUnitsRequest req) {
    AnalysisSettings s = req.settings();
    SqlTemplateVars vars = SqlTemplateVars.of(s.startDate(), s.endDate()).withExperimentId(s.experimentId());
    List<UserDimension> out = new ArrayList<>();
    for (DimensionSpec d : req.dimensions()) {
      if (d instanceof UserDimension u) out.add(u.withSql(templates.compile(u.sql(), vars)));
    }
    return out;
  }

  static String dimensionTable(int index) {
    return index == 0 ? "__dimension" : "__dimension" + index;
  }
}
