package io.intellixity.nativa.experiments.sql.query;

import io.intellixity.nativa.experiments.error.InvalidMetricException;
import io.intellixity.nativa.experiments.error.UnsupportedCapabilityException;
import io.intellixity.nativa.experiments.model.AnalysisSettings;
import io.intellixity.nativa.experiments.model.DatasourceSettings;
import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.model.QuantileType;
import io.intellixity.nativa.experiments.spi.sql.PercentileCapSpec;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.sql.format.SqlPrettyPrinter;
import io.intellixity.nativa.experiments.sql.identity.IdentityPlan;
import io.intellixity.nativa.experiments.sql.identity.IdentityResolutionPlanner;
import io.intellixity.nativa.experiments.sql.metric.DimensionColumn;
import io.intellixity.nativa.experiments.sql.metric.IndexedMetric;
import io.intellixity.nativa.experiments.sql.metric.MetricCteBuilder;
import io.intellixity.nativa.experiments.sql.metric.MetricExpressions;
import io.intellixity.nativa.experiments.sql.metric.SegmentCteBuilder;
import io.intellixity.nativa.experiments.sql.stats.FactMetricData;
import io.intellixity.nativa.experiments.sql.stats.StatisticsCteBuilder;
import io.intellixity.nativa.experiments.sql.stats.StatisticsRequest;
import io.intellixity.nativa.experiments.template.SqlTemplateCompiler;
import io.intellixity.nativa.experiments.template.SqlTemplateVars;
import io.intellixity.nativa.experiments.time.TimeWindow;
import io.intellixity.nativa.experiments.time.TimeWindows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compiles experiment and metric analyses into a single SQL statement for one warehouse dialect.
 *
 * Instances hold no per-call state and may be shared between threads. Every query is built
 * as one {@code WITH} chain: identity joins, experiment units, {@code __distinctUsers}, metric
 * CTEs, per-unit aggregates, {@code __stats}, and a final select joining {@code __stats} to
 * {@code __overallUsers}.
 */
public final class ExperimentQueryCompiler {
  private static final Logger log = LoggerFactory.getLogger(ExperimentQueryCompiler.class);

  private final SqlDialect dialect;
  private final DatasourceSettings datasource;
  private final SqlTemplateCompiler templates;
  private final Clock clock;
  private final CompilerOptions options;

  private final IdentityResolutionPlanner identities;
  private final ExperimentUnitsCteBuilder units;
  private final MetricExpressions expr;
  private final MetricCteBuilder metricCtes;
  private final SegmentCteBuilder segments;
  private final StatisticsCteBuilder statistics;
  private final SqlPrettyPrinter printer;

  public ExperimentQueryCompiler(SqlDialect dialect, DatasourceSettings datasource) {
    this(dialect, datasource, new SqlTemplateCompiler(), Clock.systemUTC(), CompilerOptions.DEFAULTS);
  }

  public ExperimentQueryCompiler(SqlDialect dialect, DatasourceSettings datasource, SqlTemplateCompiler templates,
                                 Clock clock, CompilerOptions options) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.datasource = datasource == null ? DatasourceSettings.EMPTY : datasource;
    this.templates = Objects.requireNonNull(templates, "templates");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.options = options == null ? CompilerOptions.DEFAULTS : options;

    this.identities = new IdentityResolutionPlanner(dialect, this.datasource, templates);
    this.units = new ExperimentUnitsCteBuilder(dialect, this.datasource, templates, clock);
    this.expr = new MetricExpressions(dialect);
    this.metricCtes = new MetricCteBuilder(expr, templates);
    this.segments = new SegmentCteBuilder(dialect, templates);
    this.statistics = new StatisticsCteBuilder(dialect);
    this.printer = new SqlPrettyPrinter(this.options.maxFormatLength());
  }

  public SqlDialect dialect() { return dialect; }

  // units

  /** Units of an experiment phase, one row per unit, as a standalone query over {@code __experimentUnits}. */
  public String experimentUnitsQuery(ExperimentUnitsRequest req) {
    IdentityPlan ids = planUnits(req, List.of());
    String sql = "-- Experiment units (" + req.settings().experimentId() + ")\nWITH\n"
        + ids.idJoinSql()
        + experimentUnitsCtes(req, ids) + "\n"
        + "SELECT * FROM __experimentUnits";
    return finish("experimentUnitsQuery", req.settings().experimentId(), ids, sql);
  }

  /** Identity-join-free CTE chain ending in {@code __experimentUnits}; {@code ids} must cover every participant. */
  public String experimentUnitsCtes(ExperimentUnitsRequest req, IdentityPlan ids) {
    return units.build(req, ids);
  }

  // legacy metric

  public String experimentMetricQuery(ExperimentMetricRequest req) {
    ExperimentUnitsRequest u = req.units();
    AnalysisSettings settings = u.settings();
    MetricSpec metric = req.metric().validate();
    List<MetricSpec> denominators = req.denominatorMetrics();
    denominators.forEach(MetricSpec::validate);
    MetricSpec denominator = req.denominator();
    boolean funnel = req.isFunnel();
    boolean ratio = req.isRatio();
    MetricSpec activation = u.activationMetric();

    boolean regressionAdjusted = settings.regressionAdjustmentEnabled()
        && metric.regressionAdjustmentEnabled()
        && metric.regressionAdjustmentDays() > 0
        && metric.quantileType() == QuantileType.NONE
        && !ratio;
    double raHours = regressionAdjusted ? metric.regressionAdjustmentDays() * 24 : 0;
    boolean override = settings.overrideConversionWindows();

    List<MetricSpec> ordered = new ArrayList<>();
    if (activation != null) ordered.add(activation);
    ordered.addAll(denominators);
    ordered.add(metric);
    List<MetricSpec> converting = new ArrayList<>();
    converting.add(metric);
    converting.addAll(denominators);
    double minDelay = TimeWindows.metricMinDelay(ordered);
    TimeWindow window = TimeWindow.compute(settings, ordered, raHours,
        TimeWindows.maxHoursToConvert(funnel, converting, activation), clock);

    List<List<String>> objects = new ArrayList<>();
    objects.add(MetricCteBuilder.userIdTypes(metric, u.factTables(), false));
    for (MetricSpec d : denominators) objects.add(MetricCteBuilder.userIdTypes(d, u.factTables(), true));
    IdentityPlan ids = planUnits(u, objects);
    String base = ids.baseIdType();
    SqlTemplateVars vars = SqlTemplateVars.forAnalysis(settings, settings.startDate(), settings.endDate());
    List<DimensionColumn> dims = units.dimensionColumns(u);

    List<String> raColumns = List.of();
    if (regressionAdjusted) {
      raColumns = List.of(
          dialect.addHours("first_exposure_timestamp", minDelay) + " AS preexposure_end",
          dialect.addHours("first_exposure_timestamp", minDelay - raHours) + " AS preexposure_start");
    }

    StringBuilder sb = new StringBuilder();
    sb.append("-- ").append(metric.name()).append(" (").append(metric.type().wire()).append(")\nWITH\n");
    sb.append(ids.idJoinSql());
    sb.append(experimentUnitsCtes(u, ids)).append(",\n");
    sb.append("__distinctUsers AS (\n").append(distinctUsers(u, base, dims, window.experimentEndDate(), raColumns)).append("\n)");
    sb.append(",\n__metric AS (\n")
        .append(metricCtes.metricCte(metric, ids, window.metricStart(), window.metricEnd(), vars, u.factTables(), false))
        .append("\n)");
    for (int i = 0; i < denominators.size(); i++) {
      sb.append(",\n__denominator").append(i).append(" AS (\n")
          .append(metricCtes.metricCte(denominators.get(i), ids, window.metricStart(), window.metricEnd(), vars,
              u.factTables(), true))
          .append("\n)");
    }
    if (funnel) {
      sb.append(",\n__denominatorUsers AS (\n")
          .append(metricCtes.funnelUsersCte(base, denominators, settings.endDate(), dims, regressionAdjusted, override,
              "__denominator", "__distinctUsers"))
          .append("\n)");
    }

    sb.append(",\n__userMetricJoin AS (\nSELECT\n  d.variation AS variation\n");
    appendDims(sb, "d", dims);
    sb.append("  , d.").append(base).append(" AS ").append(base).append('\n')
        .append("  , ").append(expr.caseWhenTimeFilter("m.value", metric, override, settings.endDate(), "m.timestamp", "d.timestamp"))
        .append(" as value\n")
        .append("FROM\n  ").append(funnel ? "__denominatorUsers" : "__distinctUsers").append(" d\n")
        .append("  LEFT JOIN __metric m ON (m.").append(base).append(" = d.").append(base).append(")\n)");

    sb.append(",\n__userMetric AS (\n-- Add in the aggregate metric value for each user\nSELECT\n  umj.variation AS variation\n");
    appendDims(sb, "umj", dims);
    sb.append("  , umj.").append(base).append('\n')
        .append("  , ").append(expr.legacyAggregation(metric)).append(" as value\n")
        .append("FROM\n  __userMetricJoin umj\n");
    appendGroupBy(sb, "umj", dims, base);
    sb.append(')');

    boolean capped = metric.isPercentileCapped();
    if (capped) {
      sb.append(",\n__capValue AS (\n").append(legacyCap(metric, "__userMetric")).append("\n)");
    }
    boolean denominatorCapped = ratio && denominator.isPercentileCapped();
    if (ratio) {
      sb.append(",\n__userDenominatorAgg AS (\nSELECT\n  d.variation AS variation\n");
      appendDims(sb, "d", dims);
      sb.append("  , d.").append(base).append(" AS ").append(base).append('\n')
          .append("  , ").append(expr.legacyAggregation(denominator)).append(" as value\n")
          .append("FROM\n  __distinctUsers d\n")
          .append("  JOIN __denominator").append(denominators.size() - 1).append(" m ON (m.").append(base)
          .append(" = d.").append(base).append(")\n")
          .append("WHERE\n  ").append(expr.conversionWindowClause("d.timestamp", "m.timestamp", denominator,
              settings.endDate(), override)).append('\n');
      appendGroupBy(sb, "d", dims, base);
      sb.append(')');
      if (denominatorCapped) {
        sb.append(",\n__capValueDenominator AS (\n").append(legacyCap(denominator, "__userDenominatorAgg")).append("\n)");
      }
    }
    if (regressionAdjusted) {
      sb.append(",\n__userCovariateMetric AS (\nSELECT\n  d.variation AS variation\n");
      appendDims(sb, "d", dims);
      sb.append("  , d.").append(base).append(" AS ").append(base).append('\n')
          .append("  , ").append(expr.legacyAggregation(metric)).append(" as value\n")
          .append("FROM\n  __distinctUsers d\n")
          .append("  JOIN __metric m ON (m.").append(base).append(" = d.").append(base).append(")\n")
          .append("WHERE\n  m.timestamp >= d.preexposure_start\n  AND m.timestamp < d.preexposure_end\n");
      appendGroupBy(sb, "d", dims, base);
      sb.append(')');
    }

    String main = expr.capCoalesce("m.value", metric, "cap", "value_cap");
    sb.append(",\n__stats AS (\n-- One row per variation/dimension with aggregations\nSELECT\n  m.variation AS variation\n");
    appendDims(sb, "m", dims);
    sb.append("  , COUNT(*) AS users\n");
    if (capped) sb.append("  , MAX(COALESCE(cap.value_cap, 0)) as main_cap_value\n");
    sb.append("  , SUM(").append(main).append(") AS main_sum\n")
        .append("  , SUM(POWER(").append(main).append(", 2)) AS main_sum_squares\n");
    if (ratio) {
      String den = expr.capCoalesce("d.value", denominator, "capd", "value_cap");
      if (denominatorCapped) sb.append("  , MAX(COALESCE(capd.value_cap, 0)) as denominator_cap_value\n");
      sb.append("  , SUM(").append(den).append(") AS denominator_sum\n")
          .append("  , SUM(POWER(").append(den).append(", 2)) AS denominator_sum_squares\n")
          .append("  , SUM(").append(den).append(" * ").append(main).append(") AS main_denominator_sum_product\n");
    }
    if (regressionAdjusted) {
      String cov = expr.capCoalesce("c.value", metric, "cap", "value_cap");
      sb.append("  , SUM(").append(cov).append(") AS covariate_sum\n")
          .append("  , SUM(POWER(").append(cov).append(", 2)) AS covariate_sum_squares\n")
          .append("  , SUM(").append(main).append(" * ").append(cov).append(") AS main_covariate_sum_product\n");
    }
    sb.append("FROM\n  __userMetric m\n");
    if (ratio) {
      sb.append("  LEFT JOIN __userDenominatorAgg d ON (d.").append(base).append(" = m.").append(base).append(")\n");
      if (denominatorCapped) sb.append("  CROSS JOIN __capValueDenominator capd\n");
    }
    if (regressionAdjusted) {
      sb.append("  LEFT JOIN __userCovariateMetric c ON (c.").append(base).append(" = m.").append(base).append(")\n");
    }
    if (capped) sb.append("  CROSS JOIN __capValue cap\n");
    if (metric.ignoreNulls()) sb.append("WHERE m.value != 0\n");
    sb.append("GROUP BY\n  m.variation");
    for (DimensionColumn c : dims) sb.append(", m.").append(c.alias());
    sb.append("\n)");

    appendOverallUsersAndFinalSelect(sb, dims);
    return finish("experimentMetricQuery", metric.id(), ids, sb.toString());
  }

  // fact metrics

  public String experimentFactMetricsQuery(FactMetricsRequest req) {
    ExperimentUnitsRequest u = req.units();
    AnalysisSettings settings = u.settings();
    if (req.metrics().isEmpty()) throw new InvalidMetricException("No fact metrics requested");
    List<IndexedMetric> indexed = new ArrayList<>();
    for (int i = 0; i < req.metrics().size(); i++) {
      MetricSpec m = req.metrics().get(i).validate();
      if (!m.isFact()) throw new InvalidMetricException("Metric " + m.id() + " is not a fact metric");
      indexed.add(new IndexedMetric(m, i));
    }
    List<FactTableUse> tables = FactTableUse.forMetrics(indexed, u.factTables());
    MetricSpec activation = u.activationMetric();

    List<FactMetricPlan> plans = new ArrayList<>();
    for (IndexedMetric im : indexed) plans.add(FactMetricPlan.of(im, settings, activation, tables, expr));

    if (u.dimensions().size() > 1 && plans.stream().anyMatch(p -> p.data().quantileMetric() != QuantileType.NONE)) {
      throw new InvalidMetricException("Quantile metrics are not supported with more than one dimension");
    }
    if (!dialect.hasQuantileTesting() && plans.stream().anyMatch(p -> p.data().quantileMetric() != QuantileType.NONE)) {
      throw UnsupportedCapabilityException.of(dialect.id(), "Quantile metrics");
    }

    Instant metricStart = settings.startDate();
    Instant metricEnd = settings.endDate();
    double maxHours = 0;
    for (FactMetricPlan p : plans) {
      if (p.metricStart().isBefore(metricStart)) metricStart = p.metricStart();
      if (p.metricEnd() != null && p.metricEnd().isAfter(metricEnd)) metricEnd = p.metricEnd();
      maxHours = Math.max(maxHours, p.maxHoursToConvert());
    }
    Instant endDate = TimeWindows.experimentEndDate(settings.endDate(), settings.skipPartialData(), maxHours, clock);

    IdentityPlan ids = planUnits(u, List.of(tables.get(0).factTable().userIdTypes()));
    String base = ids.baseIdType();
    SqlTemplateVars vars = SqlTemplateVars.forAnalysis(settings, settings.startDate(), settings.endDate());
    List<DimensionColumn> dims = units.dimensionColumns(u);

    List<FactMetricPlan> raPlans = plans.stream().filter(p -> p.data().regressionAdjusted()).toList();
    List<String> raColumns = new ArrayList<>();
    if (!raPlans.isEmpty()) {
      double minStart = raPlans.stream().mapToDouble(p -> p.minDelay() - p.regressionAdjustmentHours()).min().orElse(0);
      double maxEnd = raPlans.stream().mapToDouble(FactMetricPlan::minDelay).max().orElse(0);
      raColumns.add(dialect.addHours("first_exposure_timestamp", minStart) + " as min_preexposure_start");
      raColumns.add(dialect.addHours("first_exposure_timestamp", maxEnd) + " as max_preexposure_end");
      for (FactMetricPlan p : raPlans) {
        raColumns.add(dialect.addHours("first_exposure_timestamp", p.minDelay()) + " AS " + p.alias() + "_preexposure_end");
        raColumns.add(dialect.addHours("first_exposure_timestamp", p.minDelay() - p.regressionAdjustmentHours())
            + " AS " + p.alias() + "_preexposure_start");
      }
    }

    List<PercentileCapSpec> caps = new ArrayList<>();
    Set<Integer> percentileTables = new LinkedHashSet<>();
    Set<Integer> raTables = new LinkedHashSet<>();
    for (FactMetricPlan p : plans) {
      FactMetricData d = p.data();
      if (d.percentileCapped()) {
        var cap = p.metric().cappingSettings();
        caps.add(new PercentileCapSpec(p.alias() + "_value", p.alias() + "_value_cap", cap.value(), cap.ignoreZeros(),
            d.numeratorSourceIndex()));
        percentileTables.add(d.numeratorSourceIndex());
        if (d.ratioMetric()) {
          caps.add(new PercentileCapSpec(p.alias() + "_denominator", p.alias() + "_denominator_cap", cap.value(),
              cap.ignoreZeros(), d.denominatorSourceIndex()));
          percentileTables.add(d.denominatorSourceIndex());
        }
      }
      if (d.regressionAdjusted()) {
        raTables.add(d.numeratorSourceIndex());
        if (d.ratioMetric()) raTables.add(d.denominatorSourceIndex());
      }
    }
    List<FactMetricPlan> eventQuantiles = plans.stream()
        .filter(p -> p.data().quantileMetric() == QuantileType.EVENT).toList();
    Set<Integer> eventQuantileTables = eventQuantiles.stream()
        .map(p -> p.data().numeratorSourceIndex()).collect(Collectors.toCollection(LinkedHashSet::new));
    if (eventQuantileTables.size() > 1) {
      throw new InvalidMetricException("Event quantile metrics must all come from the same fact table");
    }
    String eventQuantileTable = tables.stream()
        .filter(t -> eventQuantileTables.contains(t.index()))
        .map(t -> "__eventQuantileMetric" + t.suffix())
        .findFirst().orElse("__eventQuantileMetric");

    String queryName = (tables.size() == 1 ? "Fact Table: " : "Cross-Fact Table Metrics: ")
        + tables.stream().map(t -> t.factTable().name()).collect(Collectors.joining(" & "));

    StringBuilder sb = new StringBuilder();
    sb.append("-- ").append(queryName).append("\nWITH\n");
    sb.append(ids.idJoinSql());
    sb.append(experimentUnitsCtes(u, ids)).append(",\n");
    sb.append("__distinctUsers AS (\n").append(distinctUsers(u, base, dims, endDate, raColumns)).append("\n)");

    for (FactTableUse t : tables) {
      String s = t.suffix();
      int idx = t.index();
      sb.append(",\n__factTable").append(s).append(" AS (\n")
          .append(metricCtes.factTableCte(t.factTable(), t.metrics(), ids, metricStart, metricEnd, vars))
          .append("\n)");

      sb.append(",\n__userMetricJoin").append(s).append(" AS (\nSELECT\n")
          .append("  d.variation AS variation\n  , d.timestamp AS timestamp\n");
      appendDims(sb, "d", dims);
      sb.append("  , d.").append(base).append(" AS ").append(base).append('\n');
      for (FactMetricPlan p : plans) {
        FactMetricData d = p.data();
        if (d.numeratorSourceIndex() == idx) {
          sb.append("  , ").append(expr.caseWhenTimeFilter("m." + p.alias() + "_value", p.metric(),
              settings.overrideConversionWindows(), settings.endDate(), "m.timestamp", "d.timestamp"))
              .append(" as ").append(p.alias()).append("_value\n");
        }
        if (d.ratioMetric() && d.denominatorSourceIndex() == idx) {
          sb.append("  , ").append(expr.caseWhenTimeFilter("m." + p.alias() + "_denominator",
              p.metric().toBuilder().quantileSettings(null).build(),
              settings.overrideConversionWindows(), settings.endDate(), "m.timestamp", "d.timestamp"))
              .append(" as ").append(p.alias()).append("_denominator\n");
        }
      }
      sb.append("FROM\n  __distinctUsers d\n")
          .append("  LEFT JOIN __factTable").append(s).append(" m ON (m.").append(base).append(" = d.").append(base)
          .append(")\n)");

      List<FactMetricPlan> tableEventQuantiles = eventQuantiles.stream()
          .filter(p -> p.data().numeratorSourceIndex() == idx).toList();
      if (!tableEventQuantiles.isEmpty()) {
        sb.append(",\n__eventQuantileMetric").append(s).append(" AS (\nSELECT\n  m.variation AS variation\n");
        appendDims(sb, "m", dims);
        for (FactMetricPlan p : tableEventQuantiles) {
          sb.append(dialect.quantileGridColumns(p.data().quantileSettings(), p.alias() + "_")).append('\n');
        }
        sb.append("FROM\n  __userMetricJoin").append(s).append(" m\nGROUP BY\n  m.variation");
        for (DimensionColumn c : dims) sb.append(", m.").append(c.alias());
        sb.append("\n)");
      }

      sb.append(",\n__userMetric").append(s)
          .append(" AS (\n-- Add in the aggregate metric value for each user\nSELECT\n  umj.variation AS variation\n");
      appendDims(sb, "umj", dims);
      sb.append("  , umj.").append(base).append('\n');
      for (FactMetricPlan p : plans) {
        FactMetricData d = p.data();
        String qcol = "qm." + p.alias() + "_quantile";
        if (d.numeratorSourceIndex() == idx) {
          sb.append("  , ").append(p.numeratorAgg().apply("umj." + p.alias() + "_value", qcol))
              .append(" AS ").append(p.alias()).append("_value\n");
        }
        if (d.ratioMetric() && d.denominatorSourceIndex() == idx) {
          sb.append("  , ").append(p.denominatorAgg().apply("umj." + p.alias() + "_denominator", qcol))
              .append(" AS ").append(p.alias()).append("_denominator\n");
        }
      }
      for (FactMetricPlan p : tableEventQuantiles) {
        sb.append("  , COUNT(umj.").append(p.alias()).append("_value) AS ").append(p.alias()).append("_n_events\n");
      }
      sb.append("FROM\n  __userMetricJoin").append(s).append(" umj\n");
      if (!tableEventQuantiles.isEmpty()) {
        sb.append("  LEFT JOIN __eventQuantileMetric").append(s).append(" qm ON (qm.variation = umj.variation");
        for (DimensionColumn c : dims) sb.append(" AND qm.").append(c.alias()).append(" = umj.").append(c.alias());
        sb.append(")\n");
      }
      appendGroupBy(sb, "umj", dims, base);
      sb.append(')');

      if (percentileTables.contains(idx)) {
        List<PercentileCapSpec> tableCaps = caps.stream().filter(c -> c.sourceIndex() == idx).toList();
        sb.append(",\n__capValue").append(s).append(" AS (\n")
            .append(dialect.percentileCapSelectClause(tableCaps, "__userMetric" + s, ""))
            .append("\n)");
      }
      if (raTables.contains(idx)) {
        sb.append(",\n__userCovariateMetric").append(s).append(" AS (\n")
            .append(covariateCte(raPlans, dims, base, idx, s))
            .append("\n)");
      }
    }

    StatisticsRequest statsReq = new StatisticsRequest(dims,
        plans.stream().map(FactMetricPlan::data).toList(),
        !eventQuantiles.isEmpty(),
        base,
        "__userMetric",
        eventQuantileTable,
        "__userCovariateMetric",
        "__capValue",
        tables.stream().map(FactTableUse::index).toList(),
        raTables,
        percentileTables);
    sb.append(",\n__stats AS (\n-- One row per variation/dimension with aggregations\n")
        .append(statistics.build(statsReq)).append("\n)");

    appendOverallUsersAndFinalSelect(sb, dims);
    return finish("experimentFactMetricsQuery",
        plans.stream().map(p -> p.metric().id()).collect(Collectors.joining(",")), ids, sb.toString());
  }

  // metric value

  public String metricValueQuery(MetricValueRequest req) {
    MetricSpec metric = req.metric().validate();
    List<List<String>> objects = new ArrayList<>();
    objects.add(metric.userIdTypes());
    if (req.segment() != null) objects.add(List.of(req.segment().userIdType()));
    IdentityPlan ids = identities.plan(objects, req.from(), req.to(), null, null);
    String base = ids.baseIdType();

    Instant start = TimeWindows.metricStart(req.from(), TimeWindows.metricMinDelay(List.of(metric)), 0);
    Instant end = TimeWindows.metricEnd(List.of(metric), req.to());
    SqlTemplateVars vars = SqlTemplateVars.of(req.from(), req.to());
    String aggregate = expr.legacyAggregation(metric);
    String segmentJoin = req.segment() == null ? ""
        : "  JOIN __segment s ON (s." + base + " = m." + base + ")\nWHERE s.date <= m.timestamp\n";

    StringBuilder sb = new StringBuilder();
    sb.append("-- ").append(req.name()).append(" - ").append(metric.name()).append(" Metric\nWITH\n");
    sb.append(ids.idJoinSql());
    if (req.segment() != null) {
      sb.append("__segment AS (\n").append(segments.segmentCte(req.segment(), ids, Map.of(), vars)).append("\n),\n");
    }
    sb.append("__metric AS (\n").append(metricCtes.metricCte(metric, ids, start, end, vars, Map.of(), false)).append("\n)");
    sb.append(",\n__userMetric AS (\n-- Add in the aggregate metric value for each user\nSELECT\n  ")
        .append(aggregate).append(" as value\nFROM\n  __metric m\n").append(segmentJoin)
        .append("GROUP BY\n  m.").append(base).append("\n)");
    sb.append(",\n__overall AS (\nSELECT\n  COUNT(*) as count,\n  COALESCE(SUM(value), 0) as main_sum,\n")
        .append("  COALESCE(SUM(POWER(value, 2)), 0) as main_sum_squares\nFROM\n  __userMetric\n)");
    if (req.includeByDate()) {
      String day = dialect.dateTrunc("m.timestamp");
      sb.append(",\n__userMetricDates AS (\nSELECT\n  ").append(day).append(" as date,\n  ")
          .append(aggregate).append(" as value\nFROM\n  __metric m\n").append(segmentJoin)
          .append("GROUP BY\n  ").append(day).append(",\n  m.").append(base).append("\n)");
      sb.append(",\n__byDateOverall AS (\nSELECT\n  date,\n  COUNT(*) as count,\n  COALESCE(SUM(value), 0) as main_sum,\n")
          .append("  COALESCE(SUM(POWER(value, 2)), 0) as main_sum_squares\nFROM\n  __userMetricDates d\nGROUP BY\n  date\n)");
      sb.append(",\n__union AS (\nSELECT\n  null as date,\n  o.*\nFROM\n  __overall o\nUNION ALL\nSELECT\n  d.*\nFROM\n  __byDateOverall d\n)\n");
      sb.append("SELECT\n  *\nFROM\n  __union\nORDER BY\n  date ASC");
    } else {
      sb.append("\nSELECT\n  o.*\nFROM\n  __overall o");
    }
    return finish("metricValueQuery", metric.id(), ids, sb.toString());
  }

  // shared pieces

  private IdentityPlan planUnits(ExperimentUnitsRequest u, List<List<String>> metricObjects) {
    AnalysisSettings settings = u.settings();
    String userIdType = units.exposureQuery(settings).userIdType();
    List<List<String>> objects = new ArrayList<>();
    objects.add(List.of(userIdType));
    objects.addAll(metricObjects);
    objects.addAll(units.idTypeObjects(u));
    return identities.plan(objects, settings.startDate(), settings.endDate(), userIdType, settings.experimentId());
  }

  private String distinctUsers(ExperimentUnitsRequest u, String base, List<DimensionColumn> dims, Instant endDate,
                               List<String> extraColumns) {
    String tsCol = u.activatedUnitsOnly() ? "first_activation_timestamp" : "first_exposure_timestamp";
    List<String> where = new ArrayList<>();
    if (u.activatedUnitsOnly()) where.add("first_activation_timestamp IS NOT NULL");
    if (u.settings().skipPartialData()) where.add(tsCol + " <= " + dialect.toTimestamp(endDate));

    StringBuilder sb = new StringBuilder("SELECT\n  ").append(base).append('\n');
    for (DimensionColumn c : dims) sb.append("  , ").append(c.value()).append(" AS ").append(c.alias()).append('\n');
    sb.append("  , variation\n")
        .append("  , ").append(tsCol).append(" AS timestamp\n")
        .append("  , ").append(dialect.dateTrunc("first_exposure_timestamp")).append(" AS first_exposure_date\n");
    for (String c : extraColumns) sb.append("  , ").append(c).append('\n');
    sb.append("FROM __experimentUnits");
    if (!where.isEmpty()) sb.append("\nWHERE ").append(String.join(" AND ", where));
    return sb.toString();
  }

  private String legacyCap(MetricSpec metric, String table) {
    var cap = metric.cappingSettings();
    return dialect.percentileCapSelectClause(
        List.of(new PercentileCapSpec("value", "value_cap", cap.value(), cap.ignoreZeros(), 0)),
        table,
        "WHERE value IS NOT NULL" + (cap.ignoreZeros() ? " AND value != 0" : ""));
  }

  private String covariateCte(List<FactMetricPlan> raPlans, List<DimensionColumn> dims, String base, int idx, String s) {
    StringBuilder sb = new StringBuilder("SELECT\n  d.variation AS variation\n");
    appendDims(sb, "d", dims);
    sb.append("  , d.").append(base).append(" AS ").append(base).append('\n');
    for (FactMetricPlan p : raPlans) {
      FactMetricData d = p.data();
      String inWindow = "m.timestamp >= d." + p.alias() + "_preexposure_start AND m.timestamp < d." + p.alias() + "_preexposure_end";
      if (d.numeratorSourceIndex() == idx) {
        sb.append("  , ").append(p.numeratorAgg().apply(dialect.ifElse(inWindow, "m." + p.alias() + "_value", "NULL")))
            .append(" as ").append(p.alias()).append("_value\n");
      }
      if (d.ratioMetric() && d.denominatorSourceIndex() == idx) {
        sb.append("  , ").append(p.denominatorAgg().apply(dialect.ifElse(inWindow, "m." + p.alias() + "_denominator", "NULL")))
            .append(" AS ").append(p.alias()).append("_denominator\n");
      }
    }
    sb.append("FROM\n  __distinctUsers d\n")
        .append("  JOIN __factTable").append(s).append(" m ON (m.").append(base).append(" = d.").append(base).append(")\n")
        .append("WHERE\n  m.timestamp >= d.min_preexposure_start\n  AND m.timestamp < d.max_preexposure_end\n");
    appendGroupBy(sb, "d", dims, base);
    return sb.toString();
  }

  private static void appendDims(StringBuilder sb, String alias, List<DimensionColumn> dims) {
    for (DimensionColumn c : dims) {
      sb.append("  , ").append(alias).append('.').append(c.alias()).append(" AS ").append(c.alias()).append('\n');
    }
  }

  private static void appendGroupBy(StringBuilder sb, String alias, List<DimensionColumn> dims, String base) {
    sb.append("GROUP BY\n  ").append(alias).append(".variation");
    for (DimensionColumn c : dims) sb.append(", ").append(alias).append('.').append(c.alias());
    sb.append(", ").append(alias).append('.').append(base).append('\n');
  }

  private static void appendOverallUsersAndFinalSelect(StringBuilder sb, List<DimensionColumn> dims) {
    sb.append(",\n__overallUsers AS (\nSELECT\n  variation\n");
    for (DimensionColumn c : dims) sb.append("  , ").append(c.alias()).append('\n');
    sb.append("  , COUNT(*) AS users\nFROM\n  __distinctUsers\nGROUP BY\n  variation");
    for (DimensionColumn c : dims) sb.append(", ").append(c.alias());
    sb.append("\n)\n");
    sb.append("SELECT\n  s.*\n  , u.users AS exposed_users\nFROM\n  __stats s\n")
        .append("  LEFT JOIN __overallUsers u ON (u.variation = s.variation");
    for (DimensionColumn c : dims) sb.append(" AND u.").append(c.alias()).append(" = s.").append(c.alias());
    sb.append(')');
  }

  private String finish(String op, String key, IdentityPlan ids, String sql) {
    String out = options.formatSql() ? printer.format(sql, dialect.formatDialect()) : sql;
    if (log.isDebugEnabled()) {
      log.debug("nativa.experiments op={} dialect={} key={} baseIdType={} identityJoins={} sqlLength={}",
          op, dialect.id(), key, ids.baseIdType(), ids.idJoinMap().size(), out.length());
    }
    return out;
  }
}
