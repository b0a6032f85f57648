package io.intellixity.nativa.experiments.sql.query;

import io.intellixity.nativa.experiments.model.AnalysisSettings;
import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.model.QuantileType;
import io.intellixity.nativa.experiments.sql.metric.IndexedMetric;
import io.intellixity.nativa.experiments.sql.metric.MetricExpressions;
import io.intellixity.nativa.experiments.sql.stats.FactMetricData;
import io.intellixity.nativa.experiments.time.TimeWindows;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Everything one fact metric contributes to a fact metrics query, derived once per build. */
record FactMetricPlan(IndexedMetric indexed,
                      FactMetricData data,
                      MetricExpressions.Aggregation numeratorAgg,
                      MetricExpressions.Aggregation denominatorAgg,
                      double regressionAdjustmentHours,
                      double minDelay,
                      Instant metricStart,
                      Instant metricEnd,
                      double maxHoursToConvert) {

  MetricSpec metric() { return indexed.metric(); }

  String alias() { return indexed.alias(); }

  static FactMetricPlan of(IndexedMetric indexed, AnalysisSettings settings, MetricSpec activation,
                           List<FactTableUse> tables, MetricExpressions expr) {
    MetricSpec metric = indexed.metric();
    String a = indexed.alias();
    boolean ratio = metric.isRatio();
    boolean regressionAdjusted = settings.regressionAdjustmentEnabled()
        && metric.regressionAdjustmentEnabled()
        && metric.regressionAdjustmentDays() > 0
        && metric.quantileType() == QuantileType.NONE;
    double raHours = regressionAdjusted ? metric.regressionAdjustmentDays() * 24 : 0;

    int ni = FactTableUse.indexOf(tables, metric.numerator() == null ? null : metric.numerator().factTableId());
    int di = FactTableUse.indexOf(tables, metric.denominator() == null ? null : metric.denominator().factTableId());
    String ns = ni == 0 ? "" : String.valueOf(ni);
    String ds = di == 0 ? "" : String.valueOf(di);

    FactMetricData data = new FactMetricData(metric.id(), a, ni, ratio ? di : ni, ratio, regressionAdjusted,
        metric.quantileType(), metric.quantileSettings(), metric.isPercentileCapped(),
        expr.capCoalesce("m" + ns + "." + a + "_value", metric, "cap" + ns, a + "_value_cap"),
        expr.capCoalesce("c" + ns + "." + a + "_value", metric, "cap" + ns, a + "_value_cap"),
        expr.capCoalesce("m" + ds + "." + a + "_denominator", metric, "cap" + ds, a + "_denominator_cap"),
        expr.capCoalesce("c" + ds + "." + a + "_denominator", metric, "cap" + ds, a + "_denominator_cap"));

    List<MetricSpec> ordered = new ArrayList<>();
    if (activation != null) ordered.add(activation);
    ordered.add(metric);
    double minDelay = TimeWindows.metricMinDelay(ordered);

    return new FactMetricPlan(indexed, data,
        expr.factAggregation(metric, false),
        ratio ? expr.factAggregation(metric, true) : null,
        raHours,
        minDelay,
        TimeWindows.metricStart(settings.startDate(), minDelay, raHours),
        TimeWindows.metricEnd(ordered, settings.endDate(), settings.overrideConversionWindows()),
        TimeWindows.maxHoursToConvert(false, List.of(metric), activation));
  }
}
