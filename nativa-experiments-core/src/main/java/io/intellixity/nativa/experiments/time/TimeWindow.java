package io.intellixity.nativa.experiments.time;

import io.intellixity.nativa.experiments.model.AnalysisSettings;
import io.intellixity.nativa.experiments.model.MetricSpec;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Concrete bounds of one query build: metric rows are read in
 * {@code [metricStart, metricEnd]}, units are admitted until {@code experimentEndDate}.
 */
public record TimeWindow(Instant metricStart, Instant metricEnd, Instant experimentEndDate) {
  public TimeWindow {
    Objects.requireNonNull(metricStart, "metricStart");
    Objects.requireNonNull(experimentEndDate, "experimentEndDate");
  }

  public static TimeWindow compute(AnalysisSettings settings,
                                   List<MetricSpec> orderedMetrics,
                                   double regressionAdjustmentHours,
                                   double maxHoursToConvert,
                                   Clock clock) {
    double minDelay = TimeWindows.metricMinDelay(orderedMetrics);
    return new TimeWindow(
        TimeWindows.metricStart(settings.startDate(), minDelay, regressionAdjustmentHours),
        TimeWindows.metricEnd(orderedMetrics, settings.endDate(), settings.overrideConversionWindows()),
        TimeWindows.experimentEndDate(settings.endDate(), settings.skipPartialData(), maxHoursToConvert, clock));
  }
}
