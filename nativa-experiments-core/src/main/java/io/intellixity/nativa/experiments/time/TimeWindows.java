package io.intellixity.nativa.experiments.time;

import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.model.WindowSettings;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Pure date arithmetic over metric window settings.
 *
 * Metric lists are ordered: for funnels, each step's delay and window stack on the
 * previous step's, so running totals (not per-metric maxima) drive the bounds.
 */
public final class TimeWindows {
  private static final double MILLIS_PER_HOUR = 3_600_000d;

  private TimeWindows() {}

  /** Most negative value reached by the running sum of non-zero delays; 0 if never negative. */
  public static double metricMinDelay(List<MetricSpec> metrics) {
    double running = 0;
    double min = 0;
    for (MetricSpec m : metrics) {
      double delay = m.windowSettings().delayHours();
      if (delay == 0) continue;
      running += delay;
      if (running < min) min = running;
    }
    return min;
  }

  public static Instant metricStart(Instant experimentStart, double minDelay, double regressionAdjustmentHours) {
    Objects.requireNonNull(experimentStart, "experimentStart");
    Instant start = experimentStart;
    if (minDelay < 0) start = plusHours(start, minDelay);
    if (regressionAdjustmentHours > 0) start = plusHours(start, -regressionAdjustmentHours);
    return start;
  }

  /** Returns {@code null} when there is no experiment end. */
  public static Instant metricEnd(List<MetricSpec> metrics, Instant experimentEnd, boolean overrideConversionWindows) {
    if (experimentEnd == null) return null;
    if (overrideConversionWindows) return experimentEnd;

    double running = 0;
    double max = 0;
    for (MetricSpec m : metrics) {
      WindowSettings w = m.windowSettings();
      if (!w.isConversion()) continue;
      running += w.windowHours() + w.delayHours();
      if (running > max) max = running;
    }
    return max > 0 ? plusHours(experimentEnd, max) : experimentEnd;
  }

  public static Instant metricEnd(List<MetricSpec> metrics, Instant experimentEnd) {
    return metricEnd(metrics, experimentEnd, false);
  }

  /**
   * Hours a unit needs after exposure to fully convert. Funnel steps are summed,
   * independent metrics take the maximum; an activation metric always adds on top.
   */
  public static double maxHoursToConvert(boolean funnel, List<MetricSpec> metricsIncludingDenominators, MetricSpec activationMetric) {
    double needed = 0;
    for (MetricSpec m : metricsIncludingDenominators) {
      WindowSettings w = m.windowSettings();
      if (!w.isConversion()) continue;
      double hours = w.delayHours() + w.windowHours();
      if (funnel) {
        needed += hours;
      } else if (hours > needed) {
        needed = hours;
      }
    }
    if (activationMetric != null && activationMetric.windowSettings().isConversion()) {
      WindowSettings w = activationMetric.windowSettings();
      needed += w.delayHours() + w.windowHours();
    }
    return needed;
  }

  /** With {@code skipPartialData}, units that could still convert after {@code now} are excluded. */
  public static Instant experimentEndDate(Instant endDate, boolean skipPartialData, double conversionWindowHours, Clock clock) {
    Objects.requireNonNull(endDate, "endDate");
    if (!skipPartialData) return endDate;
    Instant lastFullyConverted = plusHours(clock.instant(), -conversionWindowHours);
    return lastFullyConverted.isBefore(endDate) ? lastFullyConverted : endDate;
  }

  public static Instant plusHours(Instant instant, double hours) {
    return instant.plusMillis(Math.round(hours * MILLIS_PER_HOUR));
  }
}
