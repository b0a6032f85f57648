package io.intellixity.nativa.experiments.model;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one experiment phase as analysed by a single query build.
 * {@code experimentId} is the tracking key matched against the exposure query.
 */
public record AnalysisSettings(String experimentId,
                               int phaseIndex,
                               Instant startDate,
                               Instant endDate,
                               boolean skipPartialData,
                               boolean regressionAdjustmentEnabled,
                               boolean overrideConversionWindows,
                               String exposureQueryId,
                               UserIdType userIdType,
                               String queryFilter,
                               boolean removeMultipleExposures,
                               Map<String, Object> customFields) {
  public AnalysisSettings {
    Objects.requireNonNull(experimentId, "experimentId");
    Objects.requireNonNull(startDate, "startDate");
    Objects.requireNonNull(endDate, "endDate");
    userIdType = userIdType == null ? UserIdType.ANONYMOUS : userIdType;
    customFields = customFields == null ? Map.of() : Map.copyOf(customFields);
  }

  public static Builder builder(String experimentId, Instant startDate, Instant endDate) {
    return new Builder(experimentId, startDate, endDate);
  }

  /** A running phase without an end date is analysed up to {@code clock.instant()}. */
  public static Builder forPhase(ExperimentSpec experiment, int phaseIndex, Clock clock) {
    Phase phase = experiment.phase(phaseIndex);
    Instant end = phase.dateEnded() != null ? phase.dateEnded() : clock.instant();
    return new Builder(experiment.trackingKey(), phase.dateStarted(), end)
        .phaseIndex(phaseIndex)
        .skipPartialData(phase.skipPartialData())
        .exposureQueryId(experiment.exposureQueryId())
        .userIdType(experiment.userIdType())
        .queryFilter(experiment.queryFilter())
        .removeMultipleExposures(experiment.removeMultipleExposures());
  }

  public static final class Builder {
    private final String experimentId;
    private final Instant startDate;
    private final Instant endDate;
    private int phaseIndex;
    private boolean skipPartialData;
    private boolean regressionAdjustmentEnabled;
    private boolean overrideConversionWindows;
    private String exposureQueryId;
    private UserIdType userIdType;
    private String queryFilter;
    private boolean removeMultipleExposures;
    private Map<String, Object> customFields = Map.of();

    private Builder(String experimentId, Instant startDate, Instant endDate) {
      this.experimentId = experimentId;
      this.startDate = startDate;
      this.endDate = endDate;
    }

    public Builder phaseIndex(int v) { this.phaseIndex = v; return this; }
    public Builder skipPartialData(boolean v) { this.skipPartialData = v; return this; }
    public Builder regressionAdjustmentEnabled(boolean v) { this.regressionAdjustmentEnabled = v; return this; }
    public Builder overrideConversionWindows(boolean v) { this.overrideConversionWindows = v; return this; }
    public Builder exposureQueryId(String v) { this.exposureQueryId = v; return this; }
    public Builder userIdType(UserIdType v) { this.userIdType = v; return this; }
    public Builder queryFilter(String v) { this.queryFilter = v; return this; }
    public Builder removeMultipleExposures(boolean v) { this.removeMultipleExposures = v; return this; }
    public Builder customFields(Map<String, Object> v) { this.customFields = v; return this; }

    public AnalysisSettings build() {
      return new AnalysisSettings(experimentId, phaseIndex, startDate, endDate, skipPartialData,
          regressionAdjustmentEnabled, overrideConversionWindows, exposureQueryId, userIdType,
          queryFilter, removeMultipleExposures, customFields);
    }
  }
}
