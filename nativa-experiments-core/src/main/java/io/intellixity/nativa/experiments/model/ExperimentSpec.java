package io.intellixity.nativa.experiments.model;

import java.util.List;
import java.util.Objects;

public record ExperimentSpec(String id,
                             String trackingKey,
                             UserIdType userIdType,
                             String exposureQueryId,
                             boolean removeMultipleExposures,
                             String queryFilter,
                             List<Phase> phases) {
  public ExperimentSpec {
    Objects.requireNonNull(id, "id");
    trackingKey = trackingKey == null || trackingKey.isBlank() ? id : trackingKey;
    userIdType = userIdType == null ? UserIdType.ANONYMOUS : userIdType;
    phases = phases == null ? List.of() : List.copyOf(phases);
  }

  public Phase phase(int index) {
    if (index < 0 || index >= phases.size()) {
      throw new IllegalArgumentException("Experiment " + id + " has no phase " + index);
    }
    return phases.get(index);
  }
}
