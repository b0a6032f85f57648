package io.intellixity.nativa.experiments.model;

import java.time.Instant;
import java.util.Objects;

public record Phase(Instant dateStarted, Instant dateEnded, boolean skipPartialData) {
  public Phase {
    Objects.requireNonNull(dateStarted, "dateStarted");
    if (dateEnded != null && dateEnded.isBefore(dateStarted)) {
      throw new IllegalArgumentException("Phase ends before it starts: " + dateStarted + " > " + dateEnded);
    }
  }
}
