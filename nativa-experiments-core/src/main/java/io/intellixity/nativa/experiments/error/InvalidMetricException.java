package io.intellixity.nativa.experiments.error;

/** Metric, segment or dimension definition has an impossible shape. */
public final class InvalidMetricException extends QueryBuildException {
  public InvalidMetricException(String message) {
    super(message);
  }

  public InvalidMetricException(String message, Throwable cause) {
    super(message, cause);
  }
}
