package io.intellixity.nativa.experiments.sql.query;

import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.model.SegmentSpec;

import java.time.Instant;
import java.util.Objects;

/** Overall value of a legacy metric between {@code from} and {@code to}, optionally per day. */
public record MetricValueRequest(String name, MetricSpec metric, Instant from, Instant to, SegmentSpec segment,
                                 boolean includeByDate) {
  public MetricValueRequest {
    Objects.requireNonNull(metric, "metric");
    Objects.requireNonNull(from, "from");
    name = name == null ? metric.name() : name;
  }
}
