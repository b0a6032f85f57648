package io.intellixity.nativa.experiments.model;

import java.util.List;
import java.util.Objects;

/**
 * Experiment assignment source. The query returns {@code <userIdType>, timestamp,
 * experiment_id, variation_id} plus one column per inline dimension.
 */
public record ExposureQuery(String id, String name, String userIdType, String query, List<String> dimensions) {
  public ExposureQuery {
    Objects.requireNonNull(id, "id");
    name = name == null ? id : name;
    userIdType = userIdType == null || userIdType.isBlank() ? "user_id" : userIdType;
    dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
  }
}
