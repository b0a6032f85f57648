package io.intellixity.nativa.experiments.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared event source for fact metrics; {@code filters} maps filter id to a SQL condition.
 * {@code eventName} is exposed to the table's SQL as {@code {{templateVariables.eventName}}}.
 */
public record FactTableSpec(String id,
                            String name,
                            String sql,
                            List<String> userIdTypes,
                            Map<String, String> filters,
                            String eventName) {
  @JsonCreator
  public FactTableSpec {
    Objects.requireNonNull(id, "id");
    name = name == null ? id : name;
    userIdTypes = userIdTypes == null ? List.of() : List.copyOf(userIdTypes);
    filters = filters == null ? Map.of() : Map.copyOf(filters);
  }

  public FactTableSpec(String id, String name, String sql, List<String> userIdTypes, Map<String, String> filters) {
    this(id, name, sql, userIdTypes, filters, null);
  }

  public Map<String, String> templateVariables() {
    return eventName == null || eventName.isBlank() ? Map.of() : Map.of("eventName", eventName);
  }
}
