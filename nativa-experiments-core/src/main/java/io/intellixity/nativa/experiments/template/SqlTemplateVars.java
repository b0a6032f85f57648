package io.intellixity.nativa.experiments.template;

import io.intellixity.nativa.experiments.model.AnalysisSettings;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Values available to user-authored SQL (exposure queries, metric SQL, segments, dimensions).
 * A {@code null} end date is resolved by {@link SqlTemplateCompiler} against its clock.
 */
public record SqlTemplateVars(Instant startDate,
                              Instant endDate,
                              String experimentId,
                              Integer phaseIndex,
                              Map<String, Object> customFields,
                              Map<String, String> templateVariables) {
  public SqlTemplateVars {
    Objects.requireNonNull(startDate, "startDate");
    customFields = customFields == null ? Map.of() : Map.copyOf(customFields);
    templateVariables = templateVariables == null ? Map.of() : Map.copyOf(templateVariables);
  }

  public static SqlTemplateVars of(Instant startDate, Instant endDate) {
    return new SqlTemplateVars(startDate, endDate, null, null, Map.of(), Map.of());
  }

  public static SqlTemplateVars forAnalysis(AnalysisSettings settings, Instant startDate, Instant endDate) {
    return new SqlTemplateVars(startDate, endDate, settings.experimentId(), settings.phaseIndex(),
        settings.customFields(), Map.of());
  }

  public SqlTemplateVars withRange(Instant start, Instant end) {
    return new SqlTemplateVars(start, end, experimentId, phaseIndex, customFields, templateVariables);
  }

  public SqlTemplateVars withExperimentId(String id) {
    return new SqlTemplateVars(startDate, endDate, id, phaseIndex, customFields, templateVariables);
  }

  /** {@code eventName} / {@code valueColumn} pairs used by templated metric definitions. */
  public SqlTemplateVars withTemplateVariables(Map<String, String> vars) {
    return new SqlTemplateVars(startDate, endDate, experimentId, phaseIndex, customFields, vars);
  }
}
