package io.intellixity.nativa.experiments.sql.metric;

/** A breakdown column of {@code __distinctUsers}: the expression over {@code __experimentUnits} and its alias. */
public record DimensionColumn(String value, String alias) {
}
