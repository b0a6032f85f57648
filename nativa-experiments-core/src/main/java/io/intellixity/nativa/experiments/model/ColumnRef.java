package io.intellixity.nativa.experiments.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.List;

/**
 * Reference from a fact metric to a fact table column plus the ids of the
 * fact table filters that restrict which rows count.
 *
 * {@code aggregation} applies to plain columns only: {@code sum} (default), {@code max}
 * or {@code count distinct}.
 */
public record ColumnRef(String factTableId, String column, List<String> filters, String aggregation) {
  public static final String COUNT = "$$count";
  public static final String DISTINCT_USERS = "$$distinctUsers";
  public static final String DISTINCT_DATES = "$$distinctDates";

  public static final String SUM = "sum";
  public static final String MAX = "max";
  public static final String COUNT_DISTINCT = "count distinct";

  @JsonCreator
  public ColumnRef {
    filters = filters == null ? List.of() : List.copyOf(filters);
    aggregation = aggregation == null || aggregation.isBlank() ? SUM : aggregation.trim();
  }

  public ColumnRef(String factTableId, String column, List<String> filters) {
    this(factTableId, column, filters, SUM);
  }

  public static ColumnRef of(String factTableId, String column) {
    return new ColumnRef(factTableId, column, List.of(), SUM);
  }

  public ColumnRef withFilters(List<String> filterIds) {
    return new ColumnRef(factTableId, column, filterIds, aggregation);
  }

  public ColumnRef withAggregation(String agg) {
    return new ColumnRef(factTableId, column, filters, agg);
  }

  public boolean countsRows() {
    return column == null || COUNT.equals(column) || DISTINCT_USERS.equals(column) || DISTINCT_DATES.equals(column);
  }

  /** True for the {@code $$}-prefixed pseudo columns. */
  public boolean isSpecial() {
    return column != null && column.startsWith("$$");
  }
}
