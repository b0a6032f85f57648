package io.intellixity.nativa.experiments.sql.metric;

import io.intellixity.nativa.experiments.error.MissingConfigurationException;
import io.intellixity.nativa.experiments.model.ColumnRef;
import io.intellixity.nativa.experiments.model.FactTableSpec;
import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.sql.identity.IdentityPlan;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.template.SqlTemplateCompiler;
import io.intellixity.nativa.experiments.template.SqlTemplateVars;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Bodies of the per-metric CTEs: {@code __metric}, {@code __denominator<i>},
 * {@code __activationMetric}, {@code __factTable<N>} and the funnel {@code __denominatorUsers}.
 * Each body is keyed on the plan's base id type and template-compiled before it is returned.
 */
public final class MetricCteBuilder {
  private final MetricExpressions expr;
  private final SqlDialect dialect;
  private final SqlTemplateCompiler templates;

  public MetricCteBuilder(MetricExpressions expr, SqlTemplateCompiler templates) {
    this.expr = Objects.requireNonNull(expr, "expr");
    this.dialect = expr.dialect();
    this.templates = Objects.requireNonNull(templates, "templates");
  }

  /** Id types a metric row carries: the fact table's for fact metrics, the metric's own otherwise. */
  public static List<String> userIdTypes(MetricSpec metric, Map<String, FactTableSpec> factTables, boolean useDenominator) {
    if (!metric.isFact()) return metric.userIdTypes();
    ColumnRef ref = useDenominator ? metric.denominator() : metric.numerator();
    FactTableSpec table = ref == null || ref.factTableId() == null ? null : factTables.get(ref.factTableId());
    return table == null ? List.of() : table.userIdTypes();
  }

  public String metricCte(MetricSpec metric, IdentityPlan ids, Instant start, Instant end, SqlTemplateVars vars,
                          Map<String, FactTableSpec> factTables, boolean useDenominator) {
    String base = ids.baseIdType();
    FactTableSpec factTable = null;
    ColumnRef ref = null;
    if (metric.isFact()) {
      ref = useDenominator ? metric.denominator() : metric.numerator();
      factTable = ref == null || ref.factTableId() == null ? null : factTables.get(ref.factTableId());
      if (factTable == null) throw new MissingConfigurationException("Could not find fact table");
    }
    boolean builder = !metric.isFact() && !metric.source().isSql();
    MetricColumns cols = expr.metricColumns(metric, factTable, useDenominator);

    String userIdCol = cols.userIds().getOrDefault(base, "user_id");
    String join = "";
    List<String> types = userIdTypes(metric, factTables, useDenominator);
    if (types.contains(base)) {
      userIdCol = builder ? userIdCol : base;
    } else {
      for (String t : types) {
        if (ids.needsJoin(t)) {
          String metricUserIdCol = builder ? cols.userIds().get(t) : "m." + t;
          join = "JOIN " + ids.idJoinMap().get(t) + " i ON (i." + t + " = " + metricUserIdCol + ")";
          userIdCol = "i." + base;
          break;
        }
      }
    }

    List<String> where = new ArrayList<>();
    String from;
    if (factTable != null) {
      where.addAll(MetricExpressions.factFilters(factTable, ref));
      from = "(\n" + factTable.sql() + "\n)";
    } else if (!builder) {
      from = "(\n" + metric.source().sql() + "\n)";
    } else {
      String schema = dialect.schema();
      String table = metric.source().table();
      from = (schema != null && !schema.isEmpty() && !table.contains(".") ? schema + "." : "") + table;
    }
    where.add(cols.timestamp() + " >= " + dialect.toTimestamp(start));
    if (end != null) where.add(cols.timestamp() + " <= " + dialect.toTimestamp(end));

    String sql = "-- Metric (" + metric.name() + ")\n"
        + "SELECT\n"
        + "  " + userIdCol + " as " + base + ",\n"
        + "  " + cols.value() + " as value,\n"
        + "  " + dialect.castUserDateCol(cols.timestamp()) + " as timestamp\n"
        + "FROM\n"
        + "  " + from + " m\n"
        + (join.isEmpty() ? "" : "  " + join + "\n")
        + "WHERE " + String.join(" AND ", where);
    return templates.compile(sql, vars.withRange(start, end)
        .withTemplateVariables(factTable == null ? Map.of() : factTable.templateVariables()));
  }

  /**
   * One row per fact table event with an {@code m<i>_value} column per numerator on this table
   * and an {@code m<i>_denominator} column per ratio denominator on it. When every column carries
   * filters, rows matching none of them are dropped in the WHERE clause.
   */
  public String factTableCte(FactTableSpec factTable, List<IndexedMetric> metrics, IdentityPlan ids,
                             Instant start, Instant end, SqlTemplateVars vars) {
    String base = ids.baseIdType();
    String userIdCol = "";
    String join = "";
    if (factTable.userIdTypes().contains(base)) {
      userIdCol = base;
    } else {
      for (String t : factTable.userIdTypes()) {
        if (ids.needsJoin(t)) {
          join = "JOIN " + ids.idJoinMap().get(t) + " i ON (i." + t + " = m." + t + ")";
          userIdCol = "i." + base;
          break;
        }
      }
    }

    List<String> where = new ArrayList<>();
    where.add("m.timestamp >= " + dialect.toTimestamp(start));
    if (end != null) where.add("m.timestamp <= " + dialect.toTimestamp(end));

    List<String> cols = new ArrayList<>();
    Set<String> filterWhere = new LinkedHashSet<>();
    int withoutFilters = 0;
    for (IndexedMetric im : metrics) {
      MetricSpec m = im.metric();
      if (m.numerator() != null && factTable.id().equals(m.numerator().factTableId())) {
        List<String> filters = MetricExpressions.factFilters(factTable, m.numerator());
        String value = expr.factColumnValue(m, m.numerator(), "m");
        cols.add("-- " + m.name() + "\n  " + filtered(value, filters) + " as " + im.alias() + "_value");
        if (filters.isEmpty()) withoutFilters++;
        else filterWhere.add("(" + String.join(" AND ", filters) + ")");
      }
      if (m.isRatio() && factTable.id().equals(m.denominator().factTableId())) {
        List<String> filters = MetricExpressions.factFilters(factTable, m.denominator());
        String value = expr.factColumnValue(m, m.denominator(), "m");
        cols.add("-- " + m.name() + " (denominator)\n  " + filtered(value, filters) + " as " + im.alias() + "_denominator");
        if (filters.isEmpty()) withoutFilters++;
        else filterWhere.add("(" + String.join(" AND ", filters) + ")");
      }
    }
    if (!filterWhere.isEmpty() && withoutFilters == 0) {
      where.add("(" + String.join(" OR ", filterWhere) + ")");
    }

    String sql = "-- Fact Table (" + factTable.name() + ")\n"
        + "SELECT\n"
        + "  " + userIdCol + " as " + base + ",\n"
        + "  " + dialect.castUserDateCol("m.timestamp") + " as timestamp,\n"
        + "  " + String.join(",\n  ", cols) + "\n"
        + "FROM(\n" + factTable.sql() + "\n) m\n"
        + (join.isEmpty() ? "" : join + "\n")
        + "WHERE " + String.join(" AND ", where);
    return templates.compile(sql, vars.withRange(start, end).withTemplateVariables(factTable.templateVariables()));
  }

  /**
   * Units that completed every funnel step in order. Step {@code i} is read from
   * {@code <tablePrefix><i>} and must fall in its conversion window relative to step {@code i - 1}.
   */
  public String funnelUsersCte(String baseIdType, List<MetricSpec> steps, Instant endDate,
                               List<DimensionColumn> dimensions, boolean regressionAdjusted,
                               boolean overrideConversionWindows, String tablePrefix, String initialTable) {
    if (steps.isEmpty()) throw new IllegalArgumentException("funnel needs at least one step");
    StringBuilder sb = new StringBuilder("-- one row per user\nSELECT\n");
    sb.append("  initial.").append(baseIdType).append(" AS ").append(baseIdType).append('\n');
    for (DimensionColumn d : dimensions) {
      sb.append("  , MIN(initial.").append(d.alias()).append(") AS ").append(d.alias()).append('\n');
    }
    sb.append("  , MIN(initial.variation) AS variation\n");
    sb.append("  , MIN(initial.first_exposure_date) AS first_exposure_date\n");
    if (regressionAdjusted) {
      sb.append("  , MIN(initial.preexposure_start) AS preexposure_start\n");
      sb.append("  , MIN(initial.preexposure_end) AS preexposure_end\n");
    }
    sb.append("  , MIN(t").append(steps.size() - 1).append(".timestamp) AS timestamp\n");
    sb.append("FROM\n  ").append(initialTable).append(" initial\n");

    List<String> where = new ArrayList<>();
    for (int i = 0; i < steps.size(); i++) {
      String prev = i == 0 ? "initial" : "t" + (i - 1);
      String alias = "t" + i;
      sb.append("  JOIN ").append(tablePrefix).append(i).append(' ').append(alias)
          .append(" ON (").append(alias).append('.').append(baseIdType)
          .append(" = ").append(prev).append('.').append(baseIdType).append(")\n");
      where.add(expr.conversionWindowClause(prev + ".timestamp", alias + ".timestamp", steps.get(i), endDate,
          overrideConversionWindows));
    }
    sb.append("WHERE\n  ").append(String.join("\n  AND ", where)).append('\n');
    sb.append("GROUP BY\n  initial.").append(baseIdType);
    return sb.toString();
  }

  private static String filtered(String value, List<String> filters) {
    if (filters.isEmpty()) return value;
    return "CASE WHEN (" + String.join(" AND ", filters) + ") THEN " + value + " ELSE NULL END";
  }
}
