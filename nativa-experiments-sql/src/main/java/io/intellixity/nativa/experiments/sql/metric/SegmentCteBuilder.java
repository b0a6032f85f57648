package io.intellixity.nativa.experiments.sql.metric;

import io.intellixity.nativa.experiments.error.InvalidMetricException;
import io.intellixity.nativa.experiments.error.MissingConfigurationException;
import io.intellixity.nativa.experiments.model.FactTableSpec;
import io.intellixity.nativa.experiments.model.SegmentSpec;
import io.intellixity.nativa.experiments.model.SegmentType;
import io.intellixity.nativa.experiments.sql.identity.IdentityPlan;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.template.SqlTemplateCompiler;
import io.intellixity.nativa.experiments.template.SqlTemplateVars;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Body of the {@code __segment} CTE: {@code <baseIdType>, date} for every unit in the segment. */
public final class SegmentCteBuilder {
  private final SqlDialect dialect;
  private final SqlTemplateCompiler templates;

  public SegmentCteBuilder(SqlDialect dialect, SqlTemplateCompiler templates) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.templates = Objects.requireNonNull(templates, "templates");
  }

  public String segmentCte(SegmentSpec segment, IdentityPlan ids, Map<String, FactTableSpec> factTables, SqlTemplateVars vars) {
    String base = ids.baseIdType();
    String header = "-- Segment (" + segment.name() + ")\n";

    if (segment.type() == SegmentType.FACT) {
      if (segment.factTableId() == null || segment.factTableId().isBlank()) {
        throw new InvalidMetricException("Segment " + segment.name() + " is a FACT Segment, but has no factTableId set");
      }
      FactTableSpec factTable = factTables.get(segment.factTableId());
      if (factTable == null) {
        throw new MissingConfigurationException("Unknown fact table: " + segment.factTableId());
      }
      return header + "SELECT * FROM (\n" + factSegment(factTable, segment.filters(), ids, vars) + "\n) s";
    }

    if (segment.sql() == null || segment.sql().isBlank()) {
      throw new InvalidMetricException("Segment " + segment.name() + " is a SQL Segment but has no SQL value");
    }
    String sql = templates.compile(segment.sql(), vars);
    String dateCol = dialect.castUserDateCol("s.date");
    String idType = segment.userIdType();

    if (!idType.equals(base)) {
      return header
          + "SELECT\n  i." + base + ",\n  " + dateCol + " as date\n"
          + "FROM\n  (\n" + sql + "\n  ) s\n"
          + "  JOIN " + joinTable(ids, idType) + " i ON ( i." + idType + " = s." + idType + " )";
    }
    if (!dateCol.equals("s.date")) {
      return header
          + "SELECT\n  s." + idType + ",\n  " + dateCol + " as date\n"
          + "FROM\n  (\n" + sql + "\n  ) s";
    }
    return header + sql;
  }

  private String factSegment(FactTableSpec factTable, List<String> filterIds, IdentityPlan ids, SqlTemplateVars vars) {
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
    for (String id : filterIds) {
      String condition = factTable.filters().get(id);
      if (condition != null) where.add(condition);
    }
    String sql = "-- Fact Table (" + factTable.name() + ")\n"
        + "SELECT\n  " + userIdCol + " as " + base + ",\n"
        + "  " + dialect.castUserDateCol("m.timestamp") + " as date\n"
        + "FROM(\n" + factTable.sql() + "\n) m\n"
        + (join.isEmpty() ? "" : join + "\n")
        + (where.isEmpty() ? "" : "WHERE " + String.join(" AND ", where));
    return templates.compile(sql, vars.withTemplateVariables(factTable.templateVariables()));
  }

  static String joinTable(IdentityPlan ids, String idType) {
    String table = ids.idJoinMap().get(idType);
    if (table == null) {
      throw new MissingConfigurationException("No identity join planned for '" + idType + "' to '" + ids.baseIdType() + "'");
    }
    return table;
  }
}
