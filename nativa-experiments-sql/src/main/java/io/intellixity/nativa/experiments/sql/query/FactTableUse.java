package io.intellixity.nativa.experiments.sql.query;

import io.intellixity.nativa.experiments.error.MissingConfigurationException;
import io.intellixity.nativa.experiments.error.UnsupportedCapabilityException;
import io.intellixity.nativa.experiments.model.FactTableSpec;
import io.intellixity.nativa.experiments.model.MetricSpec;
import io.intellixity.nativa.experiments.sql.metric.IndexedMetric;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A fact table read by a fact metrics query, its source index and the metrics reading it. */
record FactTableUse(FactTableSpec factTable, int index, List<IndexedMetric> metrics) {
  static final int MAX_FACT_TABLES = 2;

  String suffix() {
    return index == 0 ? "" : String.valueOf(index);
  }

  /**
   * Groups metrics by numerator fact table, adding a ratio's denominator table when it differs.
   * Tables are indexed in first-use order.
   */
  static List<FactTableUse> forMetrics(List<IndexedMetric> metrics, Map<String, FactTableSpec> factTables) {
    Map<String, List<IndexedMetric>> byTable = new LinkedHashMap<>();
    for (IndexedMetric im : metrics) {
      MetricSpec m = im.metric();
      String numeratorTable = m.numerator() == null ? null : m.numerator().factTableId();
      require(factTables, numeratorTable);
      byTable.computeIfAbsent(numeratorTable, k -> new ArrayList<>()).add(im);
      if (m.isRatio() && m.denominator().factTableId() != null
          && !m.denominator().factTableId().equals(numeratorTable)) {
        require(factTables, m.denominator().factTableId());
        byTable.computeIfAbsent(m.denominator().factTableId(), k -> new ArrayList<>()).add(im);
      }
    }
    if (byTable.isEmpty()) throw new MissingConfigurationException("No fact tables found");
    if (byTable.size() > MAX_FACT_TABLES) {
      throw new UnsupportedCapabilityException("Only two fact tables at a time are supported, got " + byTable.size());
    }
    List<FactTableUse> out = new ArrayList<>();
    int i = 0;
    for (Map.Entry<String, List<IndexedMetric>> e : byTable.entrySet()) {
      out.add(new FactTableUse(factTables.get(e.getKey()), i++, List.copyOf(e.getValue())));
    }
    return out;
  }

  static int indexOf(List<FactTableUse> tables, String factTableId) {
    if (factTableId == null) return 0;
    for (FactTableUse t : tables) {
      if (t.factTable().id().equals(factTableId)) return t.index();
    }
    return 0;
  }

  private static void require(Map<String, FactTableSpec> factTables, String id) {
    if (id == null || !factTables.containsKey(id)) {
      throw new MissingConfigurationException("Unknown fact table: " + id);
    }
  }
}
