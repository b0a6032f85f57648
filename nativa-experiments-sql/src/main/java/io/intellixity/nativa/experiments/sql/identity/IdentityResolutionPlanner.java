package io.intellixity.nativa.experiments.sql.identity;

import io.intellixity.nativa.experiments.model.DatasourceSettings;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.template.SqlTemplateCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Picks the id type a query is keyed on and plans the identity-join CTEs that map every
 * other participating id type onto it.
 *
 * Each input object is the list of id types one participant (exposure table, metric,
 * segment, dimension) can supply natively.
 */
public final class IdentityResolutionPlanner {
  private static final Logger log = LoggerFactory.getLogger(IdentityResolutionPlanner.class);

  public static final String CTE_PREFIX = "__identities_";

  private final SqlDialect dialect;
  private final DatasourceSettings settings;
  private final SqlTemplateCompiler templates;

  public IdentityResolutionPlanner(SqlDialect dialect, DatasourceSettings settings, SqlTemplateCompiler templates) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.settings = settings == null ? DatasourceSettings.EMPTY : settings;
    this.templates = Objects.requireNonNull(templates, "templates");
  }

  /** Base id type plus the id types that need a join back to it, in join order. */
  public record Resolution(String baseIdType, List<String> joinsRequired) {
    public Resolution {
      joinsRequired = List.copyOf(joinsRequired);
    }
  }

  /**
   * Without a forced base, the id type supported by the most objects wins; ties go to
   * the type seen first. Objects are then visited shortest first, and each object that
   * supplies neither the base nor an already joined type adds its most supported type.
   */
  public static Resolution baseIdTypeAndJoins(List<List<String>> objects, String forcedBaseIdType) {
    List<List<String>> cleaned = new ArrayList<>();
    for (List<String> o : objects) {
      if (o == null) continue;
      List<String> ids = o.stream().filter(id -> id != null && !id.isEmpty()).toList();
      if (!ids.isEmpty()) cleaned.add(ids);
    }

    Map<String, Integer> counts = new LinkedHashMap<>();
    for (List<String> ids : cleaned) {
      for (String id : ids) counts.merge(id, 1, Integer::sum);
    }
    List<String> idTypes = new ArrayList<>(counts.keySet());
    idTypes.sort(Comparator.comparing((String id) -> counts.get(id)).reversed());

    String base = forcedBaseIdType != null && !forcedBaseIdType.isEmpty()
        ? forcedBaseIdType
        : (idTypes.isEmpty() ? "" : idTypes.get(0));

    List<List<String>> byLength = new ArrayList<>(cleaned);
    byLength.sort(Comparator.comparingInt(List::size));

    List<String> joinsRequired = new ArrayList<>();
    for (List<String> ids : byLength) {
      if (ids.contains(base)) continue;
      if (ids.stream().anyMatch(joinsRequired::contains)) continue;
      for (String id : idTypes) {
        if (ids.contains(id)) {
          joinsRequired.add(id);
          break;
        }
      }
    }
    return new Resolution(base, joinsRequired);
  }

  public IdentityPlan plan(List<List<String>> objects, Instant from, Instant to, String forcedBaseIdType, String experimentId) {
    Resolution r = baseIdTypeAndJoins(objects, forcedBaseIdType);
    Map<String, String> joinMap = new LinkedHashMap<>();
    StringBuilder sql = new StringBuilder();
    for (String idType : r.joinsRequired()) {
      String table = cteName(idType);
      joinMap.put(idType, table);
      sql.append(table).append(" as (\n")
          .append(dialect.identitiesQuery(settings, r.baseIdType(), idType, from, to, experimentId, templates))
          .append("\n),\n");
    }
    if (log.isDebugEnabled()) {
      log.debug("nativa.experiments op=identityPlan baseIdType={} joins={}", r.baseIdType(), r.joinsRequired());
    }
    return new IdentityPlan(r.baseIdType(), sql.toString(), joinMap);
  }

  public static String cteName(String idType) {
    return CTE_PREFIX + idType.replaceAll("[^a-zA-Z0-9_]", "");
  }
}
