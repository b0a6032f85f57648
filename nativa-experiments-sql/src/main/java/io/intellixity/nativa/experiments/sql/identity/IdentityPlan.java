package io.intellixity.nativa.experiments.sql.identity;

import java.util.Map;

/**
 * Result of identity planning.
 *
 * @param baseIdType id type every CTE is keyed on
 * @param idJoinSql  comma-terminated {@code __identities_*} CTE definitions, empty when no join is needed
 * @param idJoinMap  id type to the CTE mapping it onto {@code baseIdType}
 */
public record IdentityPlan(String baseIdType, String idJoinSql, Map<String, String> idJoinMap) {
  public IdentityPlan {
    idJoinMap = Map.copyOf(idJoinMap);
  }

  public boolean needsJoin(String idType) {
    return idJoinMap.containsKey(idType);
  }
}
