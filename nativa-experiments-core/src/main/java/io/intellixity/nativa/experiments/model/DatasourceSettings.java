package io.intellixity.nativa.experiments.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.intellixity.nativa.experiments.error.MissingConfigurationException;

import java.util.List;

/** Query configuration of one datasource. */
public record DatasourceSettings(List<IdentityJoin> identityJoins,
                                 String pageviewsQuery,
                                 @JsonAlias("exposure") List<ExposureQuery> exposureQueries) {
  public static final DatasourceSettings EMPTY = new DatasourceSettings(List.of(), null, List.of());

  public DatasourceSettings {
    identityJoins = identityJoins == null ? List.of() : List.copyOf(identityJoins);
    exposureQueries = exposureQueries == null ? List.of() : List.copyOf(exposureQueries);
  }

  /**
   * Resolves an exposure query by id. A blank id falls back to the query named
   * after the experiment's unit type ({@code user_id} or {@code anonymous_id}).
   */
  public ExposureQuery exposureQuery(String exposureQueryId, UserIdType userIdType) {
    String id = exposureQueryId;
    if (id == null || id.isBlank()) {
      id = userIdType == UserIdType.USER ? "user_id" : "anonymous_id";
    }
    for (ExposureQuery q : exposureQueries) {
      if (q.id().equals(id)) return q;
    }
    throw new MissingConfigurationException("Unknown experiment assignment table - " + id);
  }
}
