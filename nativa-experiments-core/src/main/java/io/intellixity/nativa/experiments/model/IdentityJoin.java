package io.intellixity.nativa.experiments.model;

import java.util.List;

/** SQL mapping between two identifier types, e.g. {@code user_id} and {@code anonymous_id}. */
public record IdentityJoin(List<String> ids, String query) {
  public IdentityJoin {
    ids = ids == null ? List.of() : List.copyOf(ids);
  }

  public boolean joins(String id1, String id2) {
    return ids.contains(id1) && ids.contains(id2);
  }
}
