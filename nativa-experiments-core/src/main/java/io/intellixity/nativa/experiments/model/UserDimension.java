package io.intellixity.nativa.experiments.model;

import java.util.Objects;

/** Dimension computed by external SQL returning {@code <userIdType>, value}. */
public record UserDimension(String id, String name, String userIdType, String sql) implements DimensionSpec {
  public UserDimension {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sql, "sql");
    name = name == null ? id : name;
    userIdType = userIdType == null || userIdType.isBlank() ? "user_id" : userIdType;
  }

  @Override public String type() { return "user"; }

  public UserDimension withSql(String compiledSql) {
    return new UserDimension(id, name, userIdType, compiledSql);
  }
}
