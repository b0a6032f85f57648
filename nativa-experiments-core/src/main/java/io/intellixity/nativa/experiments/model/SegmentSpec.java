package io.intellixity.nativa.experiments.model;

import java.util.List;
import java.util.Objects;

/**
 * Restricts analysed units to those present in a segment. SQL segments expose
 * {@code <userIdType>} and {@code date}; fact segments select units from a fact table.
 */
public record SegmentSpec(String id,
                          String name,
                          SegmentType type,
                          String userIdType,
                          String sql,
                          String factTableId,
                          List<String> filters) {
  public SegmentSpec {
    Objects.requireNonNull(id, "id");
    name = name == null ? id : name;
    type = type == null ? SegmentType.SQL : type;
    userIdType = userIdType == null || userIdType.isBlank() ? "user_id" : userIdType;
    filters = filters == null ? List.of() : List.copyOf(filters);
  }

  public static SegmentSpec sql(String id, String userIdType, String sql) {
    return new SegmentSpec(id, id, SegmentType.SQL, userIdType, sql, null, List.of());
  }

  public static SegmentSpec fact(String id, String factTableId, List<String> filters) {
    return new SegmentSpec(id, id, SegmentType.FACT, null, null, factTableId, filters);
  }
}
