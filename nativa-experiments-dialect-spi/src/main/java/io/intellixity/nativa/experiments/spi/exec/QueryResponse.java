package io.intellixity.nativa.experiments.spi.exec;

import java.util.List;
import java.util.Map;

/** Result rows of one warehouse query, column names lower-cased. */
public record QueryResponse(List<Map<String, Object>> rows, QueryStatistics statistics) {
  public QueryResponse {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }

  public static QueryResponse of(List<Map<String, Object>> rows) {
    return new QueryResponse(rows, null);
  }
}
