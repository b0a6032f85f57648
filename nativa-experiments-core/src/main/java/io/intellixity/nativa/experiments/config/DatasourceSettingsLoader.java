package io.intellixity.nativa.experiments.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.nativa.experiments.error.MissingConfigurationException;
import io.intellixity.nativa.experiments.model.DatasourceSettings;
import io.intellixity.nativa.experiments.model.FactTableSpec;
import io.intellixity.nativa.experiments.model.MetricSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

/**
 * Reads datasource settings, metric and fact table definitions from YAML (or JSON, which YAML accepts).
 *
 * Settings may sit at the document root or under a {@code queries:} node:
 * <pre>
 * queries:
 *   exposure:
 *     - id: user_id
 *       userIdType: user_id
 *       query: SELECT user_id, timestamp, experiment_id, variation_id FROM viewed_experiment
 *   identityJoins:
 *     - ids: [user_id, anonymous_id]
 *       query: SELECT user_id, anonymous_id FROM identifies
 * </pre>
 */
public final class DatasourceSettingsLoader {
  private static final Logger log = LoggerFactory.getLogger(DatasourceSettingsLoader.class);

  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private DatasourceSettingsLoader() {}

  public static DatasourceSettings loadSettings(String text) {
    return settings(readTree(text));
  }

  public static DatasourceSettings loadSettings(InputStream in) {
    return settings(readTree(in));
  }

  public static List<MetricSpec> loadMetrics(String text) {
    List<MetricSpec> metrics = list(readTree(text), "metrics", new TypeReference<List<MetricSpec>>() {});
    metrics.forEach(MetricSpec::validate);
    return metrics;
  }

  public static List<FactTableSpec> loadFactTables(String text) {
    return list(readTree(text), "factTables", new TypeReference<List<FactTableSpec>>() {});
  }

  private static DatasourceSettings settings(JsonNode root) {
    if (root == null || root.isMissingNode() || root.isNull()) return DatasourceSettings.EMPTY;
    JsonNode node = root.has("queries") && root.get("queries").isObject() ? root.get("queries") : root;
    try {
      DatasourceSettings s = YAML.treeToValue(node, DatasourceSettings.class);
      if (log.isDebugEnabled()) {
        log.debug("nativa.experiments op=loadSettings exposureQueries={} identityJoins={} pageviews={}",
            s.exposureQueries().size(), s.identityJoins().size(), s.pageviewsQuery() != null);
      }
      return s;
    } catch (IOException e) {
      throw new MissingConfigurationException("Invalid datasource settings: " + e.getMessage(), e);
    }
  }

  private static <T> List<T> list(JsonNode root, String wrapper, TypeReference<List<T>> type) {
    if (root == null || root.isMissingNode() || root.isNull()) return List.of();
    JsonNode node = root.isObject() && root.has(wrapper) ? root.get(wrapper) : root;
    if (!node.isArray()) {
      throw new MissingConfigurationException("Expected a list of " + wrapper + " but found " + node.getNodeType());
    }
    try {
      return List.copyOf(YAML.readerFor(type).<List<T>>readValue(node));
    } catch (IOException e) {
      throw new MissingConfigurationException("Invalid " + wrapper + " definition: " + e.getMessage(), e);
    }
  }

  private static JsonNode readTree(String text) {
    Objects.requireNonNull(text, "text");
    try {
      return YAML.readTree(text);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to parse settings document", e);
    }
  }

  private static JsonNode readTree(InputStream in) {
    Objects.requireNonNull(in, "in");
    try (in) {
      return YAML.readTree(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read settings document", e);
    }
  }
}
