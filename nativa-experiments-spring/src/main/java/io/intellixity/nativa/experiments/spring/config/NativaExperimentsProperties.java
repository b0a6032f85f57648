package io.intellixity.nativa.experiments.spring.config;

import io.intellixity.nativa.experiments.sql.query.CompilerOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "nativa.experiments")
public class NativaExperimentsProperties {
  /** Dialect id registered in {@code META-INF/nativa.factories}, e.g. {@code bigquery}. */
  private String engine;

  /**
   * Connection parameters handed to the dialect. Use bracket keys to keep their case:
   * {@code nativa.experiments.params[projectId]=acme}.
   */
  private final Map<String, String> params = new HashMap<>();

  /** Resource location of the datasource settings YAML; absent means no exposure or identity queries. */
  private String settingsLocation;

  private boolean formatSql = true;
  private int maxFormatLength = CompilerOptions.DEFAULT_MAX_FORMAT_LENGTH;

  public String getEngine() { return engine; }
  public void setEngine(String engine) { this.engine = engine; }
  public Map<String, String> getParams() { return params; }
  public String getSettingsLocation() { return settingsLocation; }
  public void setSettingsLocation(String settingsLocation) { this.settingsLocation = settingsLocation; }
  public boolean isFormatSql() { return formatSql; }
  public void setFormatSql(boolean formatSql) { this.formatSql = formatSql; }
  public int getMaxFormatLength() { return maxFormatLength; }
  public void setMaxFormatLength(int maxFormatLength) { this.maxFormatLength = maxFormatLength; }
}
