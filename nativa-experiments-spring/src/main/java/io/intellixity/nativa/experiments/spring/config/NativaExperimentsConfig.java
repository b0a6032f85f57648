package io.intellixity.nativa.experiments.spring.config;

import io.intellixity.nativa.experiments.config.DatasourceSettingsLoader;
import io.intellixity.nativa.experiments.error.MissingConfigurationException;
import io.intellixity.nativa.experiments.model.DatasourceSettings;
import io.intellixity.nativa.experiments.spi.exec.WarehouseQueryRunner;
import io.intellixity.nativa.experiments.spi.sql.ConnectionParams;
import io.intellixity.nativa.experiments.spi.sql.DialectFactories;
import io.intellixity.nativa.experiments.spi.sql.SqlDialect;
import io.intellixity.nativa.experiments.spring.service.ExperimentAnalysisService;
import io.intellixity.nativa.experiments.sql.query.CompilerOptions;
import io.intellixity.nativa.experiments.sql.query.ExperimentQueryCompiler;
import io.intellixity.nativa.experiments.template.SqlTemplateCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;

/**
 * Wires one warehouse: its dialect, datasource settings and the query compiler.
 * {@link ExperimentAnalysisService} is added when the application provides a {@link WarehouseQueryRunner}.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(NativaExperimentsProperties.class)
public class NativaExperimentsConfig {
  private static final Logger log = LoggerFactory.getLogger(NativaExperimentsConfig.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock nativaExperimentsClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public DialectFactories dialectFactories() {
    return DialectFactories.load();
  }

  @Bean
  @ConditionalOnMissingBean
  public SqlDialect sqlDialect(NativaExperimentsProperties props, DialectFactories factories) {
    String engine = props.getEngine();
    if (engine == null || engine.isBlank()) {
      throw new MissingConfigurationException("nativa.experiments.engine is not set. Available: " + factories.ids());
    }
    SqlDialect dialect = factories.create(engine, ConnectionParams.of(props.getParams()));
    log.info("nativa.experiments op=configure dialect={} formatSql={}", dialect.id(), props.isFormatSql());
    return dialect;
  }

  @Bean
  @ConditionalOnMissingBean
  public DatasourceSettings datasourceSettings(NativaExperimentsProperties props, ResourceLoader resources) {
    String location = props.getSettingsLocation();
    if (location == null || location.isBlank()) return DatasourceSettings.EMPTY;
    Resource resource = resources.getResource(location);
    if (!resource.exists()) {
      throw new MissingConfigurationException("Datasource settings not found: " + location);
    }
    try {
      return DatasourceSettingsLoader.loadSettings(resource.getInputStream());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open datasource settings " + location, e);
    }
  }

  @Bean
  @ConditionalOnMissingBean
  public ExperimentQueryCompiler experimentQueryCompiler(SqlDialect dialect, DatasourceSettings settings,
                                                         NativaExperimentsProperties props, Clock clock) {
    CompilerOptions options = new CompilerOptions(props.isFormatSql(), props.getMaxFormatLength());
    return new ExperimentQueryCompiler(dialect, settings, new SqlTemplateCompiler(clock), clock, options);
  }

  @Bean
  @ConditionalOnBean(WarehouseQueryRunner.class)
  @ConditionalOnMissingBean
  public ExperimentAnalysisService experimentAnalysisService(ExperimentQueryCompiler compiler, WarehouseQueryRunner runner) {
    return new ExperimentAnalysisService(compiler, runner);
  }
}
