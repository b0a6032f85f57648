package io.intellixity.nativa.experiments.spring.service;

import io.intellixity.nativa.experiments.spi.exec.QueryResponse;
import io.intellixity.nativa.experiments.spi.exec.WarehouseQueryRunner;
import io.intellixity.nativa.experiments.sql.query.ExperimentMetricRequest;
import io.intellixity.nativa.experiments.sql.query.ExperimentQueryCompiler;
import io.intellixity.nativa.experiments.sql.query.ExperimentUnitsRequest;
import io.intellixity.nativa.experiments.sql.query.FactMetricsRequest;
import io.intellixity.nativa.experiments.sql.query.MetricValueRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Compiles an analysis and hands the SQL to the warehouse runner.
 *
 * Build errors are thrown synchronously from the calling thread; warehouse failures complete the
 * returned future exceptionally.
 */
public final class ExperimentAnalysisService {
  private static final Logger log = LoggerFactory.getLogger(ExperimentAnalysisService.class);

  private final ExperimentQueryCompiler compiler;
  private final WarehouseQueryRunner runner;

  public ExperimentAnalysisService(ExperimentQueryCompiler compiler, WarehouseQueryRunner runner) {
    this.compiler = Objects.requireNonNull(compiler, "compiler");
    this.runner = Objects.requireNonNull(runner, "runner");
    String dialectId = compiler.dialect().id();
    if (!dialectId.equalsIgnoreCase(runner.id())) {
      throw new IllegalArgumentException("Warehouse runner '" + runner.id() + "' cannot run SQL for dialect '" + dialectId + "'");
    }
  }

  public CompletableFuture<QueryResponse> experimentUnits(ExperimentUnitsRequest req) {
    return run("experimentUnits", req.settings().experimentId(), compiler.experimentUnitsQuery(req), id -> {});
  }

  public CompletableFuture<QueryResponse> experimentMetric(ExperimentMetricRequest req, Consumer<String> externalIdCallback) {
    return run("experimentMetric", req.metric().id(), compiler.experimentMetricQuery(req), externalIdCallback);
  }

  public CompletableFuture<QueryResponse> experimentFactMetrics(FactMetricsRequest req, Consumer<String> externalIdCallback) {
    return run("experimentFactMetrics", req.units().settings().experimentId(), compiler.experimentFactMetricsQuery(req),
        externalIdCallback);
  }

  public CompletableFuture<QueryResponse> metricValue(MetricValueRequest req) {
    return run("metricValue", req.metric().id(), compiler.metricValueQuery(req), id -> {});
  }

  public CompletableFuture<Void> cancel(String externalId) {
    log.info("nativa.experiments op=cancel dialect={} externalId={}", runner.id(), externalId);
    return runner.cancelQuery(externalId);
  }

  private CompletableFuture<QueryResponse> run(String op, String key, String sql, Consumer<String> externalIdCallback) {
    long started = System.nanoTime();
    return runner.runQuery(sql, externalIdCallback == null ? id -> {} : externalIdCallback)
        .whenComplete((res, err) -> {
          long elapsedMs = (System.nanoTime() - started) / 1_000_000;
          if (err != null) {
            log.warn("nativa.experiments op={} dialect={} key={} elapsedMs={} error={}",
                op, runner.id(), key, elapsedMs, err.toString());
          } else if (log.isDebugEnabled()) {
            log.debug("nativa.experiments op={} dialect={} key={} rows={} elapsedMs={}",
                op, runner.id(), key, res.rows().size(), elapsedMs);
          }
        });
  }
}
