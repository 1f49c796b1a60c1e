package io.github.themoah.hydrocp;

import io.github.themoah.hydrocp.analysis.AnalysisConfig;
import io.github.themoah.hydrocp.analysis.AnalysisRunner;
import io.github.themoah.hydrocp.analysis.PairAnalysisPipeline;
import io.github.themoah.hydrocp.config.AppConfig;
import io.github.themoah.hydrocp.health.HealthCheckHandler;
import io.github.themoah.hydrocp.http.ResultsHandler;
import io.github.themoah.hydrocp.io.CsvPressureTableLoader;
import io.github.themoah.hydrocp.io.FileResultExporter;
import io.github.themoah.hydrocp.metrics.AnalysisReporter;
import io.github.themoah.hydrocp.metrics.MetricsConfig;
import io.github.themoah.hydrocp.metrics.MicrometerConfig;
import io.github.themoah.hydrocp.metrics.MicrometerReporter;
import io.github.themoah.hydrocp.metrics.PrometheusHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for hydrocp - pairwise pressure change-point analysis.
 * Wires the analysis runner, metrics and the HTTP server.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private AnalysisRunner runner;
  private HttpServer httpServer;

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting hydrocp MainVerticle");

    AppConfig appConfig = AppConfig.fromEnvironment();
    AnalysisConfig analysisConfig = AnalysisConfig.fromEnvironment();
    MetricsConfig metricsConfig = MetricsConfig.fromEnvironment();

    Router router = Router.router(vertx);
    AnalysisReporter reporter = createReporter(metricsConfig, router);

    try {
      runner = new AnalysisRunner(
        vertx,
        new CsvPressureTableLoader(appConfig.timeUnit()),
        appConfig.inputFile(),
        new PairAnalysisPipeline(vertx, analysisConfig),
        new FileResultExporter(vertx, appConfig.outputDir()),
        reporter,
        appConfig.runOnce() ? 0 : appConfig.runIntervalMs()
      );
    } catch (RuntimeException e) {
      log.error("Invalid analysis configuration", e);
      startPromise.fail(e);
      return;
    }

    if (appConfig.runOnce()) {
      runSingleAnalysis(startPromise);
      return;
    }

    new HealthCheckHandler(runner).registerRoutes(router);
    new ResultsHandler(runner::latestReport).registerRoutes(router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    startHttpServer(router, appConfig.httpPort())
      .onSuccess(server -> {
        httpServer = server;
        log.info("hydrocp started successfully on port {}", appConfig.httpPort());
        startPromise.complete();
        runner.start();
      })
      .onFailure(err -> {
        log.error("Failed to start hydrocp", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping hydrocp MainVerticle");

    Future<Void> stopRunner = (runner != null)
      ? runner.stop()
      : Future.succeededFuture();

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    stopRunner
      .compose(v -> stopHttpServer)
      .onSuccess(v -> {
        log.info("hydrocp stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during hydrocp shutdown", err);
        stopPromise.fail(err);
      });
  }

  private void runSingleAnalysis(Promise<Void> startPromise) {
    log.info("Run-once mode: analysing without HTTP server");
    runner.runOnce()
      .onSuccess(report -> {
        log.info("Run-once analysis finished: {} pairs succeeded, {} failed",
          report.successes().size(), report.failures().size());
        startPromise.complete();
        vertx.close();
      })
      .onFailure(startPromise::fail);
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", port))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private AnalysisReporter createReporter(MetricsConfig config, Router router) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return null;
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return null;
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    return new MicrometerReporter(registry);
  }
}
