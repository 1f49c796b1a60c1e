package io.github.themoah.hydrocp.analysis;

import io.github.themoah.hydrocp.io.CsvPressureTableLoader;
import io.github.themoah.hydrocp.io.ResultExporter;
import io.github.themoah.hydrocp.metrics.AnalysisReporter;
import io.github.themoah.hydrocp.model.AnalysisReport;
import io.github.themoah.hydrocp.model.PressureTable;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the input table, analyses it, exports the results and reports metrics, either once
 * or periodically. Keeps the latest successful report for the HTTP API.
 */
public class AnalysisRunner {

  private static final Logger log = LoggerFactory.getLogger(AnalysisRunner.class);

  private final Vertx vertx;
  private final CsvPressureTableLoader loader;
  private final Path inputFile;
  private final PairAnalysisPipeline pipeline;
  private final ResultExporter exporter;
  private final AnalysisReporter reporter;
  private final long intervalMs;

  private final AtomicReference<AnalysisReport> latestReport = new AtomicReference<>();
  private final AtomicReference<Throwable> lastError = new AtomicReference<>();
  private final AtomicBoolean running = new AtomicBoolean(false);

  private Long timerId;

  /**
   * State of the runner as seen by the readiness probe.
   */
  public enum RunState {
    PENDING("pending"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    RunState(String value) {
      this.value = value;
    }

    public String getValue() {
      return value;
    }
  }

  /**
   * @param reporter metrics reporter, or null when metrics are disabled
   * @param intervalMs re-run interval, 0 to analyse only once at start
   */
  public AnalysisRunner(
    Vertx vertx,
    CsvPressureTableLoader loader,
    Path inputFile,
    PairAnalysisPipeline pipeline,
    ResultExporter exporter,
    AnalysisReporter reporter,
    long intervalMs
  ) {
    this.vertx = vertx;
    this.loader = loader;
    this.inputFile = inputFile;
    this.pipeline = pipeline;
    this.exporter = exporter;
    this.reporter = reporter;
    this.intervalMs = intervalMs;
  }

  /**
   * Runs the first analysis, then schedules periodic runs when an interval is configured.
   * A failed first run does not fail the returned future; it shows up in {@link #state()}.
   */
  public Future<Void> start() {
    log.info("Starting analysis runner for {} with interval: {}ms", inputFile, intervalMs);

    Future<Void> reporterStarted = reporter != null ? reporter.start() : Future.succeededFuture();
    return reporterStarted
      .compose(v -> runOnce().<Void>mapEmpty().otherwiseEmpty())
      .onComplete(ar -> {
        if (intervalMs > 0) {
          timerId = vertx.setPeriodic(intervalMs, id -> runOnce());
          log.info("Analysis runner scheduled, timer ID: {}", timerId);
        }
      });
  }

  /**
   * Stops periodic runs and releases the worker pool and the reporter.
   */
  public Future<Void> stop() {
    log.info("Stopping analysis runner");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    Future<Void> closeReporter = reporter != null ? reporter.close() : Future.succeededFuture();
    return pipeline.close().compose(v -> closeReporter);
  }

  /**
   * Performs one load, analyse, export and report cycle.
   * Fails without running if the previous cycle is still in progress.
   */
  public Future<AnalysisReport> runOnce() {
    if (!running.compareAndSet(false, true)) {
      log.warn("Previous analysis run still in progress, skipping");
      return Future.failedFuture(new IllegalStateException("Analysis run already in progress"));
    }

    return vertx.executeBlocking(() -> loader.load(inputFile), false)
      .compose(this::analyze)
      .onSuccess(report -> {
        latestReport.set(report);
        lastError.set(null);
        if (reporter != null) {
          reporter.reportRun(report);
        }
      })
      .onFailure(err -> {
        lastError.set(err);
        log.error("Analysis run on {} failed", inputFile, err);
        if (reporter != null) {
          reporter.reportFailedRun(err);
        }
      })
      .onComplete(ar -> running.set(false));
  }

  private Future<AnalysisReport> analyze(PressureTable table) {
    return pipeline.run(table)
      .compose(report -> exporter.export(report).map(report));
  }

  /**
   * The report of the most recent successful run, or null before the first one.
   */
  public AnalysisReport latestReport() {
    return latestReport.get();
  }

  /**
   * The failure of the most recent run, or null if it succeeded.
   */
  public Throwable lastError() {
    return lastError.get();
  }

  public RunState state() {
    if (latestReport.get() != null) {
      return RunState.COMPLETED;
    }
    return lastError.get() != null ? RunState.FAILED : RunState.PENDING;
  }
}
