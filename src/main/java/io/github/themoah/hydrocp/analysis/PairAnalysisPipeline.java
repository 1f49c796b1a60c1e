package io.github.themoah.hydrocp.analysis;

import io.github.themoah.hydrocp.error.AnalysisException;
import io.github.themoah.hydrocp.model.AnalysisReport;
import io.github.themoah.hydrocp.model.PairOutcome;
import io.github.themoah.hydrocp.model.PressureTable;
import io.github.themoah.hydrocp.model.SensorPair;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyses all sensor pairs of a table concurrently on a shared Vert.x worker pool.
 *
 * <p>Pairs are split into chunks, one blocking task per chunk. Every task reads the shared
 * immutable table and returns its own outcomes; the outcomes are merged by pair order, so
 * the report does not depend on which chunk finishes first.
 */
public class PairAnalysisPipeline {

  private static final Logger log = LoggerFactory.getLogger(PairAnalysisPipeline.class);

  static final String WORKER_POOL_NAME = "hydrocp-analysis";

  private final Vertx vertx;
  private final AnalysisConfig config;
  private final PairAnalyzer analyzer;
  private final WorkerExecutor executor;
  private final AtomicLong runCounter = new AtomicLong();

  public PairAnalysisPipeline(Vertx vertx, AnalysisConfig config) {
    this.vertx = vertx;
    this.config = config;
    this.analyzer = new PairAnalyzer(config.createDetector());
    this.executor = vertx.createSharedWorkerExecutor(WORKER_POOL_NAME, config.workerPoolSize());
  }

  /**
   * Runs the analysis for every pair of the table.
   *
   * <p>Failed pairs are recorded in the report unless fail-fast is configured, in which case
   * the returned future fails with the first failure in pair order.
   *
   * @param table the pressure table
   * @return Future with the complete report
   */
  public Future<AnalysisReport> run(PressureTable table) {
    long runId = runCounter.incrementAndGet();
    Instant startedAt = Instant.now();
    List<SensorPair> pairs = table.pairs();
    List<List<SensorPair>> chunks = splitIntoChunks(pairs, config.workerPoolSize());

    log.info("Run {}: analysing {} pairs of {} sensors ({} readings) in {} chunks",
      runId, pairs.size(), table.sensors().size(), table.length(), chunks.size());

    List<Future<List<PairOutcome>>> futures = chunks.stream()
      .map(chunk -> executor.executeBlocking(() -> analyzeChunk(table, chunk), false))
      .collect(Collectors.toList());

    Future<AnalysisReport> report = Future.all(futures)
      .map(composite -> {
        SortedMap<SensorPair, PairOutcome> outcomes = new TreeMap<>();
        for (int i = 0; i < composite.size(); i++) {
          List<PairOutcome> chunkOutcomes = composite.resultAt(i);
          for (PairOutcome outcome : chunkOutcomes) {
            outcomes.put(outcome.pair(), outcome);
          }
        }
        return new AnalysisReport(
          runId,
          startedAt,
          Instant.now(),
          config.penalty(),
          config.costModel().getValue(),
          table.timeIndex(),
          new ArrayList<>(table.sensors()),
          outcomes
        );
      })
      .compose(this::applyFailurePolicy)
      .onSuccess(r -> log.info("Run {} finished in {}ms: {} pairs succeeded, {} failed, {} change points",
        runId, r.duration().toMillis(), r.successes().size(), r.failures().size(), r.changePointCount()));

    return withDeadline(report, runId);
  }

  /**
   * Releases the worker pool.
   */
  public Future<Void> close() {
    return executor.close();
  }

  private List<PairOutcome> analyzeChunk(PressureTable table, List<SensorPair> chunk) {
    List<PairOutcome> outcomes = new ArrayList<>(chunk.size());
    for (SensorPair pair : chunk) {
      outcomes.add(analyzePair(table, pair));
    }
    return outcomes;
  }

  private PairOutcome analyzePair(PressureTable table, SensorPair pair) {
    try {
      PairOutcome outcome = analyzer.analyze(table, pair);
      log.debug("Pair {}: r2={}, mse={}, change points={}",
        pair.key(), String.format("%.4f", outcome.model().r2()),
        String.format("%.4g", outcome.model().mse()), outcome.changePoints().breakpoints());
      return outcome;
    } catch (AnalysisException e) {
      log.warn("Analysis failed for pair {}: {}", pair.key(), e.getMessage());
      return PairOutcome.failed(pair, e);
    }
  }

  private Future<AnalysisReport> applyFailurePolicy(AnalysisReport report) {
    if (config.failFast()) {
      List<PairOutcome> failures = report.failures();
      if (!failures.isEmpty()) {
        PairOutcome first = failures.get(0);
        log.error("Run {} aborted: {} of {} pairs failed, first failure on {}",
          report.runId(), failures.size(), report.outcomes().size(), first.pair().key());
        return Future.failedFuture(first.error());
      }
    }
    return Future.succeededFuture(report);
  }

  private Future<AnalysisReport> withDeadline(Future<AnalysisReport> report, long runId) {
    if (config.timeoutMs() <= 0) {
      return report;
    }
    Promise<AnalysisReport> promise = Promise.promise();
    long timerId = vertx.setTimer(config.timeoutMs(), id -> {
      if (promise.tryFail(new TimeoutException(
          "Run " + runId + " exceeded deadline of " + config.timeoutMs() + "ms"))) {
        log.error("Run {} exceeded deadline of {}ms, discarding its results", runId, config.timeoutMs());
      }
    });
    report.onComplete(ar -> {
      vertx.cancelTimer(timerId);
      if (ar.succeeded()) {
        promise.tryComplete(ar.result());
      } else {
        promise.tryFail(ar.cause());
      }
    });
    return promise.future();
  }

  /**
   * Splits items round-robin into at most {@code chunkCount} chunks of near-equal size,
   * keeping the relative item order inside each chunk.
   */
  static <T> List<List<T>> splitIntoChunks(List<T> items, int chunkCount) {
    if (items.isEmpty()) {
      return List.of();
    }

    int effectiveChunks = Math.max(1, Math.min(chunkCount, items.size()));
    List<List<T>> chunks = new ArrayList<>(effectiveChunks);
    for (int i = 0; i < effectiveChunks; i++) {
      chunks.add(new ArrayList<>());
    }
    for (int i = 0; i < items.size(); i++) {
      chunks.get(i % effectiveChunks).add(items.get(i));
    }
    return chunks;
  }
}
