package io.github.themoah.hydrocp.metrics;

import io.github.themoah.hydrocp.model.AnalysisReport;
import io.github.themoah.hydrocp.model.PairModel;
import io.github.themoah.hydrocp.model.PairOutcome;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.vertx.core.Future;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports analysis metrics using a Micrometer MeterRegistry.
 *
 * <p>Per-pair gauges carry {@code sensor_x}, {@code sensor_y} and {@code pair} tags. Gauges of
 * pairs missing from two consecutive runs are removed from the registry.
 */
public class MicrometerReporter implements AnalysisReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  private final MeterRegistry registry;
  private final Timer runDuration;
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();
  private final Set<String> markedForDeletion = ConcurrentHashMap.newKeySet();

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;
    this.runDuration = Timer.builder("hydrocp.run.duration")
      .description("Wall-clock duration of an analysis run")
      .register(registry);
  }

  @Override
  public void reportRun(AnalysisReport report) {
    log.debug("Reporting metrics for run {} ({} pairs)", report.runId(), report.outcomes().size());

    Set<String> activeKeys = new HashSet<>();

    for (PairOutcome outcome : report.successes()) {
      PairModel model = outcome.model();
      Tags tags = Tags.of(
        "sensor_x", outcome.pair().x(),
        "sensor_y", outcome.pair().y(),
        "pair", outcome.pair().key()
      );
      activeKeys.add(recordGauge("hydrocp.pair.r2", tags, model.r2()));
      activeKeys.add(recordGauge("hydrocp.pair.mse", tags, model.mse()));
      activeKeys.add(recordGauge("hydrocp.pair.change_points", tags, outcome.changePoints().size()));
    }

    activeKeys.add(recordGauge("hydrocp.run.pairs", Tags.of("outcome", "succeeded"), report.successes().size()));
    activeKeys.add(recordGauge("hydrocp.run.pairs", Tags.of("outcome", "failed"), report.failures().size()));
    activeKeys.add(recordGauge("hydrocp.run.change_points", Tags.empty(), report.changePointCount()));
    activeKeys.add(recordGauge("hydrocp.run.last_success_timestamp_seconds", Tags.empty(),
      report.finishedAt().toEpochMilli() / 1000.0));

    runDuration.record(report.duration());
    registry.counter("hydrocp.runs", "result", "success").increment();

    cleanupStaleGauges(activeKeys);
  }

  @Override
  public void reportFailedRun(Throwable cause) {
    registry.counter("hydrocp.runs", "result", "failure").increment();
  }

  @Override
  public Future<Void> start() {
    log.info("MicrometerReporter started");
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerReporter");
    if (registry != null) {
      registry.close();
    }
    return Future.succeededFuture();
  }

  // Gauge values are kept as raw double bits so one AtomicLong holder serves every gauge
  private String recordGauge(String name, Tags tags, double value) {
    String key = name + tags.toString();
    long bits = Double.doubleToRawLongBits(value);
    AtomicLong holder = gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong newHolder = new AtomicLong(bits);
      Gauge.builder(name, newHolder, h -> Double.longBitsToDouble(h.get()))
        .tags(tags)
        .register(registry);
      return newHolder;
    });
    holder.set(bits);
    return key;
  }

  /**
   * Two-phase cleanup for stale gauges.
   * Phase 1: Mark missing gauges for deletion
   * Phase 2: Delete gauges that were marked AND are still missing
   *
   * @param activeKeys gauge keys updated in the current run
   */
  void cleanupStaleGauges(Set<String> activeKeys) {
    Set<String> toDelete = new HashSet<>(markedForDeletion);
    toDelete.removeAll(activeKeys);
    for (String key : toDelete) {
      removeGauge(key);
      markedForDeletion.remove(key);
    }
    if (!toDelete.isEmpty()) {
      log.info("Removed {} stale gauges", toDelete.size());
    }

    Set<String> missing = new HashSet<>(gaugeValues.keySet());
    missing.removeAll(activeKeys);
    markedForDeletion.retainAll(missing);
    for (String key : missing) {
      if (markedForDeletion.add(key)) {
        log.debug("Marked gauge for deletion: {}", key);
      }
    }
  }

  int gaugeCount() {
    return gaugeValues.size();
  }

  private void removeGauge(String key) {
    if (gaugeValues.remove(key) != null) {
      registry.getMeters().stream()
        .filter(meter -> buildMeterKey(meter).equals(key))
        .findFirst()
        .ifPresent(registry::remove);
      log.debug("Removed stale gauge: {}", key);
    }
  }

  private String buildMeterKey(Meter meter) {
    return meter.getId().getName() + Tags.of(meter.getId().getTags()).toString();
  }
}
