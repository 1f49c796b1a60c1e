package io.github.themoah.hydrocp.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Complete result of one analysis run over a pressure table.
 *
 * @param runId sequence number of the run within this process
 * @param startedAt when the run started
 * @param finishedAt when the run finished
 * @param penalty change-point penalty used
 * @param costModel segment cost model name used
 * @param timeIndex the table's time index
 * @param sensors sensor ids of the table
 * @param outcomes per-pair outcomes in natural pair order
 */
public record AnalysisReport(
  long runId,
  Instant startedAt,
  Instant finishedAt,
  double penalty,
  String costModel,
  double[] timeIndex,
  List<String> sensors,
  SortedMap<SensorPair, PairOutcome> outcomes
) {

  public AnalysisReport {
    timeIndex = timeIndex.clone();
    sensors = List.copyOf(sensors);
    outcomes = Collections.unmodifiableSortedMap(new TreeMap<>(outcomes));
  }

  @Override
  public double[] timeIndex() {
    return timeIndex.clone();
  }

  public Duration duration() {
    return Duration.between(startedAt, finishedAt);
  }

  public List<PairOutcome> successes() {
    return outcomes.values().stream().filter(PairOutcome::isSuccess).toList();
  }

  public List<PairOutcome> failures() {
    return outcomes.values().stream().filter(o -> !o.isSuccess()).toList();
  }

  public int changePointCount() {
    return successes().stream().mapToInt(o -> o.changePoints().size()).sum();
  }
}
