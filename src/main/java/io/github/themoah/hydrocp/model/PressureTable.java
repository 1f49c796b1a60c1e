package io.github.themoah.hydrocp.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pressure readings of all sensors over one shared, strictly increasing time index.
 *
 * <p>Immutable: arrays are copied on the way in and on the way out. Missing readings are
 * {@code NaN}; they are allowed here so the analysis can report them against the offending
 * pair, but the loader normally rejects them first.
 */
public final class PressureTable {

  private final double[] timeIndex;
  private final Map<String, double[]> series;

  private PressureTable(double[] timeIndex, Map<String, double[]> series) {
    this.timeIndex = timeIndex;
    this.series = series;
  }

  /**
   * Creates a table, validating the shared index.
   *
   * @param timeIndex strictly increasing time values
   * @param series sensor id to readings, iteration order is kept
   * @throws IllegalArgumentException if a series length differs from the index length
   *     or the index is not strictly increasing
   */
  public static PressureTable of(double[] timeIndex, Map<String, double[]> series) {
    for (int i = 1; i < timeIndex.length; i++) {
      if (!(timeIndex[i] > timeIndex[i - 1])) {
        throw new IllegalArgumentException(
          "Time index must be strictly increasing, violated at position " + i);
      }
    }

    Map<String, double[]> copy = new LinkedHashMap<>();
    for (Map.Entry<String, double[]> entry : series.entrySet()) {
      if (entry.getValue().length != timeIndex.length) {
        throw new IllegalArgumentException(String.format(
          "Series %s has %d readings, time index has %d",
          entry.getKey(), entry.getValue().length, timeIndex.length));
      }
      copy.put(entry.getKey(), entry.getValue().clone());
    }
    return new PressureTable(timeIndex.clone(), Collections.unmodifiableMap(copy));
  }

  public int length() {
    return timeIndex.length;
  }

  public double[] timeIndex() {
    return timeIndex.clone();
  }

  public double timeAt(int position) {
    return timeIndex[position];
  }

  public Set<String> sensors() {
    return series.keySet();
  }

  public boolean hasSensor(String sensor) {
    return series.containsKey(sensor);
  }

  /**
   * Returns a copy of the readings for a sensor.
   *
   * @throws IllegalArgumentException if the sensor is unknown
   */
  public double[] series(String sensor) {
    double[] values = series.get(sensor);
    if (values == null) {
      throw new IllegalArgumentException("Unknown sensor: " + sensor);
    }
    return values.clone();
  }

  /**
   * All C(n,2) sensor pairs of this table in natural pair order.
   */
  public List<SensorPair> pairs() {
    return SensorPair.enumerate(series.keySet());
  }

  /**
   * Mean spacing of the time index, or 0 for fewer than two points.
   */
  public double meanTimeStep() {
    if (timeIndex.length < 2) {
      return 0.0;
    }
    return (timeIndex[timeIndex.length - 1] - timeIndex[0]) / (timeIndex.length - 1);
  }

  public boolean hasMissingValues() {
    return series.values().stream()
      .flatMapToDouble(Arrays::stream)
      .anyMatch(Double::isNaN);
  }

  @Override
  public String toString() {
    return "PressureTable{sensors=" + series.keySet() + ", length=" + timeIndex.length + "}";
  }
}
