package io.github.themoah.hydrocp.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pressure tables shared by the tests.
 */
public final class PressureTableFixtures {

  private PressureTableFixtures() {}

  /**
   * Three sensors over 100 readings: B follows A exactly ({@code B = 2A + 3}) while C follows
   * A with gain 1.5 until position 60 and gain 3 afterwards ({@code C = kA + 2}).
   */
  public static PressureTable threeSensorsWithRegimeShift() {
    int n = 100;
    double[] time = new double[n];
    double[] a = new double[n];
    double[] b = new double[n];
    double[] c = new double[n];
    for (int t = 0; t < n; t++) {
      time[t] = t;
      a[t] = 50.0 + 0.5 * Math.sin(2 * Math.PI * t / 20.0);
      b[t] = 2.0 * a[t] + 3.0;
      c[t] = (t < 60 ? 1.5 : 3.0) * a[t] + 2.0;
    }
    Map<String, double[]> series = new LinkedHashMap<>();
    series.put("A", a);
    series.put("B", b);
    series.put("C", c);
    return PressureTable.of(time, series);
  }

  /**
   * Table with unit-spaced time index and the given series, in argument order.
   */
  public static PressureTable table(Object... sensorsAndValues) {
    Map<String, double[]> series = new LinkedHashMap<>();
    int length = 0;
    for (int i = 0; i < sensorsAndValues.length; i += 2) {
      double[] values = (double[]) sensorsAndValues[i + 1];
      series.put((String) sensorsAndValues[i], values);
      length = values.length;
    }
    double[] time = new double[length];
    for (int t = 0; t < length; t++) {
      time[t] = t;
    }
    return PressureTable.of(time, series);
  }
}
