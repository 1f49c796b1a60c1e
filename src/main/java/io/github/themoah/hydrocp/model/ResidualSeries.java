package io.github.themoah.hydrocp.model;

/**
 * Observed-minus-predicted readings of a pair's response sensor, aligned to the table's
 * time index.
 */
public final class ResidualSeries {

  private final SensorPair pair;
  private final double[] timeIndex;
  private final double[] values;

  public ResidualSeries(SensorPair pair, double[] timeIndex, double[] values) {
    if (timeIndex.length != values.length) {
      throw new IllegalArgumentException(String.format(
        "Residuals for %s have %d values, time index has %d",
        pair, values.length, timeIndex.length));
    }
    this.pair = pair;
    this.timeIndex = timeIndex.clone();
    this.values = values.clone();
  }

  public SensorPair pair() {
    return pair;
  }

  public int length() {
    return values.length;
  }

  public double[] timeIndex() {
    return timeIndex.clone();
  }

  public double[] values() {
    return values.clone();
  }

  public double valueAt(int position) {
    return values[position];
  }

  public double timeAt(int position) {
    return timeIndex[position];
  }
}
