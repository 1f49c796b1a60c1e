package io.github.themoah.hydrocp.changepoint;

import java.util.Arrays;

/**
 * Sum of absolute deviations from the segment median.
 *
 * <p>More robust to isolated spikes than {@link L2SegmentCost}, at the price of an
 * O(m log m) sort per evaluated segment of length m.
 */
public class L1SegmentCost implements SegmentCost {

  private double[] signal = new double[0];

  @Override
  public void fit(double[] signal) {
    this.signal = signal.clone();
  }

  @Override
  public double cost(int start, int end) {
    int length = end - start;
    if (length <= 1) {
      return 0.0;
    }
    double[] segment = Arrays.copyOfRange(signal, start, end);
    Arrays.sort(segment);
    double median = segment[length / 2];

    double cost = 0.0;
    for (double value : segment) {
      cost += Math.abs(value - median);
    }
    return cost;
  }
}
