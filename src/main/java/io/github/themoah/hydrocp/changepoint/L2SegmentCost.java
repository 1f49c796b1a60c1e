package io.github.themoah.hydrocp.changepoint;

/**
 * Sum of squared deviations from the segment mean.
 *
 * <p>Prefix sums of values and squared values give every segment cost in O(1):
 * {@code cost = sumSq - sum^2 / length}. The signal is centered on its global mean first,
 * which leaves every cost unchanged but keeps the subtraction well conditioned for
 * signals with a large offset.
 */
public class L2SegmentCost implements SegmentCost {

  private double[] prefixSum = new double[1];
  private double[] prefixSumSq = new double[1];

  @Override
  public void fit(double[] signal) {
    int n = signal.length;
    double mean = 0.0;
    for (double value : signal) {
      mean += value;
    }
    mean = n > 0 ? mean / n : 0.0;

    prefixSum = new double[n + 1];
    prefixSumSq = new double[n + 1];
    for (int i = 0; i < n; i++) {
      double centered = signal[i] - mean;
      prefixSum[i + 1] = prefixSum[i] + centered;
      prefixSumSq[i + 1] = prefixSumSq[i] + centered * centered;
    }
  }

  @Override
  public double cost(int start, int end) {
    int length = end - start;
    if (length <= 0) {
      return 0.0;
    }
    double sum = prefixSum[end] - prefixSum[start];
    double sumSq = prefixSumSq[end] - prefixSumSq[start];
    // Rounding can push a zero-variance segment slightly below 0
    return Math.max(0.0, sumSq - sum * sum / length);
  }
}
