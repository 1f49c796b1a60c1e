package io.github.themoah.hydrocp.changepoint;

/**
 * Cost of modelling a contiguous range of a signal as a single segment.
 *
 * <p>Implementations must satisfy {@code cost(s, t) >= cost(s, u) + cost(u, t)} for
 * {@code s < u < t}: splitting a segment never increases its total cost. The pruning in
 * {@link ChangePointDetector} relies on it.
 *
 * <p>Instances are stateful (bound to one signal by {@link #fit}) and not thread-safe.
 */
public interface SegmentCost {

  /**
   * Binds the cost to a signal. Must be called before {@link #cost}.
   */
  void fit(double[] signal);

  /**
   * Cost of the half-open range {@code [start, end)} of the fitted signal.
   */
  double cost(int start, int end);

  /**
   * Smallest segment length for which the cost is meaningful.
   */
  default int minSize() {
    return 1;
  }
}
