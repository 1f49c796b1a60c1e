package io.github.themoah.hydrocp.changepoint;

import io.github.themoah.hydrocp.error.EmptySeriesException;
import io.github.themoah.hydrocp.error.InvalidDataException;
import io.github.themoah.hydrocp.error.InvalidPenaltyException;
import io.github.themoah.hydrocp.model.ChangePointSet;
import io.github.themoah.hydrocp.model.ResidualSeries;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact optimal partitioning of a series with PELT-style candidate pruning.
 *
 * <p>Finds breakpoints {@code 0 < t1 < ... < tk < n} minimizing
 * {@code sum(cost(segment)) + penalty * k}, where every segment holds at least
 * {@code minSegmentLength} points.
 *
 * <p>Stateless between calls and safe to share across threads: each call fits its own
 * {@link SegmentCost} instance.
 */
public class ChangePointDetector {

  private static final Logger log = LoggerFactory.getLogger(ChangePointDetector.class);

  public static final int DEFAULT_MIN_SEGMENT_LENGTH = 2;

  private final double penalty;
  private final CostModel costModel;
  private final int minSegmentLength;
  private final boolean pruningEnabled;

  public ChangePointDetector(double penalty) {
    this(penalty, CostModel.L2, DEFAULT_MIN_SEGMENT_LENGTH, true);
  }

  /**
   * @param penalty cost charged per breakpoint, must be positive and finite
   * @param costModel per-segment cost
   * @param minSegmentLength minimum number of points in a segment, at least 1
   * @param pruningEnabled whether provably suboptimal candidates are discarded
   * @throws InvalidPenaltyException if the penalty is not positive and finite
   */
  public ChangePointDetector(
      double penalty, CostModel costModel, int minSegmentLength, boolean pruningEnabled) {
    if (!(penalty > 0) || Double.isInfinite(penalty)) {
      throw new InvalidPenaltyException(penalty);
    }
    if (minSegmentLength < 1) {
      throw new IllegalArgumentException("minSegmentLength must be >= 1, got: " + minSegmentLength);
    }
    this.penalty = penalty;
    this.costModel = costModel;
    this.minSegmentLength = minSegmentLength;
    this.pruningEnabled = pruningEnabled;
  }

  /**
   * Detects change points of a pair's residual series.
   */
  public ChangePointSet detect(ResidualSeries residuals) {
    if (residuals.length() == 0) {
      throw new EmptySeriesException(residuals.pair());
    }
    return new ChangePointSet(residuals.pair(), segment(residuals.values()).breakpoints());
  }

  /**
   * Detects change points of a raw series.
   *
   * @return interior breakpoints, strictly increasing, possibly empty
   */
  public List<Integer> detect(double[] signal) {
    return segment(signal).breakpoints();
  }

  /**
   * Computes the optimal partition and its total cost.
   *
   * @throws EmptySeriesException if the signal is empty
   * @throws InvalidDataException if the signal holds NaN or infinite values
   */
  public Segmentation segment(double[] signal) {
    int n = signal.length;
    if (n == 0) {
      throw new EmptySeriesException();
    }
    for (int i = 0; i < n; i++) {
      if (!Double.isFinite(signal[i])) {
        throw new InvalidDataException("Non-finite value at position " + i + ": " + signal[i]);
      }
    }

    SegmentCost cost = costModel.newCost();
    cost.fit(signal);
    int minSize = Math.max(minSegmentLength, cost.minSize());

    if (n < 2 * minSize) {
      return new Segmentation(List.of(), cost.cost(0, n));
    }

    // best[t]: minimal cost of partitioning [0, t); best[0] = -penalty so that the first
    // segment is not charged a breakpoint
    double[] best = new double[n + 1];
    int[] previous = new int[n + 1];
    best[0] = -penalty;

    List<Candidate> candidates = new ArrayList<>();
    candidates.add(new Candidate(0));
    long evaluations = 0;

    for (int t = minSize; t <= n; t++) {
      int newStart = t - minSize;
      if (newStart >= minSize) {
        candidates.add(new Candidate(newStart));
      }

      double minValue = Double.POSITIVE_INFINITY;
      int argMin = -1;
      Iterator<Candidate> it = candidates.iterator();
      while (it.hasNext()) {
        Candidate c = it.next();
        if (c.expiresAt <= t) {
          it.remove();
          continue;
        }
        c.fit = best[c.start] + cost.cost(c.start, t);
        evaluations++;
        double value = c.fit + penalty;
        if (value < minValue) {
          minValue = value;
          argMin = c.start;
        }
      }
      best[t] = minValue;
      previous[t] = argMin;

      if (pruningEnabled) {
        for (Candidate c : candidates) {
          // t becomes an admissible start only minSize points later, so s must stay
          // available until then
          if (c.expiresAt == Integer.MAX_VALUE && c.fit > best[t]) {
            c.expiresAt = t + minSize;
          }
        }
      }
    }

    List<Integer> breakpoints = new ArrayList<>();
    int position = previous[n];
    while (position > 0) {
      breakpoints.add(position);
      position = previous[position];
    }
    Collections.reverse(breakpoints);

    log.trace("Segmented {} points into {} segments with {} cost evaluations",
      n, breakpoints.size() + 1, evaluations);

    return new Segmentation(breakpoints, best[n]);
  }

  public double penalty() {
    return penalty;
  }

  public CostModel costModel() {
    return costModel;
  }

  public int minSegmentLength() {
    return minSegmentLength;
  }

  public boolean isPruningEnabled() {
    return pruningEnabled;
  }

  private static final class Candidate {
    private final int start;
    private int expiresAt = Integer.MAX_VALUE;
    private double fit;

    private Candidate(int start) {
      this.start = start;
    }
  }
}
