package io.github.themoah.hydrocp.changepoint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.hydrocp.error.EmptySeriesException;
import io.github.themoah.hydrocp.error.InvalidDataException;
import io.github.themoah.hydrocp.error.InvalidPenaltyException;
import io.github.themoah.hydrocp.model.ChangePointSet;
import io.github.themoah.hydrocp.model.ResidualSeries;
import io.github.themoah.hydrocp.model.SensorPair;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ChangePointDetector.
 */
public class ChangePointDetectorTest {

  private static double[] step(int before, double low, int after, double high) {
    double[] signal = new double[before + after];
    for (int i = 0; i < signal.length; i++) {
      signal[i] = i < before ? low : high;
    }
    return signal;
  }

  private static double[] noisySteps(long seed, int n, int... shifts) {
    Random random = new Random(seed);
    double[] signal = new double[n];
    double level = 0;
    int next = 0;
    for (int i = 0; i < n; i++) {
      if (next < shifts.length && i == shifts[next]) {
        level += 4.0;
        next++;
      }
      signal[i] = level + random.nextGaussian();
    }
    return signal;
  }

  @Test
  void step_lowPenalty_detectsShift() {
    ChangePointDetector detector = new ChangePointDetector(1.0);

    assertEquals(List.of(50), detector.detect(step(50, 0, 50, 10)));
  }

  @Test
  void step_hugePenalty_noBreakpoints() {
    ChangePointDetector detector = new ChangePointDetector(1e6);

    assertTrue(detector.detect(step(50, 0, 50, 10)).isEmpty());
  }

  @Test
  void step_totalCostIsPenaltyOnly() {
    Segmentation segmentation = new ChangePointDetector(1.0).segment(step(50, 0, 50, 10));

    assertEquals(2, segmentation.segmentCount());
    assertEquals(1.0, segmentation.totalCost(), 1e-9);
  }

  @Test
  void constantSignal_noBreakpoints() {
    double[] signal = new double[30];
    Arrays.fill(signal, 4.2);

    assertTrue(new ChangePointDetector(0.01).detect(signal).isEmpty());
  }

  @Test
  void increasingPenalty_breakpointCountNonIncreasing() {
    double[] signal = noisySteps(42, 120, 30, 60, 90);
    double[] penalties = {0.5, 1, 2, 3, 5, 10, 20, 50, 100, 1000, 1e5};

    int previous = Integer.MAX_VALUE;
    for (double penalty : penalties) {
      int count = new ChangePointDetector(penalty).detect(signal).size();
      assertTrue(count <= previous, "penalty " + penalty + " gave " + count + " > " + previous);
      previous = count;
    }
    assertEquals(0, previous);
  }

  @Test
  void breakpoints_strictlyIncreasingAndRespectMinSegmentLength() {
    double[] signal = noisySteps(3, 80, 10, 45, 70);

    for (int minSize : new int[] {1, 2, 5}) {
      ChangePointDetector detector = new ChangePointDetector(2.0, CostModel.L2, minSize, true);
      List<Integer> breakpoints = detector.detect(signal);

      int last = 0;
      for (int bp : breakpoints) {
        assertTrue(bp - last >= minSize, "segment [" + last + ", " + bp + ") too short");
        last = bp;
      }
      assertTrue(signal.length - last >= minSize);
    }
  }

  @Test
  void shortSeries_noBreakpointsAndSingleSegmentCost() {
    ChangePointDetector detector = new ChangePointDetector(0.1);

    Segmentation single = detector.segment(new double[] {5.0});
    assertTrue(single.breakpoints().isEmpty());
    assertEquals(0.0, single.totalCost());

    // three points cannot hold two segments of length 2
    Segmentation three = detector.segment(new double[] {0, 0, 100});
    assertTrue(three.breakpoints().isEmpty());
    double mean = 100.0 / 3;
    double expected = 2 * mean * mean + (100 - mean) * (100 - mean);
    assertEquals(expected, three.totalCost(), 1e-9);
  }

  @Test
  void emptySeries_rejected() {
    ChangePointDetector detector = new ChangePointDetector(1.0);

    assertThrows(EmptySeriesException.class, () -> detector.detect(new double[0]));

    SensorPair pair = SensorPair.of("a", "b");
    EmptySeriesException e = assertThrows(EmptySeriesException.class,
      () -> detector.detect(new ResidualSeries(pair, new double[0], new double[0])));
    assertEquals(pair, e.pair());
  }

  @Test
  void nonFiniteValue_rejected() {
    ChangePointDetector detector = new ChangePointDetector(1.0);

    assertThrows(InvalidDataException.class,
      () -> detector.detect(new double[] {1, 2, Double.NaN, 4}));
    assertThrows(InvalidDataException.class,
      () -> detector.detect(new double[] {1, Double.POSITIVE_INFINITY}));
  }

  @Test
  void invalidPenalty_rejected() {
    for (double penalty : new double[] {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY}) {
      InvalidPenaltyException e = assertThrows(InvalidPenaltyException.class,
        () -> new ChangePointDetector(penalty));
      assertEquals(Double.doubleToLongBits(penalty), Double.doubleToLongBits(e.penalty()));
    }
  }

  @Test
  void invalidMinSegmentLength_rejected() {
    assertThrows(IllegalArgumentException.class,
      () -> new ChangePointDetector(1.0, CostModel.L2, 0, true));
  }

  @Test
  void detect_residualSeries_keepsPair() {
    SensorPair pair = SensorPair.of("a", "b");
    double[] values = step(20, -1, 20, 1);
    double[] time = new double[40];
    for (int i = 0; i < 40; i++) {
      time[i] = i * 0.25;
    }

    ChangePointSet changePoints = new ChangePointDetector(1.0)
      .detect(new ResidualSeries(pair, time, values));

    assertEquals(pair, changePoints.pair());
    assertEquals(List.of(20), changePoints.breakpoints());
  }

  @Test
  void l1Cost_detectsStep() {
    ChangePointDetector detector = new ChangePointDetector(1.0, CostModel.L1, 2, true);

    assertEquals(List.of(30), detector.detect(step(30, 0, 30, 5)));
  }

  @Test
  void pruning_doesNotChangeResult() {
    for (long seed = 1; seed <= 20; seed++) {
      double[] signal = noisySteps(seed, 150, 25, 70, 110);
      for (CostModel model : CostModel.values()) {
        for (double penalty : new double[] {1.0, 5.0, 25.0}) {
          Segmentation pruned =
            new ChangePointDetector(penalty, model, 2, true).segment(signal);
          Segmentation exhaustive =
            new ChangePointDetector(penalty, model, 2, false).segment(signal);

          assertEquals(exhaustive.breakpoints(), pruned.breakpoints(),
            "seed " + seed + ", " + model + ", penalty " + penalty);
          assertEquals(exhaustive.totalCost(), pruned.totalCost(), 1e-9);
        }
      }
    }
  }

  @Test
  void matchesBruteForceOnSmallSeries() {
    Random random = new Random(11);
    for (int n = 1; n <= 20; n++) {
      double[] signal = new double[n];
      for (int i = 0; i < n; i++) {
        signal[i] = random.nextGaussian() + (i >= n / 2 ? 2.0 : 0.0);
      }
      for (double penalty : new double[] {0.3, 2.0}) {
        Segmentation segmentation =
          new ChangePointDetector(penalty, CostModel.L2, 2, true).segment(signal);
        double bruteForce = bruteForceMinimum(signal, penalty, 2);

        assertEquals(bruteForce, segmentation.totalCost(), 1e-9, "n=" + n + ", penalty " + penalty);
        assertEquals(segmentation.totalCost(),
          partitionCost(signal, segmentation.breakpoints(), penalty), 1e-9,
          "returned breakpoints achieve the reported cost");
      }
    }
  }

  // Every subset of interior positions whose segments all hold at least minSize points
  private static double bruteForceMinimum(double[] signal, double penalty, int minSize) {
    int n = signal.length;
    if (n < 2 * minSize) {
      return partitionCost(signal, List.of(), penalty);
    }
    double best = Double.POSITIVE_INFINITY;
    for (int mask = 0; mask < (1 << (n - 1)); mask++) {
      List<Integer> breakpoints = new ArrayList<>();
      for (int i = 1; i < n; i++) {
        if ((mask & (1 << (i - 1))) != 0) {
          breakpoints.add(i);
        }
      }
      if (admissible(breakpoints, n, minSize)) {
        best = Math.min(best, partitionCost(signal, breakpoints, penalty));
      }
    }
    return best;
  }

  private static boolean admissible(List<Integer> breakpoints, int n, int minSize) {
    int last = 0;
    for (int bp : breakpoints) {
      if (bp - last < minSize) {
        return false;
      }
      last = bp;
    }
    return n - last >= minSize;
  }

  private static double partitionCost(double[] signal, List<Integer> breakpoints, double penalty) {
    double total = penalty * breakpoints.size();
    int start = 0;
    List<Integer> ends = new ArrayList<>(breakpoints);
    ends.add(signal.length);
    for (int end : ends) {
      double mean = 0;
      for (int i = start; i < end; i++) {
        mean += signal[i];
      }
      mean /= (end - start);
      for (int i = start; i < end; i++) {
        total += (signal[i] - mean) * (signal[i] - mean);
      }
      start = end;
    }
    return total;
  }
}
