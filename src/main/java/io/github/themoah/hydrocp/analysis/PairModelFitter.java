package io.github.themoah.hydrocp.analysis;

import io.github.themoah.hydrocp.error.InsufficientDataException;
import io.github.themoah.hydrocp.error.InvalidDataException;
import io.github.themoah.hydrocp.model.PairModel;
import io.github.themoah.hydrocp.model.PressureTable;
import io.github.themoah.hydrocp.model.SensorPair;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits one linear model per sensor pair, the x-sensor predicting the y-sensor.
 */
public class PairModelFitter {

  private static final Logger log = LoggerFactory.getLogger(PairModelFitter.class);

  static final int MIN_SAMPLES = 2;
  private static final double RELATIVE_SPREAD_TOLERANCE = 1e-10;

  /**
   * Fits models for every pair of the table.
   *
   * @return models keyed by pair, in natural pair order
   */
  public SortedMap<SensorPair, PairModel> fitAll(PressureTable table) {
    SortedMap<SensorPair, PairModel> models = new TreeMap<>();
    for (SensorPair pair : table.pairs()) {
      models.put(pair, fit(table, pair));
    }
    log.debug("Fitted {} pair models over {} readings", models.size(), table.length());
    return models;
  }

  /**
   * Fits the model of a single pair.
   *
   * @throws InsufficientDataException if the table has fewer than two readings
   * @throws InvalidDataException if either series holds a missing or non-finite reading
   */
  public PairModel fit(PressureTable table, SensorPair pair) {
    if (table.length() < MIN_SAMPLES) {
      throw new InsufficientDataException(
        "need at least " + MIN_SAMPLES + " readings to fit, got " + table.length(), pair);
    }
    double[] xs = table.series(pair.x());
    double[] ys = table.series(pair.y());
    requireFinite(xs, pair.x(), pair);
    requireFinite(ys, pair.y(), pair);

    // ============================================================================
    // ORDINARY LEAST SQUARES on (x, y) readings
    // ============================================================================
    //   slope     = Σ((xᵢ - mean_x) × (yᵢ - mean_y)) / Σ((xᵢ - mean_x)²)
    //   intercept = mean_y - slope × mean_x
    //
    // Centered sums are used instead of the expanded form: pressures carry a large
    // offset relative to their variation, and Σx² - n×mean_x² cancels badly.
    // ============================================================================

    int n = xs.length;
    double sumX = 0, sumY = 0;
    for (int i = 0; i < n; i++) {
      sumX += xs[i];
      sumY += ys[i];
    }
    double meanX = sumX / n;
    double meanY = sumY / n;

    double sxx = 0, sxy = 0, syy = 0;
    for (int i = 0; i < n; i++) {
      double dx = xs[i] - meanX;
      double dy = ys[i] - meanY;
      sxx += dx * dx;
      sxy += dx * dy;
      syy += dy * dy;
    }

    double slope;
    double intercept;
    if (isZeroVariance(sxx, meanX, n)) {
      // Constant predictor: the minimum-norm solution is the response mean
      slope = 0.0;
      intercept = meanY;
    } else {
      slope = sxy / sxx;
      intercept = meanY - slope * meanX;
    }

    double ssRes = 0;
    for (int i = 0; i < n; i++) {
      double residual = ys[i] - (slope * xs[i] + intercept);
      ssRes += residual * residual;
    }

    double r2 = isZeroVariance(syy, meanY, n) ? 0.0 : 1.0 - ssRes / syy;
    double mse = ssRes / n;

    log.trace("Fitted {}: slope={}, intercept={}, r2={}, mse={}", pair, slope, intercept, r2, mse);
    return new PairModel(pair, slope, intercept, r2, mse, n);
  }

  // Spread below RELATIVE_SPREAD_TOLERANCE of the readings' magnitude is rounding noise
  private static boolean isZeroVariance(double sumSquares, double mean, int n) {
    double tolerance = RELATIVE_SPREAD_TOLERANCE * Math.max(1.0, Math.abs(mean));
    return sumSquares <= n * tolerance * tolerance;
  }

  private static void requireFinite(double[] values, String sensor, SensorPair pair) {
    for (int i = 0; i < values.length; i++) {
      if (!Double.isFinite(values[i])) {
        throw new InvalidDataException(
          "sensor " + sensor + " has a missing or non-finite reading at position " + i, pair);
      }
    }
  }
}
