package io.github.themoah.hydrocp.model;

/**
 * Fitted linear model {@code y = slope * x + intercept} for one sensor pair.
 *
 * @param pair the sensor pair (x predicts y)
 * @param slope fitted slope
 * @param intercept fitted intercept
 * @param r2 coefficient of determination, 0 when the response has no variance
 * @param mse mean squared error of the fit
 * @param sampleCount number of readings used
 */
public record PairModel(
  SensorPair pair,
  double slope,
  double intercept,
  double r2,
  double mse,
  int sampleCount
) {

  /**
   * Model prediction for a single x-reading.
   */
  public double predict(double x) {
    return slope * x + intercept;
  }
}
