package io.github.themoah.hydrocp.model;

/**
 * Result of analysing one sensor pair: either the full result or the failure that stopped it.
 *
 * @param pair the sensor pair
 * @param model fitted model (null on failure)
 * @param residuals residual series (null on failure)
 * @param changePoints detected change points (null on failure)
 * @param error the failure (null on success)
 */
public record PairOutcome(
  SensorPair pair,
  PairModel model,
  ResidualSeries residuals,
  ChangePointSet changePoints,
  Throwable error
) {

  public static PairOutcome succeeded(
      PairModel model, ResidualSeries residuals, ChangePointSet changePoints) {
    return new PairOutcome(model.pair(), model, residuals, changePoints, null);
  }

  public static PairOutcome failed(SensorPair pair, Throwable error) {
    return new PairOutcome(pair, null, null, null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }

  /**
   * Simple class name of the failure, or null on success.
   */
  public String errorType() {
    return error != null ? error.getClass().getSimpleName() : null;
  }

  public String errorMessage() {
    return error != null ? error.getMessage() : null;
  }
}
