package io.github.themoah.hydrocp.error;

import io.github.themoah.hydrocp.model.SensorPair;

/**
 * Base class for failures of the pairwise analysis.
 *
 * <p>All analysis failures are deterministic: repeating the computation with the same input
 * fails the same way, so none of them are retried.
 */
public abstract class AnalysisException extends RuntimeException {

  private final SensorPair pair;

  protected AnalysisException(String message, SensorPair pair) {
    super(pair != null ? pair + ": " + message : message);
    this.pair = pair;
  }

  /**
   * The pair being analysed when the failure happened, or null if not pair-specific.
   */
  public SensorPair pair() {
    return pair;
  }
}
