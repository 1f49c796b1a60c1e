package io.github.themoah.hydrocp.error;

import io.github.themoah.hydrocp.model.SensorPair;

/**
 * Too few readings to fit a model or segment a series.
 */
public class InsufficientDataException extends AnalysisException {

  public InsufficientDataException(String message) {
    super(message, null);
  }

  public InsufficientDataException(String message, SensorPair pair) {
    super(message, pair);
  }
}
