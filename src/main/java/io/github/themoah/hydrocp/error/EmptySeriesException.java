package io.github.themoah.hydrocp.error;

import io.github.themoah.hydrocp.model.SensorPair;

/**
 * Change-point detection was invoked on a series with no values.
 */
public class EmptySeriesException extends AnalysisException {

  public EmptySeriesException() {
    super("Cannot segment an empty series", null);
  }

  public EmptySeriesException(SensorPair pair) {
    super("Cannot segment an empty series", pair);
  }
}
