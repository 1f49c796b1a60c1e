package io.github.themoah.hydrocp.error;

import io.github.themoah.hydrocp.model.SensorPair;

/**
 * Residuals were requested for a pair that has no fitted model.
 * This is a sequencing bug in the caller and is never recoverable.
 */
public class MissingModelException extends AnalysisException {

  public MissingModelException(SensorPair pair) {
    super("no fitted model for pair", pair);
  }
}
