package io.github.themoah.hydrocp.error;

import io.github.themoah.hydrocp.model.SensorPair;

/**
 * Input contains missing or non-numeric readings that upstream validation should have rejected.
 */
public class InvalidDataException extends AnalysisException {

  public InvalidDataException(String message) {
    super(message, null);
  }

  public InvalidDataException(String message, SensorPair pair) {
    super(message, pair);
  }
}
