package io.github.themoah.hydrocp.error;

/**
 * Change-point penalty is not a positive finite number.
 */
public class InvalidPenaltyException extends AnalysisException {

  private final double penalty;

  public InvalidPenaltyException(double penalty) {
    super("Penalty must be a positive finite number, got: " + penalty, null);
    this.penalty = penalty;
  }

  public double penalty() {
    return penalty;
  }
}
