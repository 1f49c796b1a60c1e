package io.github.themoah.hydrocp.analysis;

import io.github.themoah.hydrocp.changepoint.ChangePointDetector;
import io.github.themoah.hydrocp.model.ChangePointSet;
import io.github.themoah.hydrocp.model.PairModel;
import io.github.themoah.hydrocp.model.PairOutcome;
import io.github.themoah.hydrocp.model.PressureTable;
import io.github.themoah.hydrocp.model.ResidualSeries;
import io.github.themoah.hydrocp.model.SensorPair;

/**
 * Runs fit, residual and change-point detection for a single pair.
 *
 * <p>Reads only the immutable table, so one instance can serve all worker threads.
 */
public class PairAnalyzer {

  private final PairModelFitter fitter;
  private final ResidualComputer residualComputer;
  private final ChangePointDetector detector;

  public PairAnalyzer(ChangePointDetector detector) {
    this(new PairModelFitter(), new ResidualComputer(), detector);
  }

  PairAnalyzer(PairModelFitter fitter, ResidualComputer residualComputer, ChangePointDetector detector) {
    this.fitter = fitter;
    this.residualComputer = residualComputer;
    this.detector = detector;
  }

  /**
   * Analyses one pair.
   *
   * @throws io.github.themoah.hydrocp.error.AnalysisException if any stage fails
   */
  public PairOutcome analyze(PressureTable table, SensorPair pair) {
    PairModel model = fitter.fit(table, pair);
    ResidualSeries residuals = residualComputer.compute(table, model);
    ChangePointSet changePoints = detector.detect(residuals);
    return PairOutcome.succeeded(model, residuals, changePoints);
  }

  public ChangePointDetector detector() {
    return detector;
  }
}
