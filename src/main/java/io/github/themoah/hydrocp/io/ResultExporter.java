package io.github.themoah.hydrocp.io;

import io.github.themoah.hydrocp.model.AnalysisReport;
import io.vertx.core.Future;

/**
 * Interface for persisting analysis results outside the process.
 */
public interface ResultExporter {

  /**
   * Persists metrics, residuals, change points and model coefficients of a run.
   *
   * @param report the completed analysis report
   * @return Future that completes when every artifact is written
   */
  Future<Void> export(AnalysisReport report);
}
