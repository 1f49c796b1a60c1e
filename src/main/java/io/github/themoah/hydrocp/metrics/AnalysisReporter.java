package io.github.themoah.hydrocp.metrics;

import io.github.themoah.hydrocp.model.AnalysisReport;
import io.vertx.core.Future;

/**
 * Interface for reporting analysis run metrics to external systems.
 */
public interface AnalysisReporter {

  /**
   * Records the results of a completed run.
   *
   * @param report the completed analysis report
   */
  void reportRun(AnalysisReport report);

  /**
   * Records a run that failed before producing a report.
   *
   * @param cause the failure
   */
  default void reportFailedRun(Throwable cause) {
    // Default no-op implementation for reporters without failure tracking
  }

  /**
   * Starts the reporter.
   *
   * @return Future that completes when started
   */
  Future<Void> start();

  /**
   * Closes the reporter and releases resources.
   *
   * @return Future that completes when closed
   */
  Future<Void> close();
}
