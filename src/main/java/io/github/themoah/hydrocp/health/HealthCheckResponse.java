package io.github.themoah.hydrocp.health;

import io.github.themoah.hydrocp.analysis.AnalysisRunner.RunState;
import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param analysis analysis run state (null for liveness check)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String analysis
) {
  /**
   * Creates a liveness response (HTTP server only).
   */
  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null);
  }

  /**
   * Creates a readiness response: UP only once an analysis run has completed.
   *
   * @param state current runner state
   */
  public static HealthCheckResponse readiness(RunState state) {
    HealthStatus status = state == RunState.COMPLETED ? HealthStatus.UP : HealthStatus.DOWN;
    return new HealthCheckResponse(status, state.getValue());
  }

  public boolean isUp() {
    return status == HealthStatus.UP;
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (analysis != null) {
      json.put("analysis", analysis);
    }
    return json;
  }
}
