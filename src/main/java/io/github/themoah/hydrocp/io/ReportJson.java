package io.github.themoah.hydrocp.io;

import io.github.themoah.hydrocp.model.AnalysisReport;
import io.github.themoah.hydrocp.model.ChangePointSet;
import io.github.themoah.hydrocp.model.PairModel;
import io.github.themoah.hydrocp.model.PairOutcome;
import io.github.themoah.hydrocp.model.ResidualSeries;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * JSON views of an analysis report, shared by the file exporter and the HTTP results API.
 *
 * <p>Pairs are keyed by {@code "{x}_{y}"} and emitted in natural pair order.
 */
public final class ReportJson {

  private ReportJson() {}

  /**
   * Metrics record of one model: Sensor_X, Sensor_Y, Slope, Intercept, R2, MSE.
   */
  public static JsonObject metrics(PairModel model) {
    return new JsonObject()
      .put("Sensor_X", model.pair().x())
      .put("Sensor_Y", model.pair().y())
      .put("Slope", model.slope())
      .put("Intercept", model.intercept())
      .put("R2", model.r2())
      .put("MSE", model.mse());
  }

  /**
   * Metrics records of all successful pairs.
   */
  public static JsonArray metrics(AnalysisReport report) {
    JsonArray metrics = new JsonArray();
    for (PairOutcome outcome : report.successes()) {
      metrics.add(metrics(outcome.model()));
    }
    return metrics;
  }

  /**
   * Pair key to breakpoint positions.
   */
  public static JsonObject changePoints(AnalysisReport report) {
    JsonObject json = new JsonObject();
    for (PairOutcome outcome : report.successes()) {
      json.put(outcome.pair().key(), new JsonArray(outcome.changePoints().breakpoints()));
    }
    return json;
  }

  /**
   * Pair key to breakpoint positions mapped onto the time index.
   */
  public static JsonObject changePointTimes(AnalysisReport report) {
    double[] timeIndex = report.timeIndex();
    JsonObject json = new JsonObject();
    for (PairOutcome outcome : report.successes()) {
      json.put(outcome.pair().key(), changePointTimes(outcome.changePoints(), timeIndex));
    }
    return json;
  }

  /**
   * Model coefficients keyed by pair plus the metrics records.
   */
  public static JsonObject modelsAndMetrics(AnalysisReport report) {
    JsonObject models = new JsonObject();
    for (PairOutcome outcome : report.successes()) {
      PairModel model = outcome.model();
      models.put(outcome.pair().key(), new JsonObject()
        .put("coef", new JsonArray().add(model.slope()))
        .put("intercept", model.intercept()));
    }
    return new JsonObject()
      .put("models", models)
      .put("metrics", metrics(report));
  }

  /**
   * Failed pairs with the failure type and message.
   */
  public static JsonArray failures(AnalysisReport report) {
    JsonArray failures = new JsonArray();
    for (PairOutcome outcome : report.failures()) {
      failures.add(new JsonObject()
        .put("pair", outcome.pair().key())
        .put("sensor_x", outcome.pair().x())
        .put("sensor_y", outcome.pair().y())
        .put("error", outcome.errorType())
        .put("message", outcome.errorMessage()));
    }
    return failures;
  }

  /**
   * Run summary: timing, settings and counts.
   */
  public static JsonObject summary(AnalysisReport report) {
    return new JsonObject()
      .put("runId", report.runId())
      .put("startedAt", report.startedAt().toString())
      .put("finishedAt", report.finishedAt().toString())
      .put("durationMs", report.duration().toMillis())
      .put("penalty", report.penalty())
      .put("costModel", report.costModel())
      .put("sensors", new JsonArray(report.sensors()))
      .put("readings", report.timeIndex().length)
      .put("pairs", report.outcomes().size())
      .put("succeeded", report.successes().size())
      .put("failed", report.failures().size())
      .put("changePoints", report.changePointCount());
  }

  /**
   * Detail of one pair: model, change points and optionally the residual series.
   */
  public static JsonObject pair(PairOutcome outcome, boolean includeResiduals) {
    JsonObject json = new JsonObject()
      .put("pair", outcome.pair().key())
      .put("sensor_x", outcome.pair().x())
      .put("sensor_y", outcome.pair().y());

    if (!outcome.isSuccess()) {
      return json
        .put("error", outcome.errorType())
        .put("message", outcome.errorMessage());
    }

    ResidualSeries residuals = outcome.residuals();
    json
      .put("metrics", metrics(outcome.model()))
      .put("changePoints", new JsonArray(outcome.changePoints().breakpoints()))
      .put("changePointTimes", changePointTimes(outcome.changePoints(), residuals.timeIndex()));

    if (includeResiduals) {
      JsonArray values = new JsonArray();
      for (double value : residuals.values()) {
        values.add(value);
      }
      json.put("residuals", values);
    }
    return json;
  }

  private static JsonArray changePointTimes(ChangePointSet changePoints, double[] timeIndex) {
    JsonArray times = new JsonArray();
    for (int position : changePoints.breakpoints()) {
      times.add(timeIndex[position]);
    }
    return times;
  }
}
