package io.github.themoah.hydrocp.http;

import io.github.themoah.hydrocp.io.ReportJson;
import io.github.themoah.hydrocp.model.AnalysisReport;
import io.github.themoah.hydrocp.model.PairOutcome;
import io.github.themoah.hydrocp.model.SensorPair;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.HashSet;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only JSON API over the latest analysis report.
 *
 * <p>Every route answers 503 until the first run has completed.
 */
public class ResultsHandler {

  private static final Logger log = LoggerFactory.getLogger(ResultsHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final Supplier<AnalysisReport> reportSource;

  /**
   * @param reportSource supplies the latest report, or null while none exists
   */
  public ResultsHandler(Supplier<AnalysisReport> reportSource) {
    this.reportSource = reportSource;
  }

  public void registerRoutes(Router router) {
    router.get("/results/summary").handler(this::handleSummary);
    router.get("/results/pairs").handler(this::handlePairs);
    router.get("/results/pairs/:key").handler(this::handlePair);
    router.get("/results/change-points").handler(this::handleChangePoints);
    log.info("Results routes registered: /results/summary, /results/pairs, " +
      "/results/pairs/:key, /results/change-points");
  }

  private void handleSummary(RoutingContext ctx) {
    AnalysisReport report = requireReport(ctx);
    if (report != null) {
      ok(ctx, ReportJson.summary(report).encode());
    }
  }

  private void handlePairs(RoutingContext ctx) {
    AnalysisReport report = requireReport(ctx);
    if (report == null) {
      return;
    }
    JsonArray pairs = new JsonArray();
    for (PairOutcome outcome : report.outcomes().values()) {
      pairs.add(ReportJson.pair(outcome, false));
    }
    ok(ctx, pairs.encode());
  }

  private void handlePair(RoutingContext ctx) {
    AnalysisReport report = requireReport(ctx);
    if (report == null) {
      return;
    }

    String key = ctx.pathParam("key");
    List<SensorPair> matches = SensorPair.matchKey(key, new HashSet<>(report.sensors()));
    if (matches.isEmpty()) {
      error(ctx, 404, "Unknown pair: " + key);
      return;
    }
    if (matches.size() > 1) {
      error(ctx, 400, "Ambiguous pair key: " + key + " matches " + matches);
      return;
    }

    PairOutcome outcome = report.outcomes().get(matches.get(0));
    if (outcome == null) {
      error(ctx, 404, "Unknown pair: " + key);
      return;
    }
    boolean includeResiduals = "true".equalsIgnoreCase(ctx.request().getParam("residuals"));
    ok(ctx, ReportJson.pair(outcome, includeResiduals).encode());
  }

  private void handleChangePoints(RoutingContext ctx) {
    AnalysisReport report = requireReport(ctx);
    if (report == null) {
      return;
    }
    JsonObject json = new JsonObject()
      .put("positions", ReportJson.changePoints(report))
      .put("times", ReportJson.changePointTimes(report));
    ok(ctx, json.encode());
  }

  private AnalysisReport requireReport(RoutingContext ctx) {
    AnalysisReport report = reportSource.get();
    if (report == null) {
      error(ctx, 503, "No analysis results available yet");
    }
    return report;
  }

  private static void ok(RoutingContext ctx, String body) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(200)
      .end(body);
  }

  private static void error(RoutingContext ctx, int statusCode, String message) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(statusCode)
      .end(new JsonObject().put("error", message).encode());
  }
}
