package io.github.themoah.hydrocp.io;

import io.github.themoah.hydrocp.model.AnalysisReport;
import io.github.themoah.hydrocp.model.PairModel;
import io.github.themoah.hydrocp.model.PairOutcome;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes analysis artifacts into an output directory using the Vert.x file system.
 *
 * <p>Files are overwritten on every run:
 * <ul>
 *   <li>regression_metrics.csv - one row per pair: Sensor_X, Sensor_Y, Slope, Intercept, R2, MSE</li>
 *   <li>residuals.csv - Time column plus one residual column per pair key</li>
 *   <li>change_points.json - pair key to breakpoint positions</li>
 *   <li>change_point_times.json - pair key to breakpoint time-index values</li>
 *   <li>models_metrics.json - model coefficients and metrics</li>
 *   <li>failed_pairs.json - only when at least one pair failed</li>
 * </ul>
 */
public class FileResultExporter implements ResultExporter {

  private static final Logger log = LoggerFactory.getLogger(FileResultExporter.class);

  static final String METRICS_FILE = "regression_metrics.csv";
  static final String RESIDUALS_FILE = "residuals.csv";
  static final String CHANGE_POINTS_FILE = "change_points.json";
  static final String CHANGE_POINT_TIMES_FILE = "change_point_times.json";
  static final String MODELS_FILE = "models_metrics.json";
  static final String FAILURES_FILE = "failed_pairs.json";

  private final FileSystem fileSystem;
  private final Path outputDir;

  public FileResultExporter(Vertx vertx, Path outputDir) {
    this.fileSystem = vertx.fileSystem();
    this.outputDir = outputDir;
  }

  @Override
  public Future<Void> export(AnalysisReport report) {
    log.info("Exporting run {} results to {}", report.runId(), outputDir);

    return fileSystem.mkdirs(outputDir.toString())
      .compose(v -> {
        List<Future<Void>> writes = new ArrayList<>();
        writes.add(write(METRICS_FILE, metricsCsv(report)));
        writes.add(write(RESIDUALS_FILE, residualsCsv(report)));
        writes.add(write(CHANGE_POINTS_FILE, ReportJson.changePoints(report).encode()));
        writes.add(write(CHANGE_POINT_TIMES_FILE, ReportJson.changePointTimes(report).encode()));
        writes.add(write(MODELS_FILE, ReportJson.modelsAndMetrics(report).encodePrettily()));
        if (!report.failures().isEmpty()) {
          writes.add(write(FAILURES_FILE, ReportJson.failures(report).encodePrettily()));
        }
        return Future.all(writes);
      })
      .onSuccess(v -> log.info("Exported run {} results ({} pairs) to {}",
        report.runId(), report.successes().size(), outputDir))
      .onFailure(err -> log.error("Failed to export run {} results to {}", report.runId(), outputDir, err))
      .mapEmpty();
  }

  public Path outputDir() {
    return outputDir;
  }

  private Future<Void> write(String fileName, String content) {
    String path = outputDir.resolve(fileName).toString();
    return fileSystem.writeFile(path, Buffer.buffer(content))
      .onSuccess(v -> log.debug("Wrote {}", path));
  }

  static String metricsCsv(AnalysisReport report) {
    StringBuilder csv = new StringBuilder("Sensor_X,Sensor_Y,Slope,Intercept,R2,MSE\n");
    for (PairOutcome outcome : report.successes()) {
      PairModel model = outcome.model();
      csv.append(model.pair().x()).append(',')
        .append(model.pair().y()).append(',')
        .append(model.slope()).append(',')
        .append(model.intercept()).append(',')
        .append(model.r2()).append(',')
        .append(model.mse()).append('\n');
    }
    return csv.toString();
  }

  static String residualsCsv(AnalysisReport report) {
    List<PairOutcome> successes = report.successes();
    List<double[]> columns = new ArrayList<>(successes.size());

    StringBuilder csv = new StringBuilder("Time");
    for (PairOutcome outcome : successes) {
      csv.append(',').append(outcome.pair().key());
      columns.add(outcome.residuals().values());
    }
    csv.append('\n');

    double[] timeIndex = report.timeIndex();
    for (int i = 0; i < timeIndex.length; i++) {
      csv.append(timeIndex[i]);
      for (double[] column : columns) {
        csv.append(',').append(column[i]);
      }
      csv.append('\n');
    }
    return csv.toString();
  }
}
