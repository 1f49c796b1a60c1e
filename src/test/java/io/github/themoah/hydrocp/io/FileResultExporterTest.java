package io.github.themoah.hydrocp.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.hydrocp.analysis.AnalysisReportFixtures;
import io.github.themoah.hydrocp.model.AnalysisReport;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for FileResultExporter.
 */
@ExtendWith(VertxExtension.class)
public class FileResultExporterTest {

  @TempDir
  Path tempDir;

  @Test
  void export_writesAllArtifacts(Vertx vertx, VertxTestContext ctx) throws Exception {
    Path outputDir = tempDir.resolve("processed");
    FileResultExporter exporter = new FileResultExporter(vertx, outputDir);

    exporter.export(AnalysisReportFixtures.regimeShiftReport())
      .onComplete(ctx.succeeding(v -> ctx.verify(() -> {
        List<String> metrics = Files.readAllLines(outputDir.resolve(FileResultExporter.METRICS_FILE));
        assertEquals("Sensor_X,Sensor_Y,Slope,Intercept,R2,MSE", metrics.get(0));
        assertEquals(4, metrics.size());
        assertTrue(metrics.get(1).startsWith("A,B,"));

        List<String> residuals = Files.readAllLines(outputDir.resolve(FileResultExporter.RESIDUALS_FILE));
        assertEquals("Time,A_B,A_C,B_C", residuals.get(0));
        assertEquals(101, residuals.size());

        JsonObject changePoints = new JsonObject(
          Files.readString(outputDir.resolve(FileResultExporter.CHANGE_POINTS_FILE)));
        assertEquals(new JsonArray(), changePoints.getJsonArray("A_B"));

        assertTrue(Files.exists(outputDir.resolve(FileResultExporter.CHANGE_POINT_TIMES_FILE)));
        JsonObject models = new JsonObject(
          Files.readString(outputDir.resolve(FileResultExporter.MODELS_FILE)));
        assertEquals(3, models.getJsonObject("models").size());

        assertFalse(Files.exists(outputDir.resolve(FileResultExporter.FAILURES_FILE)));
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(10, TimeUnit.SECONDS));
  }

  @Test
  void export_writesFailuresWhenPairsFailed(Vertx vertx, VertxTestContext ctx) throws Exception {
    FileResultExporter exporter = new FileResultExporter(vertx, tempDir);

    exporter.export(AnalysisReportFixtures.partialFailureReport())
      .onComplete(ctx.succeeding(v -> ctx.verify(() -> {
        JsonArray failures = new JsonArray(
          Files.readString(tempDir.resolve(FileResultExporter.FAILURES_FILE)));
        assertEquals(1, failures.size());
        assertEquals("a_c", failures.getJsonObject(0).getString("pair"));

        List<String> metrics = Files.readAllLines(tempDir.resolve(FileResultExporter.METRICS_FILE));
        assertEquals(2, metrics.size(), "failed pairs are left out of the metrics");
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(10, TimeUnit.SECONDS));
  }

  @Test
  void residualsCsv_alignsWithTimeIndex() {
    AnalysisReport report = AnalysisReportFixtures.partialFailureReport();

    String[] lines = FileResultExporter.residualsCsv(report).split("\n");

    assertEquals("Time,a_b", lines[0]);
    assertEquals(5, lines.length);
    assertTrue(lines[1].startsWith("0.0,"));
    assertTrue(lines[4].startsWith("3.0,"));
  }
}
