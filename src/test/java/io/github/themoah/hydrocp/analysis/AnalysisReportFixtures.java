package io.github.themoah.hydrocp.analysis;

import io.github.themoah.hydrocp.changepoint.ChangePointDetector;
import io.github.themoah.hydrocp.error.InvalidDataException;
import io.github.themoah.hydrocp.model.AnalysisReport;
import io.github.themoah.hydrocp.model.PairOutcome;
import io.github.themoah.hydrocp.model.PressureTable;
import io.github.themoah.hydrocp.model.PressureTableFixtures;
import io.github.themoah.hydrocp.model.SensorPair;
import java.time.Instant;
import java.util.ArrayList;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Analysis reports built synchronously for exporter and API tests.
 */
public final class AnalysisReportFixtures {

  public static final double PENALTY = 10.0;

  private AnalysisReportFixtures() {}

  /**
   * Report of the three-sensor regime-shift table: every pair succeeds.
   */
  public static AnalysisReport regimeShiftReport() {
    PressureTable table = PressureTableFixtures.threeSensorsWithRegimeShift();
    PairAnalyzer analyzer = new PairAnalyzer(new ChangePointDetector(PENALTY));

    SortedMap<SensorPair, PairOutcome> outcomes = new TreeMap<>();
    for (SensorPair pair : table.pairs()) {
      outcomes.put(pair, analyzer.analyze(table, pair));
    }
    return report(table, outcomes);
  }

  /**
   * Report with one successful pair (a, b) and one failed pair (a, c).
   */
  public static AnalysisReport partialFailureReport() {
    PressureTable table = PressureTableFixtures.table(
      "a", new double[] {1, 2, 3, 4},
      "b", new double[] {3, 5, 7, 9},
      "c", new double[] {1, 2, 3, 4});
    PairAnalyzer analyzer = new PairAnalyzer(new ChangePointDetector(PENALTY));

    SortedMap<SensorPair, PairOutcome> outcomes = new TreeMap<>();
    SensorPair good = SensorPair.of("a", "b");
    SensorPair bad = SensorPair.of("a", "c");
    outcomes.put(good, analyzer.analyze(table, good));
    outcomes.put(bad, PairOutcome.failed(bad, new InvalidDataException("sensor c is broken", bad)));
    return report(table, outcomes);
  }

  private static AnalysisReport report(PressureTable table, SortedMap<SensorPair, PairOutcome> outcomes) {
    Instant started = Instant.parse("2024-05-01T10:00:00Z");
    return new AnalysisReport(
      7,
      started,
      started.plusMillis(250),
      PENALTY,
      "l2",
      table.timeIndex(),
      new ArrayList<>(table.sensors()),
      outcomes
    );
  }
}
