package io.github.themoah.hydrocp.analysis;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.themoah.hydrocp.error.MissingModelException;
import io.github.themoah.hydrocp.model.PairModel;
import io.github.themoah.hydrocp.model.PressureTable;
import io.github.themoah.hydrocp.model.PressureTableFixtures;
import io.github.themoah.hydrocp.model.ResidualSeries;
import io.github.themoah.hydrocp.model.SensorPair;
import java.util.Map;
import java.util.SortedMap;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ResidualComputer.
 */
public class ResidualComputerTest {

  private final ResidualComputer computer = new ResidualComputer();

  @Test
  void compute_observedMinusPredicted() {
    PressureTable table = PressureTableFixtures.table(
      "x", new double[] {1, 2, 3},
      "y", new double[] {3, 6, 6});
    SensorPair pair = SensorPair.of("x", "y");
    PairModel model = new PairModel(pair, 2.0, 1.0, 0.0, 0.0, 3);

    ResidualSeries residuals = computer.compute(table, model);

    assertArrayEquals(new double[] {0.0, 1.0, -1.0}, residuals.values(), 1e-12);
    assertArrayEquals(table.timeIndex(), residuals.timeIndex());
    assertSame(pair, residuals.pair());
  }

  @Test
  void compute_fittedModel_residualsSumToZero() {
    PressureTable table = PressureTableFixtures.threeSensorsWithRegimeShift();
    SortedMap<SensorPair, PairModel> models = new PairModelFitter().fitAll(table);

    SortedMap<SensorPair, ResidualSeries> residuals = computer.computeAll(table, models);

    assertEquals(models.keySet(), residuals.keySet());
    for (ResidualSeries series : residuals.values()) {
      double sum = 0;
      for (double value : series.values()) {
        sum += value;
      }
      assertEquals(0.0, sum, 1e-6, "OLS residuals of " + series.pair() + " sum to zero");
      assertEquals(table.length(), series.length());
    }
  }

  @Test
  void compute_perfectLine_residualsVanish() {
    double[] x = new double[50];
    double[] y = new double[50];
    for (int i = 0; i < 50; i++) {
      x[i] = i;
      y[i] = 2.0 * i + 1.0;
    }
    PressureTable table = PressureTableFixtures.table("x", x, "y", y);
    SortedMap<SensorPair, PairModel> models = new PairModelFitter().fitAll(table);

    ResidualSeries residuals = computer.compute(table, SensorPair.of("x", "y"), models);

    for (double value : residuals.values()) {
      assertEquals(0.0, value, 1e-9);
    }
  }

  @Test
  void compute_missingModel() {
    PressureTable table = PressureTableFixtures.threeSensorsWithRegimeShift();
    SensorPair pair = SensorPair.of("A", "C");

    MissingModelException e = assertThrows(MissingModelException.class,
      () -> computer.compute(table, pair, Map.of()));
    assertEquals(pair, e.pair());
  }
}
