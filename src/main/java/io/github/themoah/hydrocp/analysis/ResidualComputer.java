package io.github.themoah.hydrocp.analysis;

import io.github.themoah.hydrocp.error.MissingModelException;
import io.github.themoah.hydrocp.model.PairModel;
import io.github.themoah.hydrocp.model.PressureTable;
import io.github.themoah.hydrocp.model.ResidualSeries;
import io.github.themoah.hydrocp.model.SensorPair;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes observed-minus-predicted residuals from fitted pair models.
 */
public class ResidualComputer {

  /**
   * Computes residuals for every fitted model.
   */
  public SortedMap<SensorPair, ResidualSeries> computeAll(
      PressureTable table, Map<SensorPair, PairModel> models) {
    SortedMap<SensorPair, ResidualSeries> residuals = new TreeMap<>();
    for (SensorPair pair : models.keySet()) {
      residuals.put(pair, compute(table, pair, models));
    }
    return residuals;
  }

  /**
   * Computes the residual series of one pair.
   *
   * @throws MissingModelException if {@code models} has no entry for the pair
   */
  public ResidualSeries compute(
      PressureTable table, SensorPair pair, Map<SensorPair, PairModel> models) {
    PairModel model = models.get(pair);
    if (model == null) {
      throw new MissingModelException(pair);
    }
    return compute(table, model);
  }

  /**
   * Computes the residual series of the model's pair.
   */
  public ResidualSeries compute(PressureTable table, PairModel model) {
    double[] xs = table.series(model.pair().x());
    double[] ys = table.series(model.pair().y());

    double[] residuals = new double[ys.length];
    for (int i = 0; i < ys.length; i++) {
      residuals[i] = ys[i] - model.predict(xs[i]);
    }
    return new ResidualSeries(model.pair(), table.timeIndex(), residuals);
  }
}
