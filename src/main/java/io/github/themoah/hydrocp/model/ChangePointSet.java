package io.github.themoah.hydrocp.model;

import java.util.List;

/**
 * Detected segment boundaries of one pair's residual series.
 *
 * @param pair the sensor pair
 * @param breakpoints strictly increasing positions in {@code [1, length - 1]}; the final
 *     boundary at {@code length} is never included
 */
public record ChangePointSet(SensorPair pair, List<Integer> breakpoints) {

  public ChangePointSet {
    breakpoints = List.copyOf(breakpoints);
  }

  public boolean isEmpty() {
    return breakpoints.isEmpty();
  }

  public int size() {
    return breakpoints.size();
  }
}
