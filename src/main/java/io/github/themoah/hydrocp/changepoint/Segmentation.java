package io.github.themoah.hydrocp.changepoint;

import java.util.List;

/**
 * Optimal partition of a signal.
 *
 * @param breakpoints interior segment boundaries, strictly increasing
 * @param totalCost sum of segment costs plus penalty times the number of breakpoints
 */
public record Segmentation(List<Integer> breakpoints, double totalCost) {

  public Segmentation {
    breakpoints = List.copyOf(breakpoints);
  }

  public int segmentCount() {
    return breakpoints.size() + 1;
  }
}
