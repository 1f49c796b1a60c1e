package io.github.themoah.hydrocp.changepoint;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Segment cost models available to the change-point detector.
 */
public enum CostModel {
  L2("l2", L2SegmentCost::new),
  L1("l1", L1SegmentCost::new);

  private final String value;
  private final Supplier<SegmentCost> factory;

  CostModel(String value, Supplier<SegmentCost> factory) {
    this.value = value;
    this.factory = factory;
  }

  public String getValue() {
    return value;
  }

  /**
   * Creates a fresh, unfitted cost instance.
   */
  public SegmentCost newCost() {
    return factory.get();
  }

  /**
   * Resolves a cost model by its configuration name ("l2", "l1"), case-insensitively.
   *
   * @throws IllegalArgumentException for unknown names
   */
  public static CostModel fromValue(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (CostModel model : values()) {
      if (model.value.equals(normalized)) {
        return model;
      }
    }
    throw new IllegalArgumentException("Unknown cost model: " + value);
  }
}
