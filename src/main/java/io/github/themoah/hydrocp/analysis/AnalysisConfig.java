package io.github.themoah.hydrocp.analysis;

import io.github.themoah.hydrocp.changepoint.ChangePointDetector;
import io.github.themoah.hydrocp.changepoint.CostModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the pairwise analysis.
 *
 * @param penalty change-point penalty per additional segment (default 3.0)
 * @param minSegmentLength minimum points per segment (default 2)
 * @param costModel segment cost model (default l2)
 * @param pruningEnabled whether PELT pruning is applied (default true)
 * @param workerPoolSize number of worker threads analysing pairs (default available processors)
 * @param failFast abort the whole run on the first failed pair (default false)
 * @param timeoutMs overall deadline for one run in milliseconds, 0 for none (default 0)
 */
public record AnalysisConfig(
  double penalty,
  int minSegmentLength,
  CostModel costModel,
  boolean pruningEnabled,
  int workerPoolSize,
  boolean failFast,
  long timeoutMs
) {

  private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

  private static final double DEFAULT_PENALTY = 3.0;
  private static final int DEFAULT_MIN_SEGMENT_LENGTH = ChangePointDetector.DEFAULT_MIN_SEGMENT_LENGTH;
  private static final CostModel DEFAULT_COST_MODEL = CostModel.L2;
  private static final boolean DEFAULT_PRUNING_ENABLED = true;
  private static final boolean DEFAULT_FAIL_FAST = false;
  private static final long DEFAULT_TIMEOUT_MS = 0;

  /**
   * Defaults, with the worker pool sized to the available processors.
   */
  public static AnalysisConfig defaults() {
    return new AnalysisConfig(DEFAULT_PENALTY, DEFAULT_MIN_SEGMENT_LENGTH, DEFAULT_COST_MODEL,
      DEFAULT_PRUNING_ENABLED, defaultPoolSize(), DEFAULT_FAIL_FAST, DEFAULT_TIMEOUT_MS);
  }

  /**
   * Same configuration with a different penalty.
   */
  public AnalysisConfig withPenalty(double newPenalty) {
    return new AnalysisConfig(newPenalty, minSegmentLength, costModel, pruningEnabled,
      workerPoolSize, failFast, timeoutMs);
  }

  /**
   * Same configuration with fail-fast switched on or off.
   */
  public AnalysisConfig withFailFast(boolean newFailFast) {
    return new AnalysisConfig(penalty, minSegmentLength, costModel, pruningEnabled,
      workerPoolSize, newFailFast, timeoutMs);
  }

  /**
   * Builds the change-point detector described by this configuration.
   */
  public ChangePointDetector createDetector() {
    return new ChangePointDetector(penalty, costModel, minSegmentLength, pruningEnabled);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>HYDROCP_PENALTY - Penalty per additional segment (default: 3.0)</li>
   *   <li>HYDROCP_MIN_SEGMENT_LENGTH - Minimum points per segment (default: 2)</li>
   *   <li>HYDROCP_COST_MODEL - Segment cost, "l2" or "l1" (default: l2)</li>
   *   <li>HYDROCP_PRUNING_ENABLED - Enable candidate pruning (default: true)</li>
   *   <li>HYDROCP_WORKER_POOL_SIZE - Analysis worker threads (default: available processors)</li>
   *   <li>HYDROCP_FAIL_FAST - Abort a run on the first failed pair (default: false)</li>
   *   <li>HYDROCP_ANALYSIS_TIMEOUT_MS - Deadline per run, 0 disables (default: 0)</li>
   * </ul>
   */
  public static AnalysisConfig fromEnvironment() {
    double penalty = parseDouble("HYDROCP_PENALTY", DEFAULT_PENALTY);
    int minSegmentLength = parseInt("HYDROCP_MIN_SEGMENT_LENGTH", DEFAULT_MIN_SEGMENT_LENGTH);
    CostModel costModel = parseCostModel("HYDROCP_COST_MODEL", DEFAULT_COST_MODEL);
    boolean pruning = parseBoolean("HYDROCP_PRUNING_ENABLED", DEFAULT_PRUNING_ENABLED);
    int poolSize = parseInt("HYDROCP_WORKER_POOL_SIZE", defaultPoolSize());
    boolean failFast = parseBoolean("HYDROCP_FAIL_FAST", DEFAULT_FAIL_FAST);
    long timeoutMs = parseLong("HYDROCP_ANALYSIS_TIMEOUT_MS", DEFAULT_TIMEOUT_MS);

    if (minSegmentLength < 1) {
      log.warn("HYDROCP_MIN_SEGMENT_LENGTH must be >= 1, using default: {}", DEFAULT_MIN_SEGMENT_LENGTH);
      minSegmentLength = DEFAULT_MIN_SEGMENT_LENGTH;
    }
    if (poolSize < 1) {
      log.warn("HYDROCP_WORKER_POOL_SIZE must be >= 1, using default: {}", defaultPoolSize());
      poolSize = defaultPoolSize();
    }
    if (timeoutMs < 0) {
      log.warn("HYDROCP_ANALYSIS_TIMEOUT_MS must be >= 0, disabling the deadline");
      timeoutMs = DEFAULT_TIMEOUT_MS;
    }

    AnalysisConfig config = new AnalysisConfig(
      penalty, minSegmentLength, costModel, pruning, poolSize, failFast, timeoutMs);
    log.info("Analysis config: penalty={}, minSegmentLength={}, costModel={}, pruning={}, " +
        "workerPoolSize={}, failFast={}, timeoutMs={}",
      penalty, minSegmentLength, costModel.getValue(), pruning, poolSize, failFast, timeoutMs);

    return config;
  }

  private static int defaultPoolSize() {
    return Runtime.getRuntime().availableProcessors();
  }

  private static CostModel parseCostModel(String envVar, CostModel defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return CostModel.fromValue(value);
    } catch (IllegalArgumentException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue.getValue());
      return defaultValue;
    }
  }

  private static boolean parseBoolean(String envVar, boolean defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }

  private static double parseDouble(String envVar, double defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }

  private static int parseInt(String envVar, int defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }

  private static long parseLong(String envVar, long defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
