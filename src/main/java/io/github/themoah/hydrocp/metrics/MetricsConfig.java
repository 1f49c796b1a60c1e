package io.github.themoah.hydrocp.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for metrics reporting.
 *
 * @param enabled whether metrics are published
 * @param reporterType Micrometer backend: "prometheus" or "datadog"
 * @param jvmMetricsEnabled whether JVM memory, GC, thread and CPU metrics are bound
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final boolean DEFAULT_ENABLED = true;
  private static final String DEFAULT_REPORTER = "prometheus";
  private static final boolean DEFAULT_JVM_METRICS = false;

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_ENABLED - Enable/disable metrics (default: true)</li>
   *   <li>METRICS_REPORTER - Backend, "prometheus" or "datadog" (default: prometheus)</li>
   *   <li>METRICS_JVM_ENABLED - Bind JVM metrics (default: false)</li>
   * </ul>
   */
  public static MetricsConfig fromEnvironment() {
    boolean enabled = parseBoolean("METRICS_ENABLED", DEFAULT_ENABLED);
    String reporter = System.getenv().getOrDefault("METRICS_REPORTER", DEFAULT_REPORTER);
    boolean jvm = parseBoolean("METRICS_JVM_ENABLED", DEFAULT_JVM_METRICS);

    MetricsConfig config = new MetricsConfig(enabled, reporter, jvm);
    log.info("Metrics config: enabled={}, reporter={}, jvmMetrics={}", enabled, reporter, jvm);
    return config;
  }

  private static boolean parseBoolean(String envVar, boolean defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }
}
