package io.github.themoah.hydrocp.config;

import io.github.themoah.hydrocp.io.CsvPressureTableLoader.TimeUnit;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port
 * @param inputFile simulation CSV to analyse
 * @param outputDir directory receiving exported artifacts
 * @param timeUnit unit the time column is converted to
 * @param runIntervalMs re-run interval in milliseconds, 0 to analyse only at startup
 * @param runOnce analyse once without starting the HTTP server, then shut down
 */
public record AppConfig(
  int httpPort,
  Path inputFile,
  Path outputDir,
  TimeUnit timeUnit,
  long runIntervalMs,
  boolean runOnce
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final String DEFAULT_INPUT_FILE = "data/raw/epanet.csv";
  private static final String DEFAULT_OUTPUT_DIR = "data/processed";
  private static final TimeUnit DEFAULT_TIME_UNIT = TimeUnit.HOURS;
  private static final long DEFAULT_RUN_INTERVAL_MS = 0L;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    int port = getEnvInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    Path input = Path.of(System.getenv().getOrDefault("HYDROCP_INPUT_FILE", DEFAULT_INPUT_FILE));
    Path output = Path.of(System.getenv().getOrDefault("HYDROCP_OUTPUT_DIR", DEFAULT_OUTPUT_DIR));
    TimeUnit timeUnit = getEnvTimeUnit("HYDROCP_TIME_UNIT", DEFAULT_TIME_UNIT);
    long interval = getEnvLong("HYDROCP_RUN_INTERVAL_MS", DEFAULT_RUN_INTERVAL_MS);
    boolean runOnce = "true".equalsIgnoreCase(System.getenv("HYDROCP_RUN_ONCE"));

    log.info("AppConfig loaded: httpPort={}, inputFile={}, outputDir={}, timeUnit={}, " +
        "runIntervalMs={}, runOnce={}",
      port, input, output, timeUnit.getValue(), interval, runOnce);
    return new AppConfig(port, input, output, timeUnit, interval, runOnce);
  }

  private static TimeUnit getEnvTimeUnit(String name, TimeUnit defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return TimeUnit.fromValue(value);
      } catch (IllegalArgumentException e) {
        log.warn("Invalid time unit for {}: {}, using default: {}", name, value, defaultValue.getValue());
      }
    }
    return defaultValue;
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long getEnvLong(String name, long defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
