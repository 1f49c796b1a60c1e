package io.github.themoah.hydrocp.config;

import io.vertx.core.VertxOptions;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x configuration.
 * The default worker pool size can be overridden via VERTX_WORKER_POOL_SIZE; the analysis
 * itself runs on its own named pool sized by HYDROCP_WORKER_POOL_SIZE.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_WORKER_POOL_SIZE = "VERTX_WORKER_POOL_SIZE";

  // A chunk of pairs may block a worker for minutes
  private static final long MAX_WORKER_EXECUTE_TIME_SECONDS = 600;

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    options.setMaxWorkerExecuteTime(MAX_WORKER_EXECUTE_TIME_SECONDS);
    options.setMaxWorkerExecuteTimeUnit(TimeUnit.SECONDS);

    Integer workerPoolSize = workerPoolSize();
    if (workerPoolSize != null) {
      log.info("Using Vert.x worker pool size {}", workerPoolSize);
      options.setWorkerPoolSize(workerPoolSize);
    }
    return options;
  }

  static Integer workerPoolSize() {
    String value = System.getenv(ENV_WORKER_POOL_SIZE);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      int size = Integer.parseInt(value);
      if (size > 0) {
        return size;
      }
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using Vert.x default", ENV_WORKER_POOL_SIZE, value);
      return null;
    }
    log.warn("{} must be > 0, using Vert.x default", ENV_WORKER_POOL_SIZE);
    return null;
  }
}
