package io.github.themoah.hydrocp;

import io.github.themoah.hydrocp.config.VertxConfig;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: creates Vert.x and deploys the {@link MainVerticle}.
 */
public class HydrocpLauncher {

  private static final Logger log = LoggerFactory.getLogger(HydrocpLauncher.class);

  public static void main(String[] args) {
    VertxOptions vertxOptions = VertxConfig.createVertxOptions();
    Vertx vertx = Vertx.vertx(vertxOptions);

    vertx.deployVerticle(new MainVerticle())
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });
  }
}
