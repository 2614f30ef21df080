/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster;

import io.hybridnet.operator.cluster.operator.remotecluster.RemoteClusterController;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Verticle running the remote cluster controller. The controller blocks while it starts and stops, so both run on a
 * worker thread.
 */
public class RemoteClusterOperator extends AbstractVerticle {
    private static final Logger LOGGER = LogManager.getLogger(RemoteClusterOperator.class);

    private final RemoteClusterController controller;
    private final long shutdownTimeoutMs;

    /**
     * Constructor
     *
     * @param controller        Remote cluster controller
     * @param shutdownTimeoutMs Maximal time to wait for each worker of the controller during shutdown
     */
    public RemoteClusterOperator(RemoteClusterController controller, long shutdownTimeoutMs) {
        this.controller = controller;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    @Override
    public void start(Promise<Void> start) {
        LOGGER.info("Starting RemoteClusterOperator");

        vertx.<Void>executeBlocking(() -> {
            controller.start();
            return null;
        }, false).onComplete(res -> {
            if (res.succeeded()) {
                LOGGER.info("RemoteClusterOperator is now ready");
                start.complete();
            } else {
                LOGGER.error("RemoteClusterOperator failed to start", res.cause());
                start.fail(res.cause());
            }
        });
    }

    @Override
    public void stop(Promise<Void> stop) {
        LOGGER.info("Stopping RemoteClusterOperator");

        vertx.<Void>executeBlocking(() -> {
            controller.stop(shutdownTimeoutMs);
            return null;
        }, false).onComplete(res -> {
            if (res.failed()) {
                LOGGER.warn("RemoteClusterOperator did not stop cleanly", res.cause());
            }
            stop.complete();
        });
    }
}
