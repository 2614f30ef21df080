/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster;

import io.vertx.core.Vertx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runs the registered shutdown actions in the reverse order of their registration
 */
public class ShutdownHook implements Runnable {
    private static final Logger LOGGER = LogManager.getLogger(ShutdownHook.class);

    private final Deque<Runnable> actions = new ConcurrentLinkedDeque<>();

    /**
     * Registers a shutdown action
     *
     * @param action    Action to run during shutdown
     */
    public void register(Runnable action) {
        actions.push(action);
    }

    @Override
    public void run() {
        LOGGER.info("Shutdown hook started");

        Runnable action;
        while ((action = actions.poll()) != null) {
            try {
                action.run();
            } catch (RuntimeException e) {
                LOGGER.error("Shutdown action failed", e);
            }
        }

        LOGGER.info("Shutdown hook completed");
    }

    /**
     * Closes the Vert.x instance and waits for it
     *
     * @param vertx         Vert.x instance
     * @param timeoutMs     Maximal time to wait
     */
    public static void shutdownVertx(Vertx vertx, long timeoutMs) {
        LOGGER.info("Shutting down Vert.x");
        CountDownLatch latch = new CountDownLatch(1);

        vertx.close().onComplete(ar -> {
            if (ar.failed()) {
                LOGGER.error("Vert.x failed to shut down", ar.cause());
            }
            latch.countDown();
        });

        await(latch, timeoutMs, "Vert.x shutdown");
    }

    /**
     * Undeploys a verticle and waits for it
     *
     * @param vertx         Vert.x instance
     * @param deploymentId  Deployment ID of the verticle
     * @param timeoutMs     Maximal time to wait
     */
    public static void undeployVertxVerticle(Vertx vertx, String deploymentId, long timeoutMs) {
        LOGGER.info("Undeploying verticle {}", deploymentId);
        CountDownLatch latch = new CountDownLatch(1);

        vertx.undeploy(deploymentId).onComplete(ar -> {
            if (ar.failed()) {
                LOGGER.error("Failed to undeploy verticle {}", deploymentId, ar.cause());
            }
            latch.countDown();
        });

        await(latch, timeoutMs, "Undeployment of verticle " + deploymentId);
    }

    private static void await(CountDownLatch latch, long timeoutMs, String what) {
        try {
            if (!latch.await(timeoutMs, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("{} did not complete in {}ms", what, timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for {}", what);
        }
    }
}
