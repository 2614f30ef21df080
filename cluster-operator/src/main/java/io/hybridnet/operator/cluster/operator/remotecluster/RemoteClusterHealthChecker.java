/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.operator.cluster.operator.remotecluster.session.RemoteClusterSession;
import io.hybridnet.operator.cluster.operator.resource.RemoteClusterStore;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Periodically refreshes the status of every remote cluster with a live session. Each round probes all sessions in
 * parallel on Vert.x worker threads and the next round is scheduled only once all probes of the previous round
 * finished, so a remote cluster is never probed twice at the same time by this checker.
 */
public class RemoteClusterHealthChecker {
    private static final Logger LOGGER = LogManager.getLogger(RemoteClusterHealthChecker.class);

    /**
     * Period used when the configured period is not positive
     */
    public static final long DEFAULT_PERIOD_MS = 30_000L;

    private final Vertx vertx;
    private final RemoteClusterStore store;
    private final SessionRegistry registry;
    private final RemoteClusterStatusUpdater statusUpdater;
    private final long periodMs;

    private boolean running = false;
    private long timerId = -1L;
    private Future<Void> currentRound = Future.succeededFuture();

    /**
     * Constructor
     *
     * @param vertx         Vert.x instance
     * @param store         Store of remote clusters
     * @param registry      Session registry
     * @param statusUpdater Status updater
     * @param periodMs      Delay between the end of a round and the start of the next one
     */
    public RemoteClusterHealthChecker(Vertx vertx, RemoteClusterStore store, SessionRegistry registry,
                                      RemoteClusterStatusUpdater statusUpdater, long periodMs) {
        this.vertx = vertx;
        this.store = store;
        this.registry = registry;
        this.statusUpdater = statusUpdater;
        this.periodMs = periodMs > 0 ? periodMs : DEFAULT_PERIOD_MS;
    }

    /**
     * Starts the periodic checks. The first round starts immediately.
     */
    public synchronized void start() {
        if (running) {
            return;
        }

        LOGGER.info("Starting remote cluster health checks every {}ms", periodMs);
        running = true;
        currentRound = checkAll();
    }

    /**
     * Stops the periodic checks
     *
     * @return  Future which completes when the round in progress finished
     */
    public synchronized Future<Void> stop() {
        running = false;

        if (timerId != -1L) {
            vertx.cancelTimer(timerId);
            timerId = -1L;
        }

        return currentRound;
    }

    /**
     * Runs one round of health checks
     *
     * @return  Future which completes when all remote clusters of this round were checked. It never fails.
     */
    synchronized Future<Void> checkAll() {
        List<RemoteCluster> remoteClusters;
        try {
            remoteClusters = store.list();
        } catch (RuntimeException e) {
            LOGGER.error("Failed to list remote clusters for health checks", e);
            remoteClusters = List.of();
        }

        List<Future<Boolean>> checks = new ArrayList<>();
        for (RemoteCluster remoteCluster : remoteClusters) {
            RemoteClusterSession session = registry.get(remoteCluster.getMetadata().getName());

            if (session != null) {
                checks.add(vertx.executeBlocking(() -> statusUpdater.update(remoteCluster, session), false));
            }
        }

        LOGGER.debug("Checking health of {} remote clusters", checks.size());

        Future<Void> round = Future.join(checks)
                .<Void>mapEmpty()
                .otherwiseEmpty();

        round.onComplete(ignored -> scheduleNext());
        return round;
    }

    private synchronized void scheduleNext() {
        if (running) {
            timerId = vertx.setTimer(periodMs, id -> runScheduledRound());
        }
    }

    private synchronized void runScheduledRound() {
        timerId = -1L;

        if (running) {
            currentRound = checkAll();
        }
    }

    /**
     * @return  Period between rounds
     */
    public long getPeriodMs() {
        return periodMs;
    }
}
