/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.leaderelection;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.extended.leaderelection.LeaderCallbacks;
import io.fabric8.kubernetes.client.extended.leaderelection.LeaderElectionConfig;
import io.fabric8.kubernetes.client.extended.leaderelection.LeaderElectionConfigBuilder;
import io.fabric8.kubernetes.client.extended.leaderelection.LeaderElector;
import io.fabric8.kubernetes.client.extended.leaderelection.resourcelock.LeaseLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Runs the leader election based on a Lease resource
 */
public class LeaderElectionManager {
    private static final Logger LOGGER = LogManager.getLogger(LeaderElectionManager.class);

    private final LeaderElectionManagerConfig config;
    private final LeaderElector leaderElector;
    private volatile boolean shuttingDown = false;
    private CompletableFuture<?> leaderElectorFuture;

    /**
     * Constructor
     *
     * @param client                    Kubernetes client
     * @param config                    Leader election configuration
     * @param startLeadershipCallback   Called when this replica becomes the leader
     * @param stopLeadershipCallback    Called when this replica stops being the leader, the argument is true during shutdown
     * @param leadershipChangeCallback  Called with the identity of every new leader
     */
    public LeaderElectionManager(KubernetesClient client, LeaderElectionManagerConfig config,
                                 Runnable startLeadershipCallback, Consumer<Boolean> stopLeadershipCallback,
                                 Consumer<String> leadershipChangeCallback) {
        this.config = config;

        LeaderElectionConfig leaderElectionConfig = new LeaderElectionConfigBuilder()
                .withName(config.leaseName())
                .withLock(new LeaseLock(config.namespace(), config.leaseName(), config.identity()))
                .withLeaseDuration(config.leaseDuration())
                .withRenewDeadline(config.renewDeadline())
                .withRetryPeriod(config.retryPeriod())
                .withReleaseOnCancel(true)
                .withLeaderCallbacks(new LeaderCallbacks(
                        startLeadershipCallback,
                        () -> stopLeadershipCallback.accept(shuttingDown),
                        leadershipChangeCallback))
                .build();

        this.leaderElector = client.leaderElector().withConfig(leaderElectionConfig).build();
    }

    /**
     * Starts the leader election
     */
    public void start() {
        LOGGER.info("Starting leader election as {} using Lease {}/{}", config.identity(), config.namespace(), config.leaseName());
        leaderElectorFuture = leaderElector.start();
    }

    /**
     * Stops the leader election and releases the lease when this replica holds it
     */
    public void stop() {
        LOGGER.info("Stopping leader election");
        shuttingDown = true;

        if (leaderElectorFuture != null) {
            leaderElectorFuture.cancel(true);
        }
    }
}
