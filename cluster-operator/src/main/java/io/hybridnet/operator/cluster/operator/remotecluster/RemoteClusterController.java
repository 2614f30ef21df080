/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

import io.hybridnet.api.networking.model.network.Network;
import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.api.networking.model.subnet.Subnet;
import io.hybridnet.operator.cluster.RemoteClusterOperatorConfig;
import io.hybridnet.operator.cluster.operator.remotecluster.session.LocalCluster;
import io.hybridnet.operator.cluster.operator.remotecluster.session.RemoteClusterSessionFactory;
import io.hybridnet.operator.cluster.operator.resource.ClusterUuidResolver;
import io.hybridnet.operator.cluster.operator.resource.EventRecorder;
import io.hybridnet.operator.cluster.operator.resource.RemoteClusterStore;
import io.hybridnet.operator.cluster.operator.resource.ResourceCache;
import io.hybridnet.operator.common.MetricsProvider;
import io.hybridnet.operator.common.RetryPolicy;
import io.hybridnet.operator.common.workqueue.ItemExponentialFailureRateLimiter;
import io.hybridnet.operator.common.workqueue.RateLimitingQueue;
import io.vertx.core.Vertx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Controller of the RemoteCluster resources. It wires the UUID lock, the session registry, the event pipeline, the
 * reconciler, the health checker and the overlay network ID cache together and drives their startup and shutdown.
 */
public class RemoteClusterController implements LocalCluster {
    private static final Logger LOGGER = LogManager.getLogger(RemoteClusterController.class);

    /**
     * Name of the controller used in events and metrics
     */
    public static final String CONTROLLER_NAME = "remotecluster";

    private final RemoteClusterOperatorConfig config;
    private final ClusterUuidResolver uuidResolver;
    private final ResourceCache<RemoteCluster> remoteClusterCache;
    private final ResourceCache<Network> networkCache;
    private final ResourceCache<Subnet> subnetCache;
    private final RemoteClusterStore store;

    private final RemoteClusterMetrics metrics;
    private final UuidLock uuidLock = new UuidLock();
    private final SessionRegistry registry = new SessionRegistry();
    private final OverlayNetIdCache overlayNetIdCache;
    private final RemoteClusterEventPipeline pipeline;
    private final RemoteClusterReconciler reconciler;
    private final RemoteClusterHealthChecker healthChecker;

    private volatile String uuid;
    private volatile boolean started = false;

    /**
     * Constructor
     *
     * @param config                Operator configuration
     * @param vertx                 Vert.x instance
     * @param uuidResolver          Resolver of the local cluster UUID
     * @param remoteClusterCache    Cache of the RemoteCluster resources
     * @param networkCache          Cache of the local Network resources
     * @param subnetCache           Cache of the local Subnet resources
     * @param store                 Store of the RemoteCluster resources
     * @param sessionFactory        Factory of sessions
     * @param recorder              Event recorder
     * @param metricsProvider       Metrics provider
     * @param clock                 Clock
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public RemoteClusterController(RemoteClusterOperatorConfig config, Vertx vertx, ClusterUuidResolver uuidResolver,
                                   ResourceCache<RemoteCluster> remoteClusterCache, ResourceCache<Network> networkCache,
                                   ResourceCache<Subnet> subnetCache, RemoteClusterStore store,
                                   RemoteClusterSessionFactory sessionFactory, EventRecorder recorder,
                                   MetricsProvider metricsProvider, Clock clock) {
        this.config = config;
        this.uuidResolver = uuidResolver;
        this.remoteClusterCache = remoteClusterCache;
        this.networkCache = networkCache;
        this.subnetCache = subnetCache;
        this.store = store;

        this.metrics = new RemoteClusterMetrics(metricsProvider, CONTROLLER_NAME);
        this.overlayNetIdCache = new OverlayNetIdCache(networkCache);

        RemoteClusterStatusUpdater statusUpdater = new RemoteClusterStatusUpdater(store, metrics, clock);
        this.pipeline = new RemoteClusterEventPipeline(vertx, uuidLock, registry, store, statusUpdater, recorder, metrics,
                RetryPolicy.DEFAULT_CONFLICT_RETRY, config.getEventQueueCapacity(), config.getEventThrottleMs());
        this.healthChecker = new RemoteClusterHealthChecker(vertx, store, registry, statusUpdater, config.getHealthCheckPeriodMs());

        RateLimitingQueue<String> queue = new RateLimitingQueue<>(CONTROLLER_NAME,
                new ItemExponentialFailureRateLimiter<>(config.getWorkQueueBaseDelayMs(), config.getWorkQueueMaxDelayMs()));
        this.reconciler = new RemoteClusterReconciler(store, registry, uuidLock, sessionFactory, this, pipeline, metrics,
                queue, config.getWorkQueueMaxRetries());
    }

    /**
     * Starts the controller. Blocks until the caches synced and all workers started.
     *
     * @throws ControllerStartupException   When the local UUID cannot be determined or the caches do not sync in time
     */
    public void start() throws ControllerStartupException {
        LOGGER.info("Starting {} controller", CONTROLLER_NAME);

        resolveUuid();

        remoteClusterCache.addEventHandler(reconciler);
        networkCache.addEventHandler(overlayNetIdCache.eventHandler());

        waitForCacheSync();

        overlayNetIdCache.sync();
        seedUuidLock();

        pipeline.start();
        reconciler.start();
        healthChecker.start();

        started = true;
        LOGGER.info("{} controller started for local cluster {}", CONTROLLER_NAME, uuid);
    }

    private void resolveUuid() throws ControllerStartupException {
        String resolved;
        try {
            resolved = uuidResolver.resolveUuid();
        } catch (Exception e) {
            throw new ControllerStartupException("Failed to determine the UUID of the local cluster", e);
        }

        if (resolved == null || resolved.isEmpty()) {
            throw new ControllerStartupException("The local cluster has no UUID");
        }

        uuid = resolved;
        LOGGER.info("Local cluster UUID is {}", uuid);
    }

    private void waitForCacheSync() throws ControllerStartupException {
        LOGGER.info("Waiting for informer caches to sync");

        CompletableFuture<Void> synced = CompletableFuture.allOf(
                remoteClusterCache.start().toCompletableFuture(),
                networkCache.start().toCompletableFuture(),
                subnetCache.start().toCompletableFuture());

        try {
            synced.get(config.getCacheSyncTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ControllerStartupException("Interrupted while waiting for informer caches to sync", e);
        } catch (ExecutionException e) {
            throw new ControllerStartupException("Failed to sync informer caches", e.getCause());
        } catch (TimeoutException e) {
            throw new ControllerStartupException("Informer caches did not sync in " + config.getCacheSyncTimeoutMs() + "ms", e);
        }
    }

    private void seedUuidLock() {
        for (RemoteCluster remoteCluster : store.list()) {
            String name = remoteCluster.getMetadata().getName();
            String claimed = remoteCluster.statusUuid();

            if (claimed == null || claimed.isEmpty() || claimed.equals(uuid)) {
                continue;
            }

            try {
                uuidLock.lockByOwner(claimed, name);
            } catch (UuidConflictException e) {
                LOGGER.warn("Remote cluster {} claims a UUID which is already owned: {}", name, e.getMessage());
            }
        }

        LOGGER.info("Seeded UUID lock with {} UUIDs", uuidLock.size());
    }

    /**
     * Stops the workers, closes all sessions and stops the caches
     *
     * @param timeoutMs     Maximal time to wait for each worker
     */
    public void stop(long timeoutMs) {
        LOGGER.info("Stopping {} controller", CONTROLLER_NAME);
        started = false;

        reconciler.stop(timeoutMs);

        try {
            healthChecker.stop()
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Health checks did not finish cleanly", e);
        }

        pipeline.close(timeoutMs);
        registry.closeAll();
        metrics.sessions().set(0);

        remoteClusterCache.stop();
        networkCache.stop();
        subnetCache.stop();

        LOGGER.info("{} controller stopped", CONTROLLER_NAME);
    }

    /**
     * @return  True once the controller started and until it is stopped
     */
    public boolean isStarted() {
        return started;
    }

    @Override
    public String uuid() {
        return uuid;
    }

    @Override
    public Long overlayNetId() {
        return overlayNetIdCache.get();
    }

    @Override
    public void lockUuid(String uuid, String clusterName) throws UuidConflictException {
        uuidLock.lockByOwner(uuid, clusterName);
    }

    @Override
    public List<Subnet> listSubnets() {
        return subnetCache.list();
    }

    UuidLock uuidLock() {
        return uuidLock;
    }

    SessionRegistry registry() {
        return registry;
    }

    RemoteClusterEventPipeline pipeline() {
        return pipeline;
    }

    RemoteClusterReconciler reconciler() {
        return reconciler;
    }
}
