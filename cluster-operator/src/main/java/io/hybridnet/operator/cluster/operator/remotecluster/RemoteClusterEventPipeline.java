/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.api.networking.model.remotecluster.RemoteClusterStatus;
import io.hybridnet.operator.cluster.operator.remotecluster.event.EventBody;
import io.hybridnet.operator.cluster.operator.remotecluster.event.RemoteClusterEvent;
import io.hybridnet.operator.cluster.operator.remotecluster.event.RemoteClusterEventSink;
import io.hybridnet.operator.cluster.operator.remotecluster.session.RemoteClusterSession;
import io.hybridnet.operator.cluster.operator.resource.EventRecorder;
import io.hybridnet.operator.cluster.operator.resource.RemoteClusterStore;
import io.hybridnet.operator.common.RetryOnConflict;
import io.hybridnet.operator.common.RetryPolicy;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ordered pipeline of side effects requested by sessions and by the reconciler. A single consumer thread processes
 * the events one at a time in the order they were submitted, so UUID claims, status patches and recorded events
 * never race each other.
 */
public class RemoteClusterEventPipeline implements RemoteClusterEventSink {
    private static final Logger LOGGER = LogManager.getLogger(RemoteClusterEventPipeline.class);

    /**
     * Default number of events which can wait for processing
     */
    public static final int DEFAULT_CAPACITY = 10;

    /**
     * Default pause after each processed event
     */
    public static final long DEFAULT_THROTTLE_MS = 100L;

    private static final long POLL_TIMEOUT_MS = 100L;

    private final Vertx vertx;
    private final UuidLock uuidLock;
    private final SessionRegistry registry;
    private final RemoteClusterStore store;
    private final RemoteClusterStatusUpdater statusUpdater;
    private final EventRecorder recorder;
    private final RemoteClusterMetrics metrics;
    private final RetryPolicy retryPolicy;
    private final long throttleMs;

    private final BlockingQueue<RemoteClusterEvent> queue;
    private final Set<Future<Boolean>> statusUpdates = ConcurrentHashMap.newKeySet();
    private final Thread consumer;
    private volatile boolean open = true;

    /**
     * Constructor
     *
     * @param vertx         Vert.x instance used to run status updates
     * @param uuidLock      UUID lock
     * @param registry      Session registry
     * @param store         Store of remote clusters
     * @param statusUpdater Status updater
     * @param recorder      Event recorder
     * @param metrics       Metrics
     * @param retryPolicy   Retry policy for conflicting UUID updates
     * @param capacity      Number of events which can wait for processing
     * @param throttleMs    Pause after each processed event
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public RemoteClusterEventPipeline(Vertx vertx, UuidLock uuidLock, SessionRegistry registry, RemoteClusterStore store,
                                      RemoteClusterStatusUpdater statusUpdater, EventRecorder recorder,
                                      RemoteClusterMetrics metrics, RetryPolicy retryPolicy, int capacity, long throttleMs) {
        this.vertx = vertx;
        this.uuidLock = uuidLock;
        this.registry = registry;
        this.store = store;
        this.statusUpdater = statusUpdater;
        this.recorder = recorder;
        this.metrics = metrics;
        this.retryPolicy = retryPolicy;
        this.throttleMs = Math.max(0L, throttleMs);
        this.queue = new ArrayBlockingQueue<>(capacity > 0 ? capacity : DEFAULT_CAPACITY);
        this.consumer = new Thread(this::consume, "remotecluster-event-pipeline");
        this.consumer.setDaemon(true);
    }

    /**
     * Starts the consumer thread. Events submitted before are processed once it runs.
     */
    public void start() {
        LOGGER.info("Starting remote cluster event pipeline");
        consumer.start();
    }

    @Override
    public boolean submit(RemoteClusterEvent event) {
        try {
            while (open) {
                if (queue.offer(event, POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        LOGGER.warn("Event pipeline is closed, discarding {}", event);
        metrics.droppedEvents().increment();
        return false;
    }

    private void consume() {
        try {
            while (true) {
                RemoteClusterEvent event = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);

                if (event == null) {
                    if (!open) {
                        break;
                    }
                    continue;
                }

                try {
                    if (process(event)) {
                        metrics.processedEvents().increment();
                    } else {
                        metrics.droppedEvents().increment();
                    }
                } catch (RuntimeException e) {
                    LOGGER.error("Unexpected error while processing {}", event, e);
                    metrics.droppedEvents().increment();
                }

                if (throttleMs > 0) {
                    Thread.sleep(throttleMs);
                }
            }
        } catch (InterruptedException e) {
            LOGGER.warn("Event pipeline consumer was interrupted");
            Thread.currentThread().interrupt();
        }

        LOGGER.info("Remote cluster event pipeline stopped");
    }

    /**
     * Processes one event
     *
     * @param event     Event
     *
     * @return  True when the event was processed, false when it was dropped
     */
    boolean process(RemoteClusterEvent event) {
        return switch (event.getType()) {
            case REFRESH_UUID -> refreshUuid(event.getUuid(), event.getClusterName());
            case UPDATE_STATUS -> updateStatus(event.getClusterName());
            case RECORD_EVENT -> recordEvent(event.getClusterName(), event.getBody());
        };
    }

    private boolean refreshUuid(String uuid, String clusterName) {
        if (uuid == null || uuid.isEmpty()) {
            LOGGER.warn("Dropping UUID refresh of remote cluster {} without UUID", clusterName);
            return false;
        } else if (clusterName == null || clusterName.isEmpty()) {
            LOGGER.warn("Dropping UUID refresh of UUID {} without cluster name", uuid);
            return false;
        }

        if (lookup(clusterName) == null) {
            LOGGER.warn("Dropping UUID refresh of remote cluster {} which does not exist", clusterName);
            return false;
        }

        try {
            uuidLock.lockByOwner(uuid, clusterName);
        } catch (UuidConflictException e) {
            LOGGER.error("Dropping UUID refresh of remote cluster {}: {}", clusterName, e.getMessage());
            return false;
        }

        RemoteClusterStatus patch = new RemoteClusterStatus();
        patch.setUuid(uuid);

        try {
            RetryOnConflict.retry(retryPolicy, "UUID update of remote cluster " + clusterName, () -> {
                store.patchStatus(clusterName, patch);
                return null;
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while updating UUID of remote cluster {}", clusterName);
            return false;
        } catch (Exception e) {
            LOGGER.error("Failed to update UUID of remote cluster {} to {}", clusterName, uuid, e);
            return false;
        }

        LOGGER.info("Updated UUID of remote cluster {} to {}", clusterName, uuid);
        return true;
    }

    private boolean updateStatus(String clusterName) {
        if (clusterName == null || clusterName.isEmpty()) {
            LOGGER.warn("Dropping status update without cluster name");
            return false;
        }

        RemoteCluster remoteCluster = lookup(clusterName);
        if (remoteCluster == null) {
            LOGGER.warn("Dropping status update of remote cluster {} which does not exist", clusterName);
            return false;
        }

        RemoteClusterSession session = registry.get(clusterName);
        if (session == null) {
            LOGGER.debug("Remote cluster {} has no session, skipping status update", clusterName);
            return true;
        }

        Future<Boolean> update = vertx.executeBlocking(() -> statusUpdater.update(remoteCluster, session), false);
        statusUpdates.add(update);
        update.onComplete(ignored -> statusUpdates.remove(update));

        LOGGER.debug("Triggered status update of remote cluster {}", clusterName);
        return true;
    }

    private boolean recordEvent(String clusterName, EventBody body) {
        if (clusterName == null || clusterName.isEmpty() || body == null) {
            LOGGER.warn("Dropping malformed event record for remote cluster {}", clusterName);
            return false;
        }

        RemoteCluster remoteCluster = lookup(clusterName);
        if (remoteCluster == null) {
            LOGGER.warn("Dropping event {} of remote cluster {} which does not exist", body.reason(), clusterName);
            return false;
        }

        recorder.event(remoteCluster, body.type(), body.reason(), body.message());
        LOGGER.debug("Recorded event {} for remote cluster {}", body.reason(), clusterName);
        return true;
    }

    private RemoteCluster lookup(String clusterName) {
        try {
            return store.get(clusterName);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to get remote cluster {}: {}", clusterName, e.getMessage());
            return null;
        }
    }

    /**
     * @return  Number of events waiting for processing
     */
    public int pending() {
        return queue.size();
    }

    /**
     * Stops accepting new events, waits until the queued events are processed and until the triggered status updates
     * complete
     *
     * @param timeoutMs     Maximal time to wait for each of the two phases
     */
    public void close(long timeoutMs) {
        LOGGER.info("Closing remote cluster event pipeline with {} pending events", queue.size());
        open = false;

        try {
            if (consumer.isAlive()) {
                consumer.join(timeoutMs);

                if (consumer.isAlive()) {
                    LOGGER.warn("Event pipeline did not drain in {}ms, interrupting it", timeoutMs);
                    consumer.interrupt();
                }
            }

            if (!queue.isEmpty()) {
                LOGGER.warn("Discarding {} unprocessed events", queue.size());
                queue.clear();
            }

            Future.join(new ArrayList<>(statusUpdates))
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while closing the event pipeline");
        } catch (ExecutionException e) {
            LOGGER.warn("Some status updates failed while closing the event pipeline", e.getCause());
        } catch (TimeoutException e) {
            LOGGER.warn("Status updates did not complete in {}ms", timeoutMs);
        }
    }
}
