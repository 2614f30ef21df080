/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.operator.cluster.operator.remotecluster.event.RemoteClusterEvent;
import io.hybridnet.operator.cluster.operator.remotecluster.event.RemoteClusterEventSink;
import io.hybridnet.operator.cluster.operator.remotecluster.session.LocalCluster;
import io.hybridnet.operator.cluster.operator.remotecluster.session.RemoteClusterSession;
import io.hybridnet.operator.cluster.operator.remotecluster.session.RemoteClusterSessionFactory;
import io.hybridnet.operator.cluster.operator.remotecluster.session.SessionCreationException;
import io.hybridnet.operator.cluster.operator.resource.EventRecorder;
import io.hybridnet.operator.cluster.operator.resource.RemoteClusterStore;
import io.hybridnet.operator.common.workqueue.RateLimitingQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Set;

/**
 * Keeps the sessions and UUID claims in line with the RemoteCluster resources. Informer notifications only enqueue
 * the name of the remote cluster. The worker always reconciles against the current content of the cache, so the
 * order of the notifications does not matter.
 */
public class RemoteClusterReconciler implements ResourceEventHandler<RemoteCluster> {
    private static final Logger LOGGER = LogManager.getLogger(RemoteClusterReconciler.class);

    private final RemoteClusterStore store;
    private final SessionRegistry registry;
    private final UuidLock uuidLock;
    private final RemoteClusterSessionFactory sessionFactory;
    private final LocalCluster localCluster;
    private final RemoteClusterEventSink eventSink;
    private final RemoteClusterMetrics metrics;
    private final RateLimitingQueue<String> queue;
    private final int maxRetries;
    private final Thread worker;

    /**
     * Constructor
     *
     * @param store             Store of remote clusters
     * @param registry          Session registry
     * @param uuidLock          UUID lock
     * @param sessionFactory    Factory of new sessions
     * @param localCluster      View of the local cluster
     * @param eventSink         Event pipeline
     * @param metrics           Metrics
     * @param queue             Work queue of remote cluster names
     * @param maxRetries        Number of rate limited retries before a failing remote cluster is dropped
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public RemoteClusterReconciler(RemoteClusterStore store, SessionRegistry registry, UuidLock uuidLock,
                                   RemoteClusterSessionFactory sessionFactory, LocalCluster localCluster,
                                   RemoteClusterEventSink eventSink, RemoteClusterMetrics metrics,
                                   RateLimitingQueue<String> queue, int maxRetries) {
        this.store = store;
        this.registry = registry;
        this.uuidLock = uuidLock;
        this.sessionFactory = sessionFactory;
        this.localCluster = localCluster;
        this.eventSink = eventSink;
        this.metrics = metrics;
        this.queue = queue;
        this.maxRetries = maxRetries;
        this.worker = new Thread(this::runWorker, "remotecluster-reconciler");
        this.worker.setDaemon(true);
    }

    /**
     * Decides if a notification about the remote cluster should be handled at all
     *
     * @param remoteCluster     Remote cluster
     *
     * @return  False for resources without a name and for resources describing the local cluster
     */
    boolean accept(RemoteCluster remoteCluster) {
        if (remoteCluster == null || remoteCluster.getMetadata() == null
                || remoteCluster.getMetadata().getName() == null || remoteCluster.getMetadata().getName().isEmpty()) {
            LOGGER.debug("Ignoring remote cluster without name");
            return false;
        }

        String uuid = remoteCluster.statusUuid();
        if (uuid != null && uuid.equals(localCluster.uuid())) {
            LOGGER.warn("Ignoring remote cluster {} which has the UUID {} of the local cluster", remoteCluster.getMetadata().getName(), uuid);
            return false;
        }

        return true;
    }

    /**
     * Decides if an update needs a reconciliation. Status changes other than the UUID do not.
     *
     * @param oldCluster    Previous version
     * @param newCluster    Current version
     *
     * @return  True when the update should be reconciled
     */
    static boolean needsReconciliation(RemoteCluster oldCluster, RemoteCluster newCluster) {
        if (Objects.equals(oldCluster.getMetadata().getResourceVersion(), newCluster.getMetadata().getResourceVersion())) {
            // Periodic resync
            return true;
        }

        return !Objects.equals(oldCluster.getMetadata().getGeneration(), newCluster.getMetadata().getGeneration())
                || !Objects.equals(oldCluster.getMetadata().getDeletionTimestamp(), newCluster.getMetadata().getDeletionTimestamp())
                || !Objects.equals(oldCluster.statusUuid(), newCluster.statusUuid());
    }

    @Override
    public void onAdd(RemoteCluster remoteCluster) {
        if (accept(remoteCluster)) {
            enqueue(remoteCluster, "added");
        }
    }

    @Override
    public void onUpdate(RemoteCluster oldCluster, RemoteCluster newCluster) {
        if (accept(newCluster) && needsReconciliation(oldCluster, newCluster)) {
            enqueue(newCluster, "modified");
        }
    }

    @Override
    public void onDelete(RemoteCluster remoteCluster, boolean deletedFinalStateUnknown) {
        if (accept(remoteCluster)) {
            enqueue(remoteCluster, "deleted");
        }
    }

    private void enqueue(RemoteCluster remoteCluster, String action) {
        LOGGER.debug("Remote cluster {} was {}", remoteCluster.getMetadata().getName(), action);
        queue.add(remoteCluster.getMetadata().getName());
    }

    /**
     * Starts the worker thread
     */
    public void start() {
        LOGGER.info("Starting remote cluster reconciler");
        worker.start();
    }

    /**
     * Shuts the work queue down and waits for the worker to finish the remote cluster it is working on
     *
     * @param timeoutMs     Maximal time to wait for the worker
     */
    public void stop(long timeoutMs) {
        LOGGER.info("Stopping remote cluster reconciler");
        queue.shutDown();

        if (worker.isAlive()) {
            try {
                worker.join(timeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }

            if (worker.isAlive()) {
                LOGGER.warn("Remote cluster reconciler did not stop in {}ms", timeoutMs);
                worker.interrupt();
            }
        }
    }

    private void runWorker() {
        while (processNextItem()) {
            // Loop until the queue is shut down
        }

        LOGGER.info("Remote cluster reconciler stopped");
    }

    /**
     * Takes one remote cluster from the queue and reconciles it
     *
     * @return  False once the queue was shut down
     */
    boolean processNextItem() {
        String name;
        try {
            name = queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }

        if (name == null) {
            return false;
        }

        try {
            reconcile(name);
            queue.forget(name);
        } catch (Exception e) {
            handleError(name, e);
        } finally {
            queue.done(name);
        }

        return true;
    }

    private void handleError(String name, Exception e) {
        metrics.failedReconciliations().increment();

        if (queue.numRequeues(name) < maxRetries) {
            LOGGER.warn("Failed to reconcile remote cluster {}, will retry: {}", name, e.getMessage());
            queue.addRateLimited(name);
        } else {
            LOGGER.error("Dropping remote cluster {} from the queue after {} retries", name, maxRetries, e);
            metrics.droppedWorkItems().increment();
            queue.forget(name);
        }
    }

    /**
     * Reconciles the session and the UUID claim of one remote cluster
     *
     * @param name  Name of the remote cluster
     *
     * @throws UuidConflictException    When the UUID of the remote cluster is owned by another remote cluster
     * @throws SessionCreationException When the session cannot be created
     */
    void reconcile(String name) throws UuidConflictException, SessionCreationException {
        metrics.reconciliations().increment();

        try {
            RemoteCluster remoteCluster = store.get(name);

            if (remoteCluster == null || remoteCluster.isMarkedForDeletion()) {
                boolean closed = registry.delete(name);
                Set<String> released = uuidLock.unlockByOwner(name);

                if (closed || !released.isEmpty()) {
                    LOGGER.info("Remote cluster {} was deleted, closed session: {}, released UUIDs: {}", name, closed, released);
                }

                return;
            }

            RemoteClusterSession session = registry.get(name);

            if (session == null) {
                claimUuid(remoteCluster);

                registry.set(name, sessionFactory.create(remoteCluster, localCluster, eventSink));
                LOGGER.info("Created session of remote cluster {}", name);
                eventSink.submit(RemoteClusterEvent.updateStatus(name));
            } else {
                claimUuid(remoteCluster);

                if (!Objects.equals(session.connConfig(), remoteCluster.connConfig())) {
                    registry.delete(name);

                    registry.set(name, sessionFactory.create(remoteCluster, localCluster, eventSink));
                    LOGGER.info("Connection configuration of remote cluster {} changed, replaced its session", name);
                    eventSink.submit(RemoteClusterEvent.updateStatus(name));
                } else {
                    LOGGER.debug("Remote cluster {} is up to date", name);
                }
            }
        } finally {
            metrics.sessions().set(registry.size());
        }
    }

    private void claimUuid(RemoteCluster remoteCluster) throws UuidConflictException {
        String name = remoteCluster.getMetadata().getName();
        String uuid = remoteCluster.statusUuid();

        if (uuid == null || uuid.isEmpty()) {
            return;
        }

        try {
            uuidLock.lockByOwner(uuid, name);
        } catch (UuidConflictException e) {
            if (queue.numRequeues(name) == 0) {
                eventSink.submit(RemoteClusterEvent.recordEvent(name, EventRecorder.WARNING, "UUIDConflict", e.getMessage()));
            }

            throw e;
        }
    }

    /**
     * @return  Number of remote clusters waiting in the queue
     */
    public int queueLength() {
        return queue.len();
    }
}
