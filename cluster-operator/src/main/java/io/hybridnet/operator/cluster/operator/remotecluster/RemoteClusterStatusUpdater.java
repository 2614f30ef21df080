/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

import io.hybridnet.api.networking.model.common.Condition;
import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.api.networking.model.remotecluster.RemoteClusterStatus;
import io.hybridnet.operator.cluster.operator.remotecluster.session.HealthSnapshot;
import io.hybridnet.operator.cluster.operator.remotecluster.session.RemoteClusterSession;
import io.hybridnet.operator.cluster.operator.resource.RemoteClusterStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Probes the session of a remote cluster and writes the result into the state and conditions of its status. The
 * UUID in the status is never written here.
 */
public class RemoteClusterStatusUpdater {
    private static final Logger LOGGER = LogManager.getLogger(RemoteClusterStatusUpdater.class);

    private final RemoteClusterStore store;
    private final RemoteClusterMetrics metrics;
    private final Clock clock;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * Constructor
     *
     * @param store     Store of remote clusters
     * @param metrics   Metrics
     * @param clock     Clock used for the transition times of conditions
     */
    public RemoteClusterStatusUpdater(RemoteClusterStore store, RemoteClusterMetrics metrics, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Probes the session and patches the status when the state or a condition changed. Blocks while the session
     * talks to the peer. A second call for the same remote cluster while a probe is running returns immediately.
     *
     * @param remoteCluster     Remote cluster
     * @param session           Its session
     *
     * @return  True when the status was patched
     */
    public boolean update(RemoteCluster remoteCluster, RemoteClusterSession session) {
        String name = remoteCluster.getMetadata().getName();

        if (!inFlight.add(name)) {
            LOGGER.debug("Status update of remote cluster {} is already in progress", name);
            return false;
        }

        try {
            HealthSnapshot snapshot;
            try {
                snapshot = session.probe();
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to probe remote cluster {}", name, e);
                metrics.failedStatusUpdates().increment();
                return false;
            }

            RemoteClusterStatus current = remoteCluster.getStatus();
            List<Condition> currentConditions = current != null ? current.getConditions() : null;
            String currentState = current != null ? current.getState() : null;
            List<Condition> conditions = mergeConditions(currentConditions, snapshot.conditions(), now());

            if (Objects.equals(currentState, snapshot.state()) && Objects.equals(currentConditions, conditions)) {
                LOGGER.debug("Status of remote cluster {} is up to date", name);
                return false;
            }

            RemoteClusterStatus patch = new RemoteClusterStatus();
            patch.setState(snapshot.state());
            patch.setConditions(conditions);

            try {
                store.patchStatus(name, patch);
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to update status of remote cluster {}", name, e);
                metrics.failedStatusUpdates().increment();
                return false;
            }

            LOGGER.debug("Updated status of remote cluster {} to {}", name, snapshot.state());
            metrics.statusUpdates().increment();
            return true;
        } finally {
            inFlight.remove(name);
        }
    }

    /**
     * Merges the observed conditions with the current ones. The transition time of a condition is kept while its
     * status does not change.
     *
     * @param current       Conditions currently in the status, may be null
     * @param observed      Conditions observed by the probe
     * @param now           Timestamp used for conditions which changed their status
     *
     * @return  New list of conditions
     */
    static List<Condition> mergeConditions(List<Condition> current, List<Condition> observed, String now) {
        List<Condition> merged = new ArrayList<>(observed.size());

        for (Condition condition : observed) {
            Condition previous = current == null ? null : current.stream()
                    .filter(c -> Objects.equals(c.getType(), condition.getType()))
                    .findFirst()
                    .orElse(null);

            Condition copy = new Condition(condition.getType(), condition.getStatus(), condition.getReason(), condition.getMessage());
            if (previous != null && Objects.equals(previous.getStatus(), condition.getStatus()) && previous.getLastTransitionTime() != null) {
                copy.setLastTransitionTime(previous.getLastTransitionTime());
            } else {
                copy.setLastTransitionTime(now);
            }

            merged.add(copy);
        }

        return merged;
    }

    private String now() {
        return DateTimeFormatter.ISO_INSTANT.format(ZonedDateTime.now(clock));
    }
}
