/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

import io.hybridnet.operator.common.MetricsProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tags;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics of the remote cluster controller
 */
public class RemoteClusterMetrics {
    private static final String PREFIX = "remotecluster_";

    private final Counter reconciliations;
    private final Counter failedReconciliations;
    private final Counter droppedWorkItems;
    private final Counter processedEvents;
    private final Counter droppedEvents;
    private final Counter statusUpdates;
    private final Counter failedStatusUpdates;
    private final AtomicInteger sessions;

    /**
     * Constructor
     *
     * @param metricsProvider   Metrics provider
     * @param controllerName    Name of the controller used as a tag
     */
    public RemoteClusterMetrics(MetricsProvider metricsProvider, String controllerName) {
        Tags tags = Tags.of("controller", controllerName);

        this.reconciliations = metricsProvider.counter(PREFIX + "reconciliations", "Number of reconciliations", tags);
        this.failedReconciliations = metricsProvider.counter(PREFIX + "reconciliations_failed", "Number of failed reconciliations", tags);
        this.droppedWorkItems = metricsProvider.counter(PREFIX + "workqueue_dropped", "Number of work items dropped after reaching the retry limit", tags);
        this.processedEvents = metricsProvider.counter(PREFIX + "events_processed", "Number of processed pipeline events", tags);
        this.droppedEvents = metricsProvider.counter(PREFIX + "events_dropped", "Number of malformed, conflicting or rejected pipeline events", tags);
        this.statusUpdates = metricsProvider.counter(PREFIX + "status_updates", "Number of status updates of remote clusters", tags);
        this.failedStatusUpdates = metricsProvider.counter(PREFIX + "status_updates_failed", "Number of failed status updates of remote clusters", tags);
        this.sessions = metricsProvider.gauge(PREFIX + "sessions", "Number of live remote cluster sessions", tags);
    }

    public Counter reconciliations() {
        return reconciliations;
    }

    public Counter failedReconciliations() {
        return failedReconciliations;
    }

    public Counter droppedWorkItems() {
        return droppedWorkItems;
    }

    public Counter processedEvents() {
        return processedEvents;
    }

    public Counter droppedEvents() {
        return droppedEvents;
    }

    public Counter statusUpdates() {
        return statusUpdates;
    }

    public Counter failedStatusUpdates() {
        return failedStatusUpdates;
    }

    public AtomicInteger sessions() {
        return sessions;
    }
}
