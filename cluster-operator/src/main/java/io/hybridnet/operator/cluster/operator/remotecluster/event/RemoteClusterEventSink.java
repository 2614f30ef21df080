/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster.event;

/**
 * Accepts events for ordered processing
 */
@FunctionalInterface
public interface RemoteClusterEventSink {
    /**
     * Submits an event. Blocks while the queue is full.
     *
     * @param event     Event
     *
     * @return  True when the event was accepted, false when the sink is closed
     */
    boolean submit(RemoteClusterEvent event);
}
