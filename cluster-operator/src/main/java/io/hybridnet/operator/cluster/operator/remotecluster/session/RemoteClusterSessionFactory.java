/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster.session;

import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.operator.cluster.operator.remotecluster.event.RemoteClusterEventSink;

/**
 * Creates sessions for remote clusters
 */
@FunctionalInterface
public interface RemoteClusterSessionFactory {
    /**
     * Creates a session. The session uses the event sink to report a new peer UUID, state changes and requests
     * for status updates.
     *
     * @param remoteCluster     Remote cluster
     * @param localCluster      View of the local cluster
     * @param eventSink         Sink for the events published by the session
     *
     * @return  New session
     *
     * @throws SessionCreationException     When the connection configuration is missing or invalid
     */
    RemoteClusterSession create(RemoteCluster remoteCluster, LocalCluster localCluster, RemoteClusterEventSink eventSink) throws SessionCreationException;
}
