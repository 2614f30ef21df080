/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.api.networking.model.remotecluster;

/**
 * Values of the state field in the RemoteCluster status
 */
public final class ClusterState {
    /**
     * The peer is reachable and all health checks passed
     */
    public static final String ONLINE = "Online";

    /**
     * The peer API server cannot be reached
     */
    public static final String OFFLINE = "Offline";

    /**
     * The peer is reachable but at least one health check failed
     */
    public static final String NOT_READY = "NotReady";

    private ClusterState() {
        // Constants only
    }
}
