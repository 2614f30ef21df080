/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster.session;

import io.hybridnet.api.networking.model.remotecluster.ConnConfig;

/**
 * Live management handle of one remote cluster
 */
public interface RemoteClusterSession extends AutoCloseable {
    /**
     * @return  Name of the remote cluster
     */
    String clusterName();

    /**
     * @return  Connection configuration the session was created from
     */
    ConnConfig connConfig();

    /**
     * Checks the health of the remote cluster. Blocks while talking to the peer.
     *
     * @return  Observed state and conditions
     */
    HealthSnapshot probe();

    /**
     * Releases the connection to the peer. Closing a closed session does nothing.
     */
    @Override
    void close();
}
