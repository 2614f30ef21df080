/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster.session;

import io.hybridnet.api.networking.model.subnet.Subnet;
import io.hybridnet.operator.cluster.operator.remotecluster.UuidConflictException;

import java.util.List;

/**
 * View of the local cluster handed to the sessions
 */
public interface LocalCluster {
    /**
     * @return  UUID of the local cluster
     */
    String uuid();

    /**
     * @return  ID of the local overlay network or null when there is none
     */
    Long overlayNetId();

    /**
     * Claims a peer UUID for a remote cluster
     *
     * @param uuid          Peer UUID
     * @param clusterName   Name of the remote cluster
     *
     * @throws UuidConflictException    When another remote cluster owns the UUID
     */
    void lockUuid(String uuid, String clusterName) throws UuidConflictException;

    /**
     * @return  Local subnets
     *
     * @throws io.hybridnet.operator.cluster.operator.resource.CacheNotSyncedException   Before the subnet cache synced
     */
    List<Subnet> listSubnets();
}
