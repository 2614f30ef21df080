/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.resource;

import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.api.networking.model.remotecluster.RemoteClusterStatus;

import java.util.List;

/**
 * Access to the RemoteCluster resources. Reads come from a cache, writes go to the API server.
 */
public interface RemoteClusterStore {
    /**
     * @return  All known remote clusters
     *
     * @throws CacheNotSyncedException  When the cache has not synced yet
     */
    List<RemoteCluster> list();

    /**
     * @param name  Name of the remote cluster
     *
     * @return  The remote cluster or null when it does not exist
     *
     * @throws CacheNotSyncedException  When the cache has not synced yet
     */
    RemoteCluster get(String name);

    /**
     * Merges the non-null fields of the given status into the status subresource of the remote cluster. Fields
     * which are null in the patch are left untouched, so writers updating disjoint fields do not overwrite each
     * other.
     *
     * @param name      Name of the remote cluster
     * @param status    Partial status
     */
    void patchStatus(String name, RemoteClusterStatus status);
}
