/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.resource.kubernetes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.api.networking.model.remotecluster.RemoteClusterStatus;
import io.hybridnet.operator.cluster.operator.resource.RemoteClusterStore;
import io.hybridnet.operator.cluster.operator.resource.ResourceCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * RemoteCluster store reading from an informer cache and writing the status subresource with JSON merge patches
 */
public class KubernetesRemoteClusterStore implements RemoteClusterStore {
    private static final Logger LOGGER = LogManager.getLogger(KubernetesRemoteClusterStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final PatchContext MERGE_PATCH = PatchContext.of(PatchType.JSON_MERGE);

    private final KubernetesClient client;
    private final ResourceCache<RemoteCluster> cache;

    /**
     * Constructor
     *
     * @param client    Kubernetes client used for writes
     * @param cache     Cache used for reads
     */
    public KubernetesRemoteClusterStore(KubernetesClient client, ResourceCache<RemoteCluster> cache) {
        this.client = client;
        this.cache = cache;
    }

    @Override
    public List<RemoteCluster> list() {
        return cache.list();
    }

    @Override
    public RemoteCluster get(String name) {
        return cache.get(name);
    }

    @Override
    public void patchStatus(String name, RemoteClusterStatus status) {
        String patch = statusPatch(status);
        LOGGER.debug("Patching status of remote cluster {} with {}", name, patch);

        client.resources(RemoteCluster.class)
                .withName(name)
                .subresource("status")
                .patch(MERGE_PATCH, patch);
    }

    /**
     * Builds the JSON merge patch body for a partial status
     *
     * @param status    Partial status, null fields are left out
     *
     * @return  JSON merge patch
     */
    static String statusPatch(RemoteClusterStatus status) {
        try {
            return MAPPER.writeValueAsString(Map.of("status", status));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize RemoteCluster status patch", e);
        }
    }
}
