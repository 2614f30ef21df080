/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.hybridnet.operator.cluster.operator.resource.ClusterUuidResolver;

/**
 * Uses the UID of the kube-system namespace as the identity of a cluster. The namespace cannot be deleted, so the
 * UID is stable for the whole life of the cluster.
 */
public class KubernetesClusterUuidResolver implements ClusterUuidResolver {
    /**
     * Namespace whose UID identifies the cluster
     */
    public static final String IDENTITY_NAMESPACE = "kube-system";

    private final KubernetesClient client;

    /**
     * Constructor
     *
     * @param client    Client of the cluster to identify
     */
    public KubernetesClusterUuidResolver(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public String resolveUuid() {
        return uuidOf(client);
    }

    /**
     * Reads the UUID of the cluster the client is connected to
     *
     * @param client    Kubernetes client
     *
     * @return  UID of the kube-system namespace
     *
     * @throws IllegalStateException    When the namespace does not exist or has no UID
     */
    public static String uuidOf(KubernetesClient client) {
        Namespace namespace = client.namespaces().withName(IDENTITY_NAMESPACE).get();

        if (namespace == null || namespace.getMetadata() == null
                || namespace.getMetadata().getUid() == null || namespace.getMetadata().getUid().isEmpty()) {
            throw new IllegalStateException("Namespace " + IDENTITY_NAMESPACE + " not found or has no UID");
        }

        return namespace.getMetadata().getUid();
    }
}
