/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster.session;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.hybridnet.api.networking.model.remotecluster.ConnConfig;
import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.operator.cluster.operator.remotecluster.event.RemoteClusterEventSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Creates {@link KubernetesRemoteClusterSession}s with a dedicated Kubernetes client for every remote cluster
 */
public class KubernetesRemoteClusterSessionFactory implements RemoteClusterSessionFactory {
    private static final Logger LOGGER = LogManager.getLogger(KubernetesRemoteClusterSessionFactory.class);

    /**
     * Connection and request timeout used when the connection configuration does not set one
     */
    public static final int DEFAULT_TIMEOUT_SECONDS = 10;

    @Override
    public RemoteClusterSession create(RemoteCluster remoteCluster, LocalCluster localCluster, RemoteClusterEventSink eventSink) throws SessionCreationException {
        String name = remoteCluster.getMetadata().getName();
        ConnConfig connConfig = remoteCluster.connConfig();

        Config config = clientConfig(name, connConfig);

        KubernetesClient client;
        try {
            client = new KubernetesClientBuilder().withConfig(config).build();
        } catch (KubernetesClientException e) {
            throw new SessionCreationException("Failed to create client for remote cluster " + name, e);
        }
        LOGGER.info("Created client for remote cluster {} with endpoint {}", name, connConfig.getEndpoint());

        return new KubernetesRemoteClusterSession(name, connConfig, client, localCluster, eventSink,
                remoteCluster.statusUuid(), remoteCluster.getStatus() != null ? remoteCluster.getStatus().getState() : null);
    }

    /**
     * Builds the client configuration from the connection configuration
     *
     * @param name          Name of the remote cluster
     * @param connConfig    Connection configuration
     *
     * @return  Client configuration
     *
     * @throws SessionCreationException     When the connection configuration is missing or invalid
     */
    static Config clientConfig(String name, ConnConfig connConfig) throws SessionCreationException {
        if (connConfig == null) {
            throw new SessionCreationException("Remote cluster " + name + " has no connection configuration");
        } else if (connConfig.getEndpoint() == null || connConfig.getEndpoint().isBlank()) {
            throw new SessionCreationException("Remote cluster " + name + " has no endpoint");
        }

        int timeoutSeconds = connConfig.getTimeout() != null && connConfig.getTimeout() > 0 ? connConfig.getTimeout() : DEFAULT_TIMEOUT_SECONDS;
        int timeoutMs;
        try {
            timeoutMs = Math.multiplyExact(timeoutSeconds, 1_000);
        } catch (ArithmeticException e) {
            throw new SessionCreationException("Timeout " + timeoutSeconds + "s of remote cluster " + name + " is too large", e);
        }

        try {
            return new ConfigBuilder(Config.empty())
                    .withMasterUrl(connConfig.getEndpoint())
                    .withCaCertData(connConfig.getCaBundle())
                    .withClientCertData(connConfig.getClientCert())
                    .withClientKeyData(connConfig.getClientKey())
                    .withConnectionTimeout(timeoutMs)
                    .withRequestTimeout(timeoutMs)
                    .build();
        } catch (KubernetesClientException | IllegalArgumentException e) {
            throw new SessionCreationException("Invalid connection configuration of remote cluster " + name, e);
        }
    }
}
