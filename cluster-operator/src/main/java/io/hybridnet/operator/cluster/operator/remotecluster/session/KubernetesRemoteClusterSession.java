/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster.session;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.hybridnet.api.networking.model.common.Condition;
import io.hybridnet.api.networking.model.network.Network;
import io.hybridnet.api.networking.model.remotecluster.ClusterState;
import io.hybridnet.api.networking.model.remotecluster.ConnConfig;
import io.hybridnet.api.networking.model.subnet.Subnet;
import io.hybridnet.operator.cluster.model.Cidr;
import io.hybridnet.operator.cluster.operator.remotecluster.UuidConflictException;
import io.hybridnet.operator.cluster.operator.remotecluster.event.RemoteClusterEvent;
import io.hybridnet.operator.cluster.operator.remotecluster.event.RemoteClusterEventSink;
import io.hybridnet.operator.cluster.operator.resource.CacheNotSyncedException;
import io.hybridnet.operator.cluster.operator.resource.EventRecorder;
import io.hybridnet.operator.cluster.operator.resource.kubernetes.KubernetesClusterUuidResolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session talking to the Kubernetes API server of a remote cluster. Each probe checks that the peer is reachable,
 * that its identity is valid, that it uses the same overlay network ID and that none of its subnets overlaps with a
 * local subnet.
 */
public class KubernetesRemoteClusterSession implements RemoteClusterSession {
    private static final Logger LOGGER = LogManager.getLogger(KubernetesRemoteClusterSession.class);

    /**
     * Condition reporting whether the peer API server is reachable
     */
    public static final String CONDITION_READY = "Ready";

    /**
     * Condition reporting whether the peer UUID is valid and owned by this remote cluster
     */
    public static final String CONDITION_IDENTITY = "IdentityValid";

    /**
     * Condition reporting whether the peer uses the same overlay network ID
     */
    public static final String CONDITION_OVERLAY_NET_ID_MATCH = "OverlayNetIDMatch";

    /**
     * Condition reporting whether the peer subnets are disjoint from the local subnets
     */
    public static final String CONDITION_SUBNETS_NOT_OVERLAPPING = "SubnetsNotOverlapping";

    private final String clusterName;
    private final ConnConfig connConfig;
    private final KubernetesClient client;
    private final LocalCluster localCluster;
    private final RemoteClusterEventSink eventSink;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile String reportedUuid;
    private volatile String reportedState;

    /**
     * Constructor
     *
     * @param clusterName   Name of the remote cluster
     * @param connConfig    Connection configuration the client was built from
     * @param client        Client connected to the peer API server
     * @param localCluster  View of the local cluster
     * @param eventSink     Sink for published events
     * @param knownUuid     UUID currently stored in the status of the remote cluster or null
     * @param knownState    State currently stored in the status of the remote cluster or null
     */
    public KubernetesRemoteClusterSession(String clusterName, ConnConfig connConfig, KubernetesClient client,
                                          LocalCluster localCluster, RemoteClusterEventSink eventSink,
                                          String knownUuid, String knownState) {
        this.clusterName = clusterName;
        this.connConfig = connConfig;
        this.client = client;
        this.localCluster = localCluster;
        this.eventSink = eventSink;
        this.reportedUuid = knownUuid;
        this.reportedState = knownState;
    }

    @Override
    public String clusterName() {
        return clusterName;
    }

    @Override
    public ConnConfig connConfig() {
        return connConfig;
    }

    @Override
    public HealthSnapshot probe() {
        if (closed.get()) {
            throw new IllegalStateException("Session of remote cluster " + clusterName + " is closed");
        }

        List<Condition> conditions = new ArrayList<>();

        try {
            String version = client.getKubernetesVersion().getGitVersion();
            conditions.add(new Condition(CONDITION_READY, Condition.TRUE, "ClusterReachable", "Remote API server version " + version));
        } catch (KubernetesClientException e) {
            LOGGER.warn("Remote cluster {} is not reachable: {}", clusterName, e.getMessage());
            conditions.add(new Condition(CONDITION_READY, Condition.FALSE, "ClusterUnreachable", e.getMessage()));
            return snapshot(ClusterState.OFFLINE, conditions);
        }

        conditions.add(checkIdentity());
        conditions.add(checkOverlayNetId());
        conditions.add(checkSubnets());

        boolean healthy = conditions.stream().allMatch(c -> Condition.TRUE.equals(c.getStatus()));
        return snapshot(healthy ? ClusterState.ONLINE : ClusterState.NOT_READY, conditions);
    }

    private Condition checkIdentity() {
        String peerUuid;
        try {
            peerUuid = KubernetesClusterUuidResolver.uuidOf(client);
        } catch (KubernetesClientException | IllegalStateException e) {
            return new Condition(CONDITION_IDENTITY, Condition.FALSE, "UUIDUnavailable", e.getMessage());
        }

        if (peerUuid.equals(localCluster.uuid())) {
            return new Condition(CONDITION_IDENTITY, Condition.FALSE, "SelfReference",
                    "Remote cluster has the same UUID " + peerUuid + " as the local cluster");
        }

        try {
            localCluster.lockUuid(peerUuid, clusterName);
        } catch (UuidConflictException e) {
            return new Condition(CONDITION_IDENTITY, Condition.FALSE, "UUIDConflict", e.getMessage());
        }

        if (!peerUuid.equals(reportedUuid)) {
            LOGGER.info("Remote cluster {} reports UUID {}", clusterName, peerUuid);
            if (eventSink.submit(RemoteClusterEvent.refreshUuid(peerUuid, clusterName))) {
                reportedUuid = peerUuid;
            }
        }

        return new Condition(CONDITION_IDENTITY, Condition.TRUE, "UUIDValid", "Remote cluster UUID is " + peerUuid);
    }

    private Condition checkOverlayNetId() {
        Long localNetId = localCluster.overlayNetId();
        Long remoteNetId;
        try {
            remoteNetId = client.resources(Network.class).list().getItems().stream()
                    .filter(Network::isOverlay)
                    .map(Network::netId)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElse(null);
        } catch (KubernetesClientException e) {
            return new Condition(CONDITION_OVERLAY_NET_ID_MATCH, Condition.FALSE, "NetworkListFailed", e.getMessage());
        }

        if (localNetId == null || remoteNetId == null) {
            return new Condition(CONDITION_OVERLAY_NET_ID_MATCH, Condition.FALSE, "OverlayNetIDMissing",
                    "Overlay network ID is local=" + localNetId + ", remote=" + remoteNetId);
        } else if (!localNetId.equals(remoteNetId)) {
            return new Condition(CONDITION_OVERLAY_NET_ID_MATCH, Condition.FALSE, "OverlayNetIDMismatch",
                    "Overlay network ID is local=" + localNetId + ", remote=" + remoteNetId);
        } else {
            return new Condition(CONDITION_OVERLAY_NET_ID_MATCH, Condition.TRUE, "OverlayNetIDMatch",
                    "Overlay network ID is " + localNetId);
        }
    }

    private Condition checkSubnets() {
        List<Subnet> localSubnets;
        List<Subnet> remoteSubnets;
        try {
            localSubnets = localCluster.listSubnets();
            remoteSubnets = client.resources(Subnet.class).list().getItems();
        } catch (CacheNotSyncedException | KubernetesClientException e) {
            return new Condition(CONDITION_SUBNETS_NOT_OVERLAPPING, Condition.FALSE, "SubnetListFailed", e.getMessage());
        }

        List<String> overlaps = overlappingSubnets(localSubnets, remoteSubnets);
        if (overlaps.isEmpty()) {
            return new Condition(CONDITION_SUBNETS_NOT_OVERLAPPING, Condition.TRUE, "SubnetsNotOverlapping",
                    "No remote subnet overlaps with a local subnet");
        } else {
            return new Condition(CONDITION_SUBNETS_NOT_OVERLAPPING, Condition.FALSE, "SubnetOverlap",
                    "Overlapping subnets (local/remote): " + String.join(", ", overlaps));
        }
    }

    /**
     * Finds pairs of overlapping subnets. Subnets without a valid CIDR are ignored.
     *
     * @param localSubnets  Local subnets
     * @param remoteSubnets Remote subnets
     *
     * @return  Overlapping pairs formatted as local/remote
     */
    static List<String> overlappingSubnets(List<Subnet> localSubnets, List<Subnet> remoteSubnets) {
        List<String> overlaps = new ArrayList<>();

        for (Subnet local : localSubnets) {
            Cidr localCidr = cidrOf(local);
            if (localCidr == null) {
                continue;
            }

            for (Subnet remote : remoteSubnets) {
                Cidr remoteCidr = cidrOf(remote);
                if (remoteCidr != null && localCidr.overlaps(remoteCidr)) {
                    overlaps.add(local.getMetadata().getName() + "/" + remote.getMetadata().getName());
                }
            }
        }

        return overlaps;
    }

    private static Cidr cidrOf(Subnet subnet) {
        try {
            return Cidr.parse(subnet.cidr());
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Ignoring subnet {} with invalid CIDR {}", subnet.getMetadata().getName(), subnet.cidr());
            return null;
        }
    }

    private HealthSnapshot snapshot(String state, List<Condition> conditions) {
        if (!state.equals(reportedState)) {
            LOGGER.info("Remote cluster {} changed state from {} to {}", clusterName, reportedState, state);

            RemoteClusterEvent event = switch (state) {
                case ClusterState.ONLINE -> RemoteClusterEvent.recordEvent(clusterName, EventRecorder.NORMAL, "ClusterOnline",
                        "Remote cluster is online");
                case ClusterState.OFFLINE -> RemoteClusterEvent.recordEvent(clusterName, EventRecorder.WARNING, "ClusterOffline",
                        "Remote cluster is offline");
                default -> RemoteClusterEvent.recordEvent(clusterName, EventRecorder.WARNING, "ClusterNotReady",
                        "Remote cluster is not ready");
            };

            if (eventSink.submit(event)) {
                reportedState = state;
            }
        }

        return new HealthSnapshot(state, conditions);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOGGER.debug("Closing client of remote cluster {}", clusterName);
            client.close();
        }
    }
}
