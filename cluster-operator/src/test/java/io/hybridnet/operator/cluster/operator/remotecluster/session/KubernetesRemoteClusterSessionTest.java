/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster.session;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.hybridnet.api.networking.model.common.Condition;
import io.hybridnet.api.networking.model.network.Network;
import io.hybridnet.api.networking.model.network.NetworkType;
import io.hybridnet.api.networking.model.remotecluster.ClusterState;
import io.hybridnet.api.networking.model.subnet.Subnet;
import io.hybridnet.operator.cluster.ResourceUtils;
import io.hybridnet.operator.cluster.operator.remotecluster.UuidConflictException;
import io.hybridnet.operator.cluster.operator.remotecluster.event.RecordingEventSink;
import io.hybridnet.operator.cluster.operator.remotecluster.event.RemoteClusterEvent;
import io.hybridnet.operator.cluster.operator.resource.EventRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class KubernetesRemoteClusterSessionTest {
    private static final String LOCAL_UUID = "local-uuid";
    private static final String PEER_UUID = "peer-uuid";

    private KubernetesClient client;
    private StaticLocalCluster localCluster;
    private RecordingEventSink sink;

    @BeforeEach
    public void beforeEach() {
        client = mock(KubernetesClient.class, RETURNS_DEEP_STUBS);
        localCluster = new StaticLocalCluster(LOCAL_UUID, 42L)
                .withSubnets(List.of(ResourceUtils.subnet("local-1", "10.0.0.0/24")));
        sink = new RecordingEventSink();

        when(client.getKubernetesVersion().getGitVersion()).thenReturn("v1.28.3");
        peerUuid(PEER_UUID);
        remoteNetworks(List.of(ResourceUtils.overlayNetwork(42L), ResourceUtils.network("underlay", NetworkType.UNDERLAY, 7L)));
        remoteSubnets(List.of(ResourceUtils.subnet("remote-1", "10.1.0.0/24")));
    }

    private void peerUuid(String uid) {
        Namespace namespace = new NamespaceBuilder().withNewMetadata().withName("kube-system").withUid(uid).endMetadata().build();
        when(client.namespaces().withName("kube-system").get()).thenReturn(namespace);
    }

    private void remoteNetworks(List<Network> networks) {
        when(client.resources(Network.class).list().getItems()).thenReturn(networks);
    }

    private void remoteSubnets(List<Subnet> subnets) {
        when(client.resources(Subnet.class).list().getItems()).thenReturn(subnets);
    }

    private KubernetesRemoteClusterSession session(String knownUuid, String knownState) {
        return new KubernetesRemoteClusterSession("cluster-a", ResourceUtils.connConfig("https://10.0.0.1:6443"), client,
                localCluster, sink, knownUuid, knownState);
    }

    private static Condition condition(HealthSnapshot snapshot, String type) {
        return snapshot.conditions().stream().filter(c -> type.equals(c.getType())).findFirst().orElseThrow();
    }

    @Test
    public void testHealthyPeer() {
        KubernetesRemoteClusterSession session = session(null, null);

        HealthSnapshot snapshot = session.probe();

        assertThat(snapshot.state(), is(ClusterState.ONLINE));
        assertThat(snapshot.conditions().size(), is(4));
        assertThat(snapshot.conditions().stream().allMatch(c -> Condition.TRUE.equals(c.getStatus())), is(true));
        assertThat(condition(snapshot, KubernetesRemoteClusterSession.CONDITION_READY).getMessage(), containsString("v1.28.3"));
        assertThat(localCluster.uuidLock().ownerOf(PEER_UUID), is("cluster-a"));

        List<RemoteClusterEvent> events = sink.events();
        assertThat(events.size(), is(2));
        assertThat(events.get(0).getType(), is(RemoteClusterEvent.Type.REFRESH_UUID));
        assertThat(events.get(0).getUuid(), is(PEER_UUID));
        assertThat(events.get(0).getClusterName(), is("cluster-a"));
        assertThat(events.get(1).getType(), is(RemoteClusterEvent.Type.RECORD_EVENT));
        assertThat(events.get(1).getBody().type(), is(EventRecorder.NORMAL));
        assertThat(events.get(1).getBody().reason(), is("ClusterOnline"));

        // Nothing changed, so nothing is published again
        session.probe();
        assertThat(sink.events().size(), is(2));
    }

    @Test
    public void testKnownUuidAndStateAreNotPublishedAgain() {
        HealthSnapshot snapshot = session(PEER_UUID, ClusterState.ONLINE).probe();

        assertThat(snapshot.state(), is(ClusterState.ONLINE));
        assertThat(sink.events().isEmpty(), is(true));
    }

    @Test
    public void testChangedPeerUuidIsPublished() {
        KubernetesRemoteClusterSession session = session("old-uuid", ClusterState.ONLINE);

        session.probe();

        List<RemoteClusterEvent> refreshes = sink.events(RemoteClusterEvent.Type.REFRESH_UUID);
        assertThat(refreshes.size(), is(1));
        assertThat(refreshes.get(0).getUuid(), is(PEER_UUID));
    }

    @Test
    public void testUnreachablePeer() {
        when(client.getKubernetesVersion()).thenThrow(new KubernetesClientException("Connection refused"));

        HealthSnapshot snapshot = session(PEER_UUID, ClusterState.ONLINE).probe();

        assertThat(snapshot.state(), is(ClusterState.OFFLINE));
        assertThat(snapshot.conditions().size(), is(1));
        assertThat(snapshot.conditions().get(0).getStatus(), is(Condition.FALSE));
        assertThat(snapshot.conditions().get(0).getReason(), is("ClusterUnreachable"));

        List<RemoteClusterEvent> events = sink.events();
        assertThat(events.size(), is(1));
        assertThat(events.get(0).getBody().type(), is(EventRecorder.WARNING));
        assertThat(events.get(0).getBody().reason(), is("ClusterOffline"));
    }

    @Test
    public void testOverlayNetIdMismatch() {
        remoteNetworks(List.of(ResourceUtils.overlayNetwork(43L)));

        HealthSnapshot snapshot = session(PEER_UUID, ClusterState.ONLINE).probe();

        assertThat(snapshot.state(), is(ClusterState.NOT_READY));
        Condition condition = condition(snapshot, KubernetesRemoteClusterSession.CONDITION_OVERLAY_NET_ID_MATCH);
        assertThat(condition.getStatus(), is(Condition.FALSE));
        assertThat(condition.getReason(), is("OverlayNetIDMismatch"));
        assertThat(sink.events().get(0).getBody().reason(), is("ClusterNotReady"));
    }

    @Test
    public void testMissingOverlayNetIdIsNotReady() {
        localCluster.setOverlayNetId(null);

        HealthSnapshot snapshot = session(PEER_UUID, null).probe();

        assertThat(snapshot.state(), is(ClusterState.NOT_READY));
        assertThat(condition(snapshot, KubernetesRemoteClusterSession.CONDITION_OVERLAY_NET_ID_MATCH).getReason(), is("OverlayNetIDMissing"));
    }

    @Test
    public void testNetworkListFailure() {
        when(client.resources(Network.class).list()).thenThrow(new KubernetesClientException("Forbidden"));

        HealthSnapshot snapshot = session(PEER_UUID, null).probe();

        assertThat(snapshot.state(), is(ClusterState.NOT_READY));
        assertThat(condition(snapshot, KubernetesRemoteClusterSession.CONDITION_OVERLAY_NET_ID_MATCH).getReason(), is("NetworkListFailed"));
    }

    @Test
    public void testOverlappingSubnets() {
        remoteSubnets(List.of(ResourceUtils.subnet("remote-1", "10.0.0.128/25"), ResourceUtils.subnet("remote-2", "10.2.0.0/24")));

        HealthSnapshot snapshot = session(PEER_UUID, null).probe();

        assertThat(snapshot.state(), is(ClusterState.NOT_READY));
        Condition condition = condition(snapshot, KubernetesRemoteClusterSession.CONDITION_SUBNETS_NOT_OVERLAPPING);
        assertThat(condition.getReason(), is("SubnetOverlap"));
        assertThat(condition.getMessage(), containsString("local-1/remote-1"));
    }

    @Test
    public void testOverlapDetectionIgnoresInvalidCidrs() {
        List<String> overlaps = KubernetesRemoteClusterSession.overlappingSubnets(
                List.of(ResourceUtils.subnet("local-1", "10.0.0.0/16"), ResourceUtils.subnet("broken", "10.0.0.0/99")),
                List.of(ResourceUtils.subnet("remote-1", "10.0.5.0/24"), ResourceUtils.subnet("remote-2", "fd00::/64")));

        assertThat(overlaps, is(List.of("local-1/remote-1")));
    }

    @Test
    public void testPeerWithLocalUuidIsRejected() {
        peerUuid(LOCAL_UUID);

        HealthSnapshot snapshot = session(null, null).probe();

        assertThat(snapshot.state(), is(ClusterState.NOT_READY));
        assertThat(condition(snapshot, KubernetesRemoteClusterSession.CONDITION_IDENTITY).getReason(), is("SelfReference"));
        assertThat(sink.events(RemoteClusterEvent.Type.REFRESH_UUID).isEmpty(), is(true));
        assertThat(localCluster.uuidLock().size(), is(0));
    }

    @Test
    public void testPeerUuidOwnedByAnotherCluster() throws UuidConflictException {
        localCluster.uuidLock().lockByOwner(PEER_UUID, "cluster-b");

        HealthSnapshot snapshot = session(null, null).probe();

        assertThat(snapshot.state(), is(ClusterState.NOT_READY));
        assertThat(condition(snapshot, KubernetesRemoteClusterSession.CONDITION_IDENTITY).getReason(), is("UUIDConflict"));
        assertThat(sink.events(RemoteClusterEvent.Type.REFRESH_UUID).isEmpty(), is(true));
        assertThat(localCluster.uuidLock().ownerOf(PEER_UUID), is("cluster-b"));
    }

    @Test
    public void testUnavailablePeerUuid() {
        when(client.namespaces().withName("kube-system").get()).thenReturn(null);

        HealthSnapshot snapshot = session(null, null).probe();

        assertThat(condition(snapshot, KubernetesRemoteClusterSession.CONDITION_IDENTITY).getReason(), is("UUIDUnavailable"));
        assertThat(localCluster.uuidLock().size(), is(0));
    }

    @Test
    public void testClosedSessionCannotProbe() {
        KubernetesRemoteClusterSession session = session(null, null);

        session.close();
        session.close();

        verify(client, times(1)).close();
        assertThrows(IllegalStateException.class, session::probe);
        assertThat(sink.events().isEmpty(), is(true));
        assertThat(localCluster.uuidLock().ownerOf(PEER_UUID), is(nullValue()));
    }
}
