/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

import io.hybridnet.api.networking.model.network.Network;
import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.api.networking.model.subnet.Subnet;
import io.hybridnet.operator.cluster.RemoteClusterOperatorConfig;
import io.hybridnet.operator.cluster.ResourceUtils;
import io.hybridnet.operator.cluster.operator.remotecluster.session.FakeSession;
import io.hybridnet.operator.cluster.operator.remotecluster.session.FakeSessionFactory;
import io.hybridnet.operator.cluster.operator.resource.ClusterUuidResolver;
import io.hybridnet.operator.cluster.operator.resource.InMemoryRemoteClusterStore;
import io.hybridnet.operator.cluster.operator.resource.InMemoryResourceCache;
import io.hybridnet.operator.cluster.operator.resource.RecordingEventRecorder;
import io.hybridnet.operator.common.MicrometerMetricsProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.function.BooleanSupplier;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

public class RemoteClusterControllerTest {
    private static final String LOCAL_UUID = "local-uuid";

    private static Vertx vertx;

    private InMemoryResourceCache<RemoteCluster> remoteClusters;
    private InMemoryResourceCache<Network> networks;
    private InMemoryResourceCache<Subnet> subnets;
    private FakeSessionFactory sessionFactory;
    private RecordingEventRecorder recorder;

    @BeforeAll
    public static void beforeAll() {
        vertx = Vertx.vertx();
    }

    @AfterAll
    public static void afterAll() {
        vertx.close();
    }

    @BeforeEach
    public void beforeEach() {
        remoteClusters = new InMemoryResourceCache<>(RemoteCluster.RESOURCE_KIND);
        networks = new InMemoryResourceCache<>(Network.RESOURCE_KIND);
        subnets = new InMemoryResourceCache<>(Subnet.RESOURCE_KIND);
        sessionFactory = new FakeSessionFactory();
        recorder = new RecordingEventRecorder();
    }

    private static RemoteClusterOperatorConfig config(long cacheSyncTimeoutMs) {
        return new RemoteClusterOperatorConfig(60_000L, 10, 0L, 1L, 10L, 2, cacheSyncTimeoutMs, 0L, "kube-system", null);
    }

    private RemoteClusterController controller(ClusterUuidResolver resolver, long cacheSyncTimeoutMs) {
        return new RemoteClusterController(config(cacheSyncTimeoutMs), vertx, resolver, remoteClusters, networks, subnets,
                new InMemoryRemoteClusterStore(remoteClusters), sessionFactory, recorder,
                new MicrometerMetricsProvider(new SimpleMeterRegistry()), Clock.systemUTC());
    }

    private static void waitFor(String description, BooleanSupplier ready) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000L;

        while (!ready.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + description);
            }
            Thread.sleep(10L);
        }
    }

    @Test
    public void testStartupSeedsLockAndReconcilesExistingClusters() throws Exception {
        remoteClusters.put(ResourceUtils.remoteCluster("cluster-a", "u1"));
        remoteClusters.put(ResourceUtils.remoteCluster("cluster-b", "u1"));
        remoteClusters.put(ResourceUtils.remoteCluster("myself", LOCAL_UUID));
        networks.put(ResourceUtils.overlayNetwork(42L));
        subnets.put(ResourceUtils.subnet("subnet-1", "10.0.0.0/24"));

        RemoteClusterController controller = controller(() -> LOCAL_UUID, 5_000L);
        controller.start();

        try {
            assertThat(controller.isStarted(), is(true));
            assertThat(controller.uuid(), is(LOCAL_UUID));
            assertThat(controller.overlayNetId(), is(42L));
            assertThat(controller.listSubnets().size(), is(1));
            assertThat(controller.uuidLock().ownerOf("u1"), is("cluster-a"));
            assertThat(controller.uuidLock().ownerOf(LOCAL_UUID), is(nullValue()));

            waitFor("session of cluster-a", () -> controller.registry().get("cluster-a") != null);
            waitFor("UUID conflict event", () -> recorder.reasons().contains("UUIDConflict"));
            waitFor("status of cluster-a", () -> remoteClusters.get("cluster-a").getStatus().getState() != null);

            assertThat(controller.registry().get("cluster-b"), is(nullValue()));
            assertThat(controller.registry().get("myself"), is(nullValue()));
            assertThat(recorder.events().get(0).name(), is("cluster-b"));

            networks.put(ResourceUtils.overlayNetwork(43L));
            assertThat(controller.overlayNetId(), is(43L));
        } finally {
            controller.stop(5_000L);
        }

        assertThat(controller.isStarted(), is(false));
        assertThat(controller.registry().size(), is(0));
        for (FakeSession session : sessionFactory.created()) {
            assertThat(session.isClosed(), is(true));
        }
        assertThat(remoteClusters.isStopped(), is(true));
        assertThat(networks.isStopped(), is(true));
        assertThat(subnets.isStopped(), is(true));
    }

    @Test
    public void testUuidResolutionFailureIsFatal() {
        RemoteClusterController controller = controller(() -> {
            throw new IllegalStateException("Namespace kube-system not found");
        }, 5_000L);

        ControllerStartupException e = assertThrows(ControllerStartupException.class, controller::start);

        assertThat(e.getCause().getMessage(), is("Namespace kube-system not found"));
        assertThat(controller.isStarted(), is(false));
        assertThat(remoteClusters.hasSynced(), is(false));
    }

    @Test
    public void testEmptyUuidIsFatal() {
        RemoteClusterController controller = controller(() -> "", 5_000L);

        assertThrows(ControllerStartupException.class, controller::start);
        assertThat(controller.isStarted(), is(false));
    }

    @Test
    public void testCacheSyncTimeoutIsFatal() {
        subnets.neverSync();
        RemoteClusterController controller = controller(() -> LOCAL_UUID, 200L);

        assertThrows(ControllerStartupException.class, controller::start);
        assertThat(controller.isStarted(), is(false));
    }
}
