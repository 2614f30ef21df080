/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

import io.hybridnet.api.networking.model.remotecluster.ClusterState;
import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.operator.cluster.ResourceUtils;
import io.hybridnet.operator.cluster.operator.remotecluster.session.FakeSession;
import io.hybridnet.operator.cluster.operator.resource.InMemoryRemoteClusterStore;
import io.hybridnet.operator.cluster.operator.resource.InMemoryResourceCache;
import io.hybridnet.operator.common.MicrometerMetricsProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Clock;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;

@ExtendWith(VertxExtension.class)
public class RemoteClusterHealthCheckerTest {
    private static Vertx vertx;

    private InMemoryResourceCache<RemoteCluster> cache;
    private InMemoryRemoteClusterStore store;
    private SessionRegistry registry;
    private RemoteClusterMetrics metrics;
    private RemoteClusterStatusUpdater updater;

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
        cache = new InMemoryResourceCache<>(RemoteCluster.RESOURCE_KIND);
        store = new InMemoryRemoteClusterStore(cache);
        registry = new SessionRegistry();
        metrics = new RemoteClusterMetrics(new MicrometerMetricsProvider(new SimpleMeterRegistry()), "remotecluster");
        updater = new RemoteClusterStatusUpdater(store, metrics, Clock.systemUTC());
    }

    private FakeSession addCluster(String name, boolean withSession) {
        cache.put(ResourceUtils.remoteCluster(name, null));

        if (withSession) {
            FakeSession session = new FakeSession(name, ResourceUtils.connConfig("https://" + name + ":6443"));
            registry.set(name, session);
            return session;
        }

        return null;
    }

    @Test
    public void testRoundChecksAllSessionsAndSurvivesFailures(VertxTestContext context) {
        FakeSession a = addCluster("cluster-a", true);
        FakeSession b = addCluster("cluster-b", true).withProbeFailure(new IllegalStateException("boom"));
        FakeSession c = addCluster("cluster-c", true);
        addCluster("cluster-d", false);
        cache.start();

        RemoteClusterHealthChecker checker = new RemoteClusterHealthChecker(vertx, store, registry, updater, 60_000L);

        checker.checkAll().onComplete(context.succeeding(v -> context.verify(() -> {
            assertThat(a.probes(), is(1));
            assertThat(b.probes(), is(1));
            assertThat(c.probes(), is(1));

            assertThat(cache.get("cluster-a").getStatus().getState(), is(ClusterState.ONLINE));
            assertThat(cache.get("cluster-b").getStatus(), is(nullValue()));
            assertThat(cache.get("cluster-c").getStatus().getState(), is(ClusterState.ONLINE));
            assertThat(cache.get("cluster-d").getStatus(), is(nullValue()));
            assertThat(metrics.failedStatusUpdates().count(), is(1.0));

            context.completeNow();
        })));
    }

    @Test
    public void testRoundCompletesWhenListingFails(VertxTestContext context) {
        // The cache was never started, so listing fails
        addCluster("cluster-a", true);

        RemoteClusterHealthChecker checker = new RemoteClusterHealthChecker(vertx, store, registry, updater, 60_000L);

        checker.checkAll().onComplete(context.succeeding(v -> context.verify(() -> {
            assertThat(store.attempts(), is(0));
            context.completeNow();
        })));
    }

    @Test
    public void testRoundsDoNotOverlap(VertxTestContext context) {
        FakeSession slow = addCluster("cluster-a", true).withProbeDelay(30L);
        cache.start();

        RemoteClusterHealthChecker checker = new RemoteClusterHealthChecker(vertx, store, registry, updater, 20L);
        checker.start();

        vertx.setTimer(500L, id -> checker.stop().onComplete(context.succeeding(v -> context.verify(() -> {
            assertThat(slow.probes(), is(greaterThanOrEqualTo(3)));
            assertThat(slow.maxConcurrentProbes(), is(1));
            context.completeNow();
        }))));
    }

    @Test
    public void testNonPositivePeriodFallsBackToDefault() {
        assertThat(new RemoteClusterHealthChecker(vertx, store, registry, updater, 0L).getPeriodMs(),
                is(RemoteClusterHealthChecker.DEFAULT_PERIOD_MS));
        assertThat(new RemoteClusterHealthChecker(vertx, store, registry, updater, -5L).getPeriodMs(),
                is(RemoteClusterHealthChecker.DEFAULT_PERIOD_MS));
    }
}
