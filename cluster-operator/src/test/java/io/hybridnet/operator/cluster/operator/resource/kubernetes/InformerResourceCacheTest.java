/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.resource.kubernetes;

import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.operator.cluster.ResourceUtils;
import io.hybridnet.operator.cluster.operator.resource.CacheNotSyncedException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class InformerResourceCacheTest {
    @SuppressWarnings("unchecked")
    private static SharedIndexInformer<RemoteCluster> informer() {
        return mock(SharedIndexInformer.class, RETURNS_DEEP_STUBS);
    }

    @Test
    public void testReadsFailBeforeSync() {
        SharedIndexInformer<RemoteCluster> informer = informer();
        when(informer.hasSynced()).thenReturn(false);

        InformerResourceCache<RemoteCluster> cache = new InformerResourceCache<>(RemoteCluster.RESOURCE_KIND, informer);

        assertThat(cache.hasSynced(), is(false));
        CacheNotSyncedException e = assertThrows(CacheNotSyncedException.class, cache::list);
        assertThat(e.getMessage(), is("Informer cache of RemoteCluster resources has not synced yet"));
        assertThrows(CacheNotSyncedException.class, () -> cache.get("cluster-a"));
    }

    @Test
    public void testReadsAfterSync() {
        RemoteCluster remoteCluster = ResourceUtils.remoteCluster("cluster-a", "u1");
        SharedIndexInformer<RemoteCluster> informer = informer();
        when(informer.hasSynced()).thenReturn(true);
        when(informer.getStore().list()).thenReturn(List.of(remoteCluster));
        when(informer.getStore().getByKey("cluster-a")).thenReturn(remoteCluster);

        InformerResourceCache<RemoteCluster> cache = new InformerResourceCache<>(RemoteCluster.RESOURCE_KIND, informer);

        assertThat(cache.list(), is(List.of(remoteCluster)));
        assertThat(cache.get("cluster-a").statusUuid(), is("u1"));
    }
}
