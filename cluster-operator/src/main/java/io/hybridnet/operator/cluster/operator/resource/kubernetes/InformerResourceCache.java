/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.hybridnet.operator.cluster.operator.resource.CacheNotSyncedException;
import io.hybridnet.operator.cluster.operator.resource.ResourceCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * {@link ResourceCache} backed by a fabric8 shared informer
 *
 * @param <T>   Type of the cached resources
 */
public class InformerResourceCache<T extends HasMetadata> implements ResourceCache<T> {
    private static final Logger LOGGER = LogManager.getLogger(InformerResourceCache.class);

    private final String kind;
    private final SharedIndexInformer<T> informer;

    /**
     * Constructor
     *
     * @param kind      Kind of the resources, used in logs and errors
     * @param informer  Informer which is not running yet
     */
    public InformerResourceCache(String kind, SharedIndexInformer<T> informer) {
        this.kind = kind;
        this.informer = informer;
    }

    /**
     * Creates a cache for all resources of the given type
     *
     * @param client    Kubernetes client
     * @param type      Resource class
     * @param resyncMs  Period of the informer resync, 0 disables it
     *
     * @param <T>   Type of the cached resources
     *
     * @return  Cache which is not started yet
     */
    public static <T extends HasMetadata> InformerResourceCache<T> create(KubernetesClient client, Class<T> type, long resyncMs) {
        return new InformerResourceCache<>(HasMetadata.getKind(type), client.resources(type).runnableInformer(resyncMs));
    }

    @Override
    public void addEventHandler(ResourceEventHandler<? super T> handler) {
        informer.addEventHandler(handler);
    }

    @Override
    public CompletionStage<Void> start() {
        LOGGER.debug("Starting informer for {} resources", kind);
        return informer.start();
    }

    @Override
    public void stop() {
        LOGGER.debug("Stopping informer for {} resources", kind);
        informer.stop();
    }

    @Override
    public boolean hasSynced() {
        return informer.hasSynced();
    }

    @Override
    public List<T> list() {
        ensureSynced();
        return List.copyOf(informer.getStore().list());
    }

    @Override
    public T get(String name) {
        ensureSynced();
        return informer.getStore().getByKey(name);
    }

    private void ensureSynced() {
        if (!informer.hasSynced()) {
            throw new CacheNotSyncedException(kind);
        }
    }
}
