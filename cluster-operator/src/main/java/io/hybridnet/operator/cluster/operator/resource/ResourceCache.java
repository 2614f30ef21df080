/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Read-through cache of cluster scoped resources, kept up to date by watching the API server. Reads fail with
 * {@link CacheNotSyncedException} until the initial listing has been loaded.
 *
 * @param <T>   Type of the cached resources
 */
public interface ResourceCache<T extends HasMetadata> {
    /**
     * Registers a handler notified about every add, update and delete seen by the cache. Handlers have to be
     * registered before {@link #start()}.
     *
     * @param handler   Event handler
     */
    void addEventHandler(ResourceEventHandler<? super T> handler);

    /**
     * Starts watching the resources
     *
     * @return  Completion stage completed once the cache has synced
     */
    CompletionStage<Void> start();

    /**
     * Stops watching the resources
     */
    void stop();

    /**
     * @return  True once the initial listing has been loaded
     */
    boolean hasSynced();

    /**
     * @return  All cached resources
     *
     * @throws CacheNotSyncedException  When the cache has not synced yet
     */
    List<T> list();

    /**
     * @param name  Name of the resource
     *
     * @return  The cached resource or null when it does not exist
     *
     * @throws CacheNotSyncedException  When the cache has not synced yet
     */
    T get(String name);
}
