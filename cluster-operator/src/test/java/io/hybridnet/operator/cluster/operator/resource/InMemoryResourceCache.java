/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resource cache kept in memory which notifies its handlers like an informer does
 *
 * @param <T>   Type of the cached resources
 */
public class InMemoryResourceCache<T extends HasMetadata> implements ResourceCache<T> {
    private final String kind;
    private final Map<String, T> items = new LinkedHashMap<>();
    private final List<ResourceEventHandler<? super T>> handlers = new CopyOnWriteArrayList<>();
    private final AtomicLong resourceVersion = new AtomicLong(100);
    private volatile boolean synced = false;
    private volatile boolean neverSync = false;
    private volatile boolean stopped = false;

    public InMemoryResourceCache(String kind) {
        this.kind = kind;
    }

    /**
     * Makes {@link #start()} return a stage which never completes
     */
    public void neverSync() {
        this.neverSync = true;
    }

    @Override
    public void addEventHandler(ResourceEventHandler<? super T> handler) {
        handlers.add(handler);
    }

    @Override
    public CompletionStage<Void> start() {
        if (neverSync) {
            return new CompletableFuture<>();
        }

        List<T> initial;
        synchronized (this) {
            synced = true;
            initial = new ArrayList<>(items.values());
        }

        for (T item : initial) {
            handlers.forEach(h -> h.onAdd(item));
        }

        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    @Override
    public boolean hasSynced() {
        return synced;
    }

    @Override
    public synchronized List<T> list() {
        if (!synced) {
            throw new CacheNotSyncedException(kind);
        }

        return new ArrayList<>(items.values());
    }

    @Override
    public synchronized T get(String name) {
        if (!synced) {
            throw new CacheNotSyncedException(kind);
        }

        return items.get(name);
    }

    /**
     * Adds or replaces a resource. A new resource version is assigned, like the API server does.
     *
     * @param item  Resource
     */
    public void put(T item) {
        item.getMetadata().setResourceVersion(String.valueOf(resourceVersion.incrementAndGet()));

        T previous;
        synchronized (this) {
            previous = items.put(item.getMetadata().getName(), item);
        }

        if (synced) {
            if (previous == null) {
                handlers.forEach(h -> h.onAdd(item));
            } else {
                handlers.forEach(h -> h.onUpdate(previous, item));
            }
        }
    }

    /**
     * Removes a resource
     *
     * @param name  Name of the resource
     */
    public void remove(String name) {
        T removed;
        synchronized (this) {
            removed = items.remove(name);
        }

        if (synced && removed != null) {
            handlers.forEach(h -> h.onDelete(removed, false));
        }
    }
}
