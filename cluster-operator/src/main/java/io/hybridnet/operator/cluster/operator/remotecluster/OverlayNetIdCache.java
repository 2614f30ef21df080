/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.hybridnet.api.networking.model.network.Network;
import io.hybridnet.operator.cluster.operator.resource.CacheNotSyncedException;
import io.hybridnet.operator.cluster.operator.resource.ResourceCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * ID of the local overlay network. Written only by {@link #sync()}, read by the sessions.
 */
public class OverlayNetIdCache {
    private static final Logger LOGGER = LogManager.getLogger(OverlayNetIdCache.class);

    private final ResourceCache<Network> networks;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private Long netId;

    /**
     * Constructor
     *
     * @param networks  Cache of the local networks
     */
    public OverlayNetIdCache(ResourceCache<Network> networks) {
        this.networks = networks;
    }

    /**
     * @return  ID of the local overlay network or null when there is none
     */
    public Long get() {
        lock.readLock().lock();
        try {
            return netId;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Reads the ID of the overlay network from the network cache. Before the cache synced the previous value is kept.
     */
    public void sync() {
        lock.writeLock().lock();
        try {
            List<Network> all;
            try {
                all = networks.list();
            } catch (CacheNotSyncedException e) {
                LOGGER.debug("Network cache has not synced yet, keeping overlay network ID {}", netId);
                return;
            }

            Long current = all.stream()
                    .filter(Network::isOverlay)
                    .findFirst()
                    .map(Network::netId)
                    .orElse(null);

            if (!Objects.equals(current, netId)) {
                LOGGER.info("Overlay network ID changed from {} to {}", netId, current);
                netId = current;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return  Handler which re-syncs the cache when the overlay network changes
     */
    public ResourceEventHandler<Network> eventHandler() {
        return new ResourceEventHandler<>() {
            @Override
            public void onAdd(Network network) {
                sync();
            }

            @Override
            public void onUpdate(Network oldNetwork, Network newNetwork) {
                if ((oldNetwork.isOverlay() || newNetwork.isOverlay())
                        && (oldNetwork.isOverlay() != newNetwork.isOverlay() || !Objects.equals(oldNetwork.netId(), newNetwork.netId()))) {
                    sync();
                }
            }

            @Override
            public void onDelete(Network network, boolean deletedFinalStateUnknown) {
                if (network.isOverlay()) {
                    sync();
                }
            }
        };
    }
}
