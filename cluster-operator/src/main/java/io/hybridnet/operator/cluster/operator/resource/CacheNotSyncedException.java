/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.resource;

/**
 * Thrown when a cache is read before it finished its initial listing
 */
public class CacheNotSyncedException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param kind  Kind of the cached resources
     */
    public CacheNotSyncedException(String kind) {
        super("Informer cache of " + kind + " resources has not synced yet");
    }
}
