/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.resource;

/**
 * Resolves the UUID identifying the local cluster
 */
@FunctionalInterface
public interface ClusterUuidResolver {
    /**
     * @return  UUID of the local cluster
     *
     * @throws Exception    When the UUID cannot be determined
     */
    String resolveUuid() throws Exception;
}
