/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.api.networking.model.common;

/**
 * Constants shared by the networking.alibaba.com resources
 */
public class Constants {
    /**
     * API group of all Hybridnet networking resources
     */
    public static final String RESOURCE_GROUP_NAME = "networking.alibaba.com";

    /**
     * The only served version
     */
    public static final String V1 = "v1";

    /**
     * Scope of resources which are not namespaced
     */
    public static final String CLUSTER_SCOPE = "Cluster";

    private Constants() {
        // Constants only
    }
}
