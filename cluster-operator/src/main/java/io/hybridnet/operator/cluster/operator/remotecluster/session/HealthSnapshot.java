/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster.session;

import io.hybridnet.api.networking.model.common.Condition;

import java.util.List;

/**
 * Result of a health probe of a remote cluster
 *
 * @param state         One of the ClusterState values
 * @param conditions    Conditions observed by the probe, without transition times
 */
public record HealthSnapshot(String state, List<Condition> conditions) {
    /**
     * Constructor
     */
    public HealthSnapshot {
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }
}
