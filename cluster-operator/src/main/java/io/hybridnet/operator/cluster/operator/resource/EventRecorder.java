/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Records Kubernetes events about a resource
 */
public interface EventRecorder {
    /**
     * Event type of informational events
     */
    String NORMAL = "Normal";

    /**
     * Event type of events reporting a problem
     */
    String WARNING = "Warning";

    /**
     * Records an event. Failures are logged and never thrown.
     *
     * @param target    Resource the event is about
     * @param type      {@link #NORMAL} or {@link #WARNING}
     * @param reason    Short CamelCase reason
     * @param message   Human readable message
     */
    void event(HasMetadata target, String type, String reason, String message);
}
