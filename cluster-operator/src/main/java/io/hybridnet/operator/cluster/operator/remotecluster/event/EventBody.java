/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster.event;

/**
 * Kubernetes event to record against a remote cluster
 *
 * @param type      Event type (Normal or Warning)
 * @param reason    Short CamelCase reason
 * @param message   Human readable message
 */
public record EventBody(String type, String reason, String message) { }
