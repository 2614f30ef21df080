/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.api.networking.model.network;

/**
 * Types of Hybridnet networks
 */
public final class NetworkType {
    public static final String UNDERLAY = "Underlay";
    public static final String OVERLAY = "Overlay";

    private NetworkType() {
        // Constants only
    }
}
