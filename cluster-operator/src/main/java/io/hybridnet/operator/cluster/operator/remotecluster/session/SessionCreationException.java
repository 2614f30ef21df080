/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster.session;

/**
 * Thrown when a session cannot be created from the connection configuration of a remote cluster
 */
public class SessionCreationException extends Exception {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param message   Error message
     */
    public SessionCreationException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Error message
     * @param cause     Cause
     */
    public SessionCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
