/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

/**
 * Thrown when the remote cluster controller cannot start
 */
public class ControllerStartupException extends Exception {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param message   Error message
     */
    public ControllerStartupException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Error message
     * @param cause     Cause
     */
    public ControllerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
