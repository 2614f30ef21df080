/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.common;

/**
 * Thrown when the operator configuration is not valid
 */
public class InvalidConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param message   Description of the invalid configuration
     */
    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Description of the invalid configuration
     * @param cause     The original error
     */
    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
