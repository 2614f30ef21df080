/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.common;

import io.fabric8.kubernetes.client.KubernetesClientException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.HttpURLConnection;
import java.util.concurrent.Callable;

/**
 * Runs a write against the Kubernetes API again when it fails with a 409 Conflict, following a {@link RetryPolicy}.
 * Any other error, or a conflict on the last attempt, is thrown to the caller.
 */
public class RetryOnConflict {
    private static final Logger LOGGER = LogManager.getLogger(RetryOnConflict.class);

    private RetryOnConflict() {
        // Static utility
    }

    /**
     * Checks if the error is an optimistic concurrency conflict reported by the API server
     *
     * @param error     Error to check
     *
     * @return  True for a Kubernetes client error with HTTP code 409
     */
    public static boolean isConflict(Throwable error) {
        return error instanceof KubernetesClientException
                && ((KubernetesClientException) error).getCode() == HttpURLConnection.HTTP_CONFLICT;
    }

    /**
     * Runs the operation, retrying on conflicts
     *
     * @param policy        Retry policy
     * @param description   Description of the operation used in log messages
     * @param operation     The operation
     *
     * @param <T>   Result type of the operation
     *
     * @return  Result of the first successful attempt
     *
     * @throws Exception            The last conflict, or the first error which is not a conflict
     */
    public static <T> T retry(RetryPolicy policy, String description, Callable<T> operation) throws Exception {
        for (int attempt = 0; ; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                if (!isConflict(e) || attempt + 1 >= policy.steps()) {
                    throw e;
                }

                long delay = policy.delayMs(attempt);
                LOGGER.debug("Conflict during {} (attempt {} of {}), retrying in {}ms", description, attempt + 1, policy.steps(), delay);
                Thread.sleep(delay);
            }
        }
    }
}
