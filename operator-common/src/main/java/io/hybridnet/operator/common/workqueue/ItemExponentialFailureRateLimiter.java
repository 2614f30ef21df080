/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.common.workqueue;

import java.util.HashMap;
import java.util.Map;

/**
 * Rate limiter doubling the delay of an item on every failure: baseDelay * 2^failures, capped at maxDelay.
 *
 * @param <T>   Type of the items
 */
public class ItemExponentialFailureRateLimiter<T> implements RateLimiter<T> {
    private final Map<T, Integer> failures = new HashMap<>();
    private final long baseDelayMs;
    private final long maxDelayMs;

    /**
     * Constructor
     *
     * @param baseDelayMs   Delay after the first failure
     * @param maxDelayMs    Upper bound of the delay
     */
    public ItemExponentialFailureRateLimiter(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Base delay must be positive and not greater than the maximum delay");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public synchronized long when(T item) {
        int exp = failures.getOrDefault(item, 0);
        failures.put(item, exp + 1);

        double backoff = baseDelayMs * Math.pow(2, exp);
        return backoff > maxDelayMs ? maxDelayMs : (long) backoff;
    }

    @Override
    public synchronized void forget(T item) {
        failures.remove(item);
    }

    @Override
    public synchronized int numRequeues(T item) {
        return failures.getOrDefault(item, 0);
    }
}
