/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry policy with an exponential, jittered delay between attempts.
 */
public class RetryPolicy {
    /**
     * Policy used for status writes which can collide with other writers: 5 attempts, 10ms apart, 10% jitter
     */
    public static final RetryPolicy DEFAULT_CONFLICT_RETRY = new RetryPolicy(5, 10L, 1.0, 0.1);

    private final int steps;
    private final long initialDelayMs;
    private final double factor;
    private final double jitter;

    /**
     * Constructor
     *
     * @param steps             Maximum number of attempts (at least 1)
     * @param initialDelayMs    Delay before the second attempt
     * @param factor            Multiplier applied to the delay after every attempt
     * @param jitter            Fraction of the delay randomly added to it
     */
    public RetryPolicy(int steps, long initialDelayMs, double factor, double jitter) {
        if (steps < 1) {
            throw new IllegalArgumentException("At least one attempt is required");
        }
        if (initialDelayMs < 0 || factor < 1.0 || jitter < 0) {
            throw new IllegalArgumentException("Delay, factor and jitter must not shrink the delay");
        }

        this.steps = steps;
        this.initialDelayMs = initialDelayMs;
        this.factor = factor;
        this.jitter = jitter;
    }

    /**
     * @return  Maximum number of attempts
     */
    public int steps() {
        return steps;
    }

    /**
     * Delay to wait after the given (zero based) failed attempt
     *
     * @param attempt   Number of the failed attempt
     *
     * @return  Delay in milliseconds
     */
    public long delayMs(int attempt) {
        double delay = initialDelayMs * Math.pow(factor, attempt);
        if (jitter > 0) {
            delay += delay * jitter * ThreadLocalRandom.current().nextDouble();
        }
        return (long) delay;
    }
}
