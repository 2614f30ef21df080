/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.common.workqueue;

/**
 * Decides how long an item has to wait before it is processed again after a failure
 *
 * @param <T>   Type of the items
 */
public interface RateLimiter<T> {
    /**
     * Records another failure of the item and returns how long it should wait
     *
     * @param item  The failed item
     *
     * @return  Delay in milliseconds
     */
    long when(T item);

    /**
     * Forgets the failure history of the item, typically after it was processed successfully
     *
     * @param item  The item
     */
    void forget(T item);

    /**
     * @param item  The item
     *
     * @return  How many times the item failed since it was last forgotten
     */
    int numRequeues(T item);
}
