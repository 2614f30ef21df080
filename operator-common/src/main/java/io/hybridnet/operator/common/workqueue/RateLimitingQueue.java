/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.common.workqueue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Work queue for level triggered controllers.
 *
 * <ul>
 *     <li>An item is queued at most once, adding it again while it waits has no effect.</li>
 *     <li>An item is never handed to two workers at the same time. When it is added while being processed, it is
 *     queued again once the worker calls {@link #done(Object)}.</li>
 *     <li>Failed items can be added back after a delay computed by a {@link RateLimiter}.</li>
 * </ul>
 *
 * Every item returned by {@link #take()} must be passed to {@link #done(Object)} when its processing finished.
 *
 * @param <T>   Type of the items, usually resource names
 */
public class RateLimitingQueue<T> {
    private static final Logger LOGGER = LogManager.getLogger(RateLimitingQueue.class);

    private final String name;
    private final RateLimiter<T> rateLimiter;
    private final ScheduledExecutorService delayer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<T> queue = new ArrayDeque<>();
    private final Set<T> dirty = new HashSet<>();
    private final Set<T> processing = new HashSet<>();
    private boolean shuttingDown = false;

    /**
     * Constructor
     *
     * @param name          Name of the queue used in logs and for the delay thread
     * @param rateLimiter   Rate limiter used by {@link #addRateLimited(Object)}
     */
    public RateLimitingQueue(String name, RateLimiter<T> rateLimiter) {
        this.name = name;
        this.rateLimiter = rateLimiter;
        this.delayer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name + "-queue-delay");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Adds the item to the queue
     *
     * @param item  Item to add
     */
    public void add(T item) {
        lock.lock();
        try {
            if (shuttingDown || !dirty.add(item)) {
                return;
            }

            if (!processing.contains(item)) {
                queue.addLast(item);
                notEmpty.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds the item once the delay passed
     *
     * @param item      Item to add
     * @param delayMs   Delay in milliseconds, the item is added immediately when it is not positive
     */
    public void addAfter(T item, long delayMs) {
        if (isShuttingDown()) {
            return;
        }

        if (delayMs <= 0) {
            add(item);
            return;
        }

        try {
            delayer.schedule(() -> add(item), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Queue {} is shutting down, item {} is not requeued", name, item);
        }
    }

    /**
     * Adds the item after the delay given by the rate limiter
     *
     * @param item  Item to add
     */
    public void addRateLimited(T item) {
        addAfter(item, rateLimiter.when(item));
    }

    /**
     * Clears the failure history of the item in the rate limiter
     *
     * @param item  The item
     */
    public void forget(T item) {
        rateLimiter.forget(item);
    }

    /**
     * @param item  The item
     *
     * @return  Number of rate limited requeues of the item since it was last forgotten
     */
    public int numRequeues(T item) {
        return rateLimiter.numRequeues(item);
    }

    /**
     * Blocks until an item is available and marks it as being processed
     *
     * @return  The next item, or null once the queue is shut down
     *
     * @throws InterruptedException When the waiting thread is interrupted
     */
    public T take() throws InterruptedException {
        lock.lock();
        try {
            while (queue.isEmpty() && !shuttingDown) {
                notEmpty.await();
            }

            if (queue.isEmpty()) {
                return null;
            }

            T item = queue.pollFirst();
            processing.add(item);
            dirty.remove(item);
            return item;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the processing of the item as finished. If the item was added meanwhile, it is queued again.
     *
     * @param item  The processed item
     */
    public void done(T item) {
        lock.lock();
        try {
            processing.remove(item);
            if (dirty.contains(item)) {
                queue.addLast(item);
                notEmpty.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return  Number of items waiting to be processed
     */
    public int len() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting items and wakes up all waiting workers. Items still queued are not handed out anymore.
     */
    public void shutDown() {
        lock.lock();
        try {
            shuttingDown = true;
            queue.clear();
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }

        delayer.shutdownNow();
        LOGGER.debug("Queue {} shut down", name);
    }

    /**
     * @return  True once {@link #shutDown()} was called
     */
    public boolean isShuttingDown() {
        lock.lock();
        try {
            return shuttingDown;
        } finally {
            lock.unlock();
        }
    }
}
