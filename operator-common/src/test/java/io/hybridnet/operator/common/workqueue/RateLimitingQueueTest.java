/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.common.workqueue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

public class RateLimitingQueueTest {
    private RateLimitingQueue<String> queue;

    @BeforeEach
    public void setUp() {
        queue = new RateLimitingQueue<>("test", new ItemExponentialFailureRateLimiter<>(5, 1000));
    }

    @AfterEach
    public void tearDown() {
        queue.shutDown();
    }

    @Test
    public void testDuplicateAddsAreCollapsed() throws InterruptedException {
        queue.add("cluster-a");
        queue.add("cluster-a");
        queue.add("cluster-b");

        assertThat(queue.len(), is(2));
        assertThat(queue.take(), is("cluster-a"));
        assertThat(queue.take(), is("cluster-b"));
        assertThat(queue.len(), is(0));
    }

    @Test
    public void testItemAddedWhileProcessingIsQueuedAfterDone() throws InterruptedException {
        queue.add("cluster-a");
        String item = queue.take();

        queue.add("cluster-a");
        assertThat("Item being processed must not be handed out twice", queue.len(), is(0));

        queue.done(item);
        assertThat(queue.len(), is(1));
        assertThat(queue.take(), is("cluster-a"));
    }

    @Test
    public void testRateLimitedItemIsAddedAfterDelay() throws Exception {
        queue.addRateLimited("cluster-a");
        assertThat(queue.numRequeues("cluster-a"), is(1));

        String item = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }).get(5, TimeUnit.SECONDS);

        assertThat(item, is("cluster-a"));

        queue.forget("cluster-a");
        assertThat(queue.numRequeues("cluster-a"), is(0));
    }

    @Test
    public void testShutDownReleasesWaitingWorker() throws Exception {
        CompletableFuture<String> worker = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return "interrupted";
            }
        });

        queue.shutDown();

        assertThat(worker.get(5, TimeUnit.SECONDS), is(nullValue()));
        assertThat(queue.isShuttingDown(), is(true));
    }

    @Test
    public void testAddAfterShutDownIsIgnored() throws InterruptedException {
        queue.shutDown();
        queue.add("cluster-a");
        queue.addRateLimited("cluster-b");

        assertThat(queue.len(), is(0));
        assertThat(queue.take(), is(nullValue()));
    }
}
