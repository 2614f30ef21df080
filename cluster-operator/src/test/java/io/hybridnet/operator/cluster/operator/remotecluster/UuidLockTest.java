/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class UuidLockTest {
    @Test
    public void testLockIsIdempotentForTheSameOwner() throws UuidConflictException {
        UuidLock lock = new UuidLock();

        lock.lockByOwner("u1", "cluster-a");
        lock.lockByOwner("u1", "cluster-a");

        assertThat(lock.ownerOf("u1"), is("cluster-a"));
        assertThat(lock.size(), is(1));
    }

    @Test
    public void testConflictingClaimIsRejected() throws UuidConflictException {
        UuidLock lock = new UuidLock();
        lock.lockByOwner("u1", "cluster-a");

        UuidConflictException e = assertThrows(UuidConflictException.class, () -> lock.lockByOwner("u1", "cluster-b"));

        assertThat(e.getUuid(), is("u1"));
        assertThat(e.getOwner(), is("cluster-a"));
        assertThat(lock.ownerOf("u1"), is("cluster-a"));
    }

    @Test
    public void testNewClaimKeepsThePreviousUuid() throws UuidConflictException {
        UuidLock lock = new UuidLock();
        lock.lockByOwner("u1", "cluster-a");
        lock.lockByOwner("u2", "cluster-a");

        assertThat(lock.ownerOf("u1"), is("cluster-a"));
        assertThat(lock.ownerOf("u2"), is("cluster-a"));
        assertThat(lock.size(), is(2));

        UuidConflictException e = assertThrows(UuidConflictException.class, () -> lock.lockByOwner("u1", "cluster-b"));
        assertThat(e.getOwner(), is("cluster-a"));
    }

    @Test
    public void testUnlockReleasesAllUuidsOfTheOwner() throws UuidConflictException {
        UuidLock lock = new UuidLock();
        lock.lockByOwner("u1", "cluster-a");
        lock.lockByOwner("u2", "cluster-a");
        lock.lockByOwner("u3", "cluster-b");

        assertThat(lock.unlockByOwner("cluster-a"), is(Set.of("u1", "u2")));
        assertThat(lock.unlockByOwner("cluster-a").isEmpty(), is(true));
        assertThat(lock.unlockByOwner("unknown").isEmpty(), is(true));
        assertThat(lock.size(), is(1));
        assertThat(lock.ownerOf("u3"), is("cluster-b"));

        lock.lockByOwner("u1", "cluster-b");
        assertThat(lock.ownerOf("u1"), is("cluster-b"));
    }

    @Test
    public void testEmptyArgumentsAreRejected() {
        UuidLock lock = new UuidLock();

        assertThrows(IllegalArgumentException.class, () -> lock.lockByOwner("", "cluster-a"));
        assertThrows(IllegalArgumentException.class, () -> lock.lockByOwner(null, "cluster-a"));
        assertThrows(IllegalArgumentException.class, () -> lock.lockByOwner("u1", ""));
        assertThat(lock.size(), is(0));
    }

    @Test
    public void testConcurrentClaimsHaveSingleWinner() throws Exception {
        UuidLock lock = new UuidLock();
        int claimants = 8;
        ExecutorService executor = Executors.newFixedThreadPool(claimants);
        CountDownLatch go = new CountDownLatch(1);

        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < claimants; i++) {
                String owner = "cluster-" + i;
                results.add(executor.submit(() -> {
                    go.await();
                    try {
                        lock.lockByOwner("u1", owner);
                        return true;
                    } catch (UuidConflictException e) {
                        return false;
                    }
                }));
            }

            go.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }

            assertThat(winners, is(1));
            assertThat(lock.size(), is(1));
        } finally {
            executor.shutdownNow();
        }
    }
}
