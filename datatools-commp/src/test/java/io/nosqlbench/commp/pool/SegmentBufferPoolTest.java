package io.nosqlbench.commp.pool;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SegmentBufferPoolTest {

    @Test
    void allocatesBuffersUpFront() {
        try (SegmentBufferPool pool = new SegmentBufferPool(3, 64, "test")) {
            assertEquals(3, pool.capacity());
            assertEquals(3, pool.available());
            assertEquals(64, pool.bufferSize());
        }
    }

    @Test
    void rejectsInvalidDimensions() {
        assertThrows(IllegalArgumentException.class, () -> new SegmentBufferPool(0, 64, "test"));
        assertThrows(IllegalArgumentException.class, () -> new SegmentBufferPool(2, 0, "test"));
    }

    @Test
    void leasesAreExclusiveAndReturnOnClose() throws InterruptedException {
        try (SegmentBufferPool pool = new SegmentBufferPool(2, 16, "test")) {
            SegmentBufferPool.Lease first = pool.acquire();
            SegmentBufferPool.Lease second = pool.acquire();
            assertNotEquals(first.index(), second.index());
            assertNotSame(first.buffer(), second.buffer());
            assertEquals(0, pool.available());

            first.close();
            first.close();
            assertEquals(1, pool.available());
            assertThrows(IllegalStateException.class, first::buffer);

            second.close();
            assertEquals(2, pool.available());
        }
    }

    @Test
    void acquireBlocksUntilALeaseIsReturned() throws Exception {
        try (SegmentBufferPool pool = new SegmentBufferPool(1, 16, "test")) {
            SegmentBufferPool.Lease held = pool.acquire();
            CountDownLatch acquired = new CountDownLatch(1);
            Thread waiter = new Thread(() -> {
                try (SegmentBufferPool.Lease lease = pool.acquire()) {
                    acquired.countDown();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            waiter.start();

            assertFalse(acquired.await(200, TimeUnit.MILLISECONDS), "acquire should wait while the only buffer is leased");
            held.close();
            assertTrue(acquired.await(5, TimeUnit.SECONDS), "acquire should proceed once the buffer is returned");
            waiter.join(5000);
        }
    }

    @Test
    void acquireIsInterruptible() throws Exception {
        try (SegmentBufferPool pool = new SegmentBufferPool(1, 16, "test")) {
            SegmentBufferPool.Lease held = pool.acquire();
            AtomicReference<Throwable> thrown = new AtomicReference<>();
            Thread waiter = new Thread(() -> {
                try {
                    pool.acquire();
                } catch (Throwable t) {
                    thrown.set(t);
                }
            });
            waiter.start();
            waiter.interrupt();
            waiter.join(5000);

            assertInstanceOf(InterruptedException.class, thrown.get());
            held.close();
        }
    }

    @Test
    void dispatchedWorkRunsOnNamedWorkersAndReleasesItsLease() throws Exception {
        try (SegmentBufferPool pool = new SegmentBufferPool(2, 8, "hashing")) {
            SegmentBufferPool.Lease lease = pool.acquire();
            lease.buffer()[0] = 42;

            CompletableFuture<String> result = pool.dispatch(lease,
                buffer -> Thread.currentThread().getName() + ":" + buffer[0]);

            String value = result.get(5, TimeUnit.SECONDS);
            assertTrue(value.startsWith("hashing-worker-"), value);
            assertTrue(value.endsWith(":42"), value);
            assertEquals(2, pool.available());
        }
    }

    @Test
    void failingWorkStillReleasesItsLease() throws Exception {
        try (SegmentBufferPool pool = new SegmentBufferPool(1, 8, "test")) {
            CompletableFuture<Object> result = pool.dispatch(pool.acquire(), buffer -> {
                throw new IllegalStateException("boom");
            });

            ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, e.getCause());
            assertEquals(1, pool.available());
        }
    }

    @Test
    void inFlightWorkNeverExceedsCapacity() throws Exception {
        int capacity = 3;
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<CompletableFuture<Integer>> results = new ArrayList<>();

        try (SegmentBufferPool pool = new SegmentBufferPool(capacity, 8, "test")) {
            for (int i = 0; i < 20; i++) {
                int task = i;
                results.add(pool.dispatch(pool.acquire(), buffer -> {
                    peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                    try {
                        Thread.sleep(5);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    running.decrementAndGet();
                    return task;
                }));
            }
            for (int i = 0; i < results.size(); i++) {
                assertEquals(i, results.get(i).get(5, TimeUnit.SECONDS));
            }
        }
        assertTrue(peak.get() <= capacity, "peak concurrency " + peak.get());
    }

    @Test
    void leasesFromAnotherPoolAreRefused() throws InterruptedException {
        try (SegmentBufferPool one = new SegmentBufferPool(1, 8, "one");
             SegmentBufferPool two = new SegmentBufferPool(1, 8, "two")) {
            SegmentBufferPool.Lease lease = one.acquire();
            assertThrows(IllegalArgumentException.class, () -> two.dispatch(lease, buffer -> buffer.length));
            lease.close();
        }
    }

    @Test
    void closedPoolRefusesWork() throws InterruptedException {
        SegmentBufferPool pool = new SegmentBufferPool(1, 8, "test");
        SegmentBufferPool.Lease lease = pool.acquire();
        pool.close();
        pool.close();

        assertThrows(IllegalStateException.class, pool::acquire);
        assertThrows(RejectedExecutionException.class, () -> pool.dispatch(lease, buffer -> buffer.length));
        assertEquals(1, pool.available(), "a rejected dispatch returns its lease");
    }
}
