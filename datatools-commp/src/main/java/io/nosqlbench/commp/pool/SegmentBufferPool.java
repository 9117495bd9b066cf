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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/// A fixed arena of segment buffers, and the worker threads that hash them.
///
/// The pool holds exactly `capacity` buffers, allocated up front and tracked by index
/// in a blocking free-list. A caller {@link #acquire() acquires} a {@link Lease},
/// copies a segment into the leased buffer and {@link #dispatch dispatches} work against
/// it. The lease goes back to the free-list when the work exits, however it exits, so
/// at most `capacity` segments are ever in flight and {@link #acquire()} is where a
/// producer that runs ahead of the workers waits.
///
/// ```
/// try (SegmentBufferPool pool = new SegmentBufferPool(4, segmentSize, "commp")) {
///     SegmentBufferPool.Lease lease = pool.acquire();
///     System.arraycopy(segment, 0, lease.buffer(), 0, segmentSize);
///     CompletableFuture<byte[]> digest = pool.dispatch(lease, buffer -> hash(buffer));
/// }
/// ```
public final class SegmentBufferPool implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(SegmentBufferPool.class);

    private final byte[][] buffers;
    private final BlockingQueue<Integer> free;
    private final ExecutorService workers;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /// @param capacity number of buffers, which is also the number of worker threads
    /// @param bufferSize size of each buffer in bytes
    /// @param name prefix for worker thread names
    public SegmentBufferPool(int capacity, int bufferSize, String name) {
        if (capacity < 1) {
            throw new IllegalArgumentException("pool capacity must be at least 1, got " + capacity);
        }
        if (bufferSize < 1) {
            throw new IllegalArgumentException("buffer size must be positive, got " + bufferSize);
        }
        this.buffers = new byte[capacity][bufferSize];
        this.free = new ArrayBlockingQueue<>(capacity);
        for (int i = 0; i < capacity; i++) {
            free.add(i);
        }

        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(capacity, r -> {
            Thread t = new Thread(r);
            t.setName(name + "-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        logger.debug("Created segment buffer pool '{}' with {} buffers of {} bytes", name, capacity, bufferSize);
    }

    /// Blocks until a buffer is free and leases it to the caller.
    /// @return the lease, which must be closed or handed to {@link #dispatch}
    /// @throws InterruptedException if interrupted while waiting
    /// @throws IllegalStateException if the pool is closed
    public Lease acquire() throws InterruptedException {
        if (closed.get()) {
            throw new IllegalStateException("segment buffer pool is closed");
        }
        int index = free.take();
        return new Lease(index);
    }

    /// Runs work against a leased buffer on a worker thread. Ownership of the lease moves
    /// to the work, which releases it on exit. If the work cannot be scheduled the
    /// lease is released before the rejection propagates.
    /// @param lease a lease from this pool
    /// @param work the computation over the leased buffer
    /// @param <T> result type
    /// @return the future result of the work
    public <T> CompletableFuture<T> dispatch(Lease lease, Function<byte[], T> work) {
        if (lease.owner() != this) {
            throw new IllegalArgumentException("lease " + lease.index() + " belongs to another pool");
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                try (lease) {
                    return work.apply(lease.buffer());
                }
            }, workers);
        } catch (RejectedExecutionException e) {
            lease.close();
            throw e;
        }
    }

    /// @return the total number of buffers
    public int capacity() {
        return buffers.length;
    }

    /// @return the number of buffers not currently leased
    public int available() {
        return free.size();
    }

    /// @return the size of each buffer
    public int bufferSize() {
        return buffers[0].length;
    }

    /// Stops accepting work. Work already dispatched runs to completion.
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            workers.shutdown();
            logger.debug("Closed segment buffer pool with {} of {} buffers free", free.size(), buffers.length);
        }
    }

    /// Exclusive use of one pooled buffer until closed. Closing more than once is harmless.
    public final class Lease implements AutoCloseable {
        private final int index;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Lease(int index) {
            this.index = index;
        }

        /// @return the position of the leased buffer in the pool
        public int index() {
            return index;
        }

        /// @return the leased buffer
        /// @throws IllegalStateException if the lease was already released
        public byte[] buffer() {
            if (released.get()) {
                throw new IllegalStateException("buffer " + index + " has already been returned to the pool");
            }
            return buffers[index];
        }

        private SegmentBufferPool owner() {
            return SegmentBufferPool.this;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                free.add(index);
            }
        }
    }
}
