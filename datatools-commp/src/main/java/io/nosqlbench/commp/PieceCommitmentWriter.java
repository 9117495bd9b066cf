package io.nosqlbench.commp;

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

import io.nosqlbench.commp.leaf.LeafCommitmentTask;
import io.nosqlbench.commp.leaf.LeafResult;
import io.nosqlbench.commp.pool.SegmentBufferPool;
import io.nosqlbench.commp.tree.TreeAggregator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.SelectableChannel;
import java.nio.channels.WritableByteChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Computes the piece commitment (commP) of a byte stream of any length while it is written.
 *
 * <p>Bytes are collected into segments of {@link CommPConfig#unpaddedSegmentSize()} bytes.
 * Every full segment is copied into a buffer leased from a {@link SegmentBufferPool} and
 * committed to on a worker thread, so at most {@link CommPConfig#concurrency()} segments
 * are hashed at once and memory use does not grow with the stream. When all segments are
 * busy, {@code write} waits for one to finish. {@link #sum()} then combines the segment
 * commitments, in stream order, into the commitment of the whole piece.</p>
 *
 * <p>The result depends only on the bytes written, never on how they were split into
 * writes or on the concurrency limit.</p>
 *
 * <pre>{@code
 * try (PieceCommitmentWriter writer = new PieceCommitmentWriter()) {
 *     writer.write(data);
 *     DataCidSize result = writer.sum();
 * }
 * }</pre>
 *
 * <p>A writer serves one stream: it is written to from a single thread, finalized once,
 * and then rejects further use.</p>
 */
public final class PieceCommitmentWriter implements WritableByteChannel {
    private static final Logger logger = LogManager.getLogger(PieceCommitmentWriter.class);

    /// Bytes requested per read by {@link #sumOf(ReadableByteChannel, CommPConfig)}
    public static final int DEFAULT_READ_SIZE = 1 << 20;

    private final CommPConfig config;
    private final int segmentSize;
    private final byte[] scratch;
    private final SegmentBufferPool pool;
    private final List<CompletableFuture<LeafResult>> leaves = new ArrayList<>();

    private long length;
    private boolean finalized;
    private boolean closed;

    /**
     * Creates a writer with {@link CommPConfig#defaults()}.
     */
    public PieceCommitmentWriter() {
        this(CommPConfig.defaults());
    }

    /**
     * @param config segment size, concurrency limit and primitives to use
     */
    public PieceCommitmentWriter(CommPConfig config) {
        this.config = config;
        this.segmentSize = config.unpaddedSegmentSize();
        this.scratch = new byte[segmentSize];
        this.pool = new SegmentBufferPool(config.concurrency(), segmentSize, "commp");
        logger.debug("commP writer with {}", config);
    }

    /**
     * Computes the piece commitment of everything readable from a channel.
     *
     * @param source the bytes to commit to, in blocking mode; read to its end but not closed
     * @param config settings for the computation
     * @return the piece commitment
     * @throws InputReadException if reading the source fails
     * @throws InterruptedException if interrupted while writing or waiting for segments
     */
    public static DataCidSize sumOf(ReadableByteChannel source, CommPConfig config) throws InterruptedException {
        return sumOf(source, config, DEFAULT_READ_SIZE);
    }

    /**
     * Computes the piece commitment of everything readable from a channel.
     *
     * @param source the bytes to commit to, in blocking mode; read to its end but not closed
     * @param config settings for the computation
     * @param readSize the most bytes requested from the source at a time
     * @return the piece commitment
     * @throws IllegalArgumentException if the source is a selectable channel in non-blocking mode
     * @throws InputReadException if reading the source fails
     * @throws InterruptedException if interrupted while writing or waiting for segments
     */
    public static DataCidSize sumOf(ReadableByteChannel source, CommPConfig config, int readSize)
        throws InterruptedException {
        if (readSize < 1) {
            throw new IllegalArgumentException("read size must be positive, got " + readSize);
        }
        // a non-blocking channel may return 0 forever
        if (source instanceof SelectableChannel && !((SelectableChannel) source).isBlocking()) {
            throw new IllegalArgumentException("source channel must be in blocking mode");
        }
        ByteBuffer buffer = ByteBuffer.allocate(readSize);
        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(config)) {
            while (true) {
                int read;
                try {
                    read = source.read(buffer);
                } catch (IOException e) {
                    throw new InputReadException("reading input after " + writer.payloadSize() + " bytes failed", e);
                }
                if (read < 0) {
                    break;
                }
                buffer.flip();
                writer.writeInterruptibly(buffer);
                buffer.clear();
            }
            return writer.sum();
        }
    }

    /**
     * @param data bytes to append to the stream
     * @return the number of bytes accepted, always {@code data.length}
     * @throws InterruptedIOException if interrupted while waiting for a free segment buffer
     */
    public int write(byte[] data) throws InterruptedIOException {
        return write(data, 0, data.length);
    }

    /**
     * @param data source array
     * @param offset first byte to append
     * @param count number of bytes to append
     * @return the number of bytes accepted, always {@code count}
     * @throws InterruptedIOException if interrupted while waiting for a free segment buffer;
     *                                {@code bytesTransferred} tells how many bytes were taken
     */
    public int write(byte[] data, int offset, int count) throws InterruptedIOException {
        if (offset < 0 || count < 0 || offset > data.length - count) {
            throw new IndexOutOfBoundsException(
                "range [" + offset + "," + (offset + count) + ") is outside a " + data.length + " byte array");
        }
        return write(ByteBuffer.wrap(data, offset, count));
    }

    /**
     * Appends the remaining bytes of a buffer, advancing its position.
     *
     * @param src bytes to append
     * @return the number of bytes accepted, all of those remaining
     * @throws InterruptedIOException if interrupted while waiting for a free segment buffer;
     *                                the buffer position marks how far writing got
     */
    @Override
    public int write(ByteBuffer src) throws InterruptedIOException {
        ensureWritable();
        int count = src.remaining();
        try {
            writeInterruptibly(src);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException(
                "interrupted waiting for a free segment buffer at byte " + length);
            interrupted.bytesTransferred = count - src.remaining();
            interrupted.initCause(e);
            throw interrupted;
        }
        return count;
    }

    private void writeInterruptibly(ByteBuffer src) throws InterruptedException {
        ensureWritable();
        while (src.hasRemaining()) {
            int buffered = (int) (length % segmentSize);
            int toBuffer = Math.min(segmentSize - buffered, src.remaining());
            if (buffered + toBuffer == segmentSize) {
                // lease first, so an interrupt leaves the segment unconsumed
                SegmentBufferPool.Lease lease = pool.acquire();
                src.get(scratch, buffered, toBuffer);
                length += toBuffer;
                dispatch(lease);
            } else {
                src.get(scratch, buffered, toBuffer);
                length += toBuffer;
            }
        }
    }

    private void dispatch(SegmentBufferPool.Lease lease) {
        int index = leaves.size();
        System.arraycopy(scratch, 0, lease.buffer(), 0, segmentSize);
        LeafCommitmentTask task = new LeafCommitmentTask(index, segmentSize, config.leafHasher(), config.commitmentEncoder());
        leaves.add(pool.dispatch(lease, task));
        logger.trace("dispatched segment {} on buffer {}", index, lease.index());
    }

    /**
     * Finalizes the stream and returns its piece commitment. Waits for every segment still
     * being hashed. May be called once; the writer accepts nothing afterwards.
     *
     * @return payload size, piece size and piece commitment of the stream
     * @throws LeafComputationException if a segment could not be committed to, for the first such segment
     * @throws MerkleGenerationException if the segment commitments cannot be combined
     * @throws EmptyPayloadException if nothing was written
     * @throws InterruptedException if interrupted while waiting for segments
     */
    public DataCidSize sum() throws InterruptedException {
        ensureWritable();
        finalized = true;
        logger.debug("finalizing {} bytes: {} segments dispatched, {} trailing bytes",
            length, leaves.size(), length % segmentSize);
        try {
            return new TreeAggregator(config).aggregate(leaves, scratch, (int) (length % segmentSize), length);
        } finally {
            pool.close();
        }
    }

    /**
     * @return the number of bytes written so far
     */
    public long payloadSize() {
        return length;
    }

    /**
     * @return the number of full segments handed to workers so far
     */
    public int dispatchedSegments() {
        return leaves.size();
    }

    /**
     * @return an output stream appending to this writer; closing the stream does not finalize it
     */
    public OutputStream asOutputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                PieceCommitmentWriter.this.write(new byte[]{(byte) b}, 0, 1);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                PieceCommitmentWriter.this.write(b, off, len);
            }
        };
    }

    @Override
    public boolean isOpen() {
        return !closed && !finalized;
    }

    /**
     * Releases the worker threads. Segments already dispatched finish in the background;
     * an unfinalized stream is abandoned.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            pool.close();
        }
    }

    private void ensureWritable() {
        if (finalized) {
            throw new IllegalStateException("commP writer was already finalized; use a new writer for a new stream");
        }
        if (closed) {
            throw new IllegalStateException("commP writer is closed");
        }
    }
}
