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

import io.nosqlbench.commp.cid.CommCid;
import io.nosqlbench.commp.hash.Fr32CommPHasher;
import io.nosqlbench.commp.hash.LeafDigest;
import io.nosqlbench.commp.hash.LeafHasher;
import io.nosqlbench.commp.hash.SealProof;
import io.nosqlbench.commp.hash.ZeroComm;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.Pipe;
import java.nio.channels.ReadableByteChannel;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PieceCommitmentWriterTest {

    /// 1 KiB padded segments keep multi-segment streams small
    private static final long PADDED_SEGMENT = 1024;
    private static final int SEGMENT = 1016;

    private static CommPConfig small(int concurrency) {
        return CommPConfig.builder()
            .concurrency(concurrency)
            .paddedSegmentSize(PADDED_SEGMENT)
            .build();
    }

    private static byte[] random(int length, long seed) {
        byte[] data = new byte[length];
        new Random(seed).nextBytes(data);
        return data;
    }

    /// Segments line up with whole fr32 quads, so committing to the payload in one pass
    /// builds the same tree as committing per segment and combining.
    private static DataCidSize reference(byte[] data) {
        LeafDigest digest = Fr32CommPHasher.INSTANCE.digest(data, 0, data.length);
        return new DataCidSize(data.length, digest.paddedSize(), CommCid.pieceCommitmentToCid(digest.commitment()));
    }

    private static DataCidSize commit(byte[] data, CommPConfig config, int chunk) throws Exception {
        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(config)) {
            for (int offset = 0; offset < data.length; offset += chunk) {
                int count = Math.min(chunk, data.length - offset);
                assertEquals(count, writer.write(data, offset, count));
            }
            return writer.sum();
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {65, 127, 500, SEGMENT - 1, SEGMENT, SEGMENT + 1, 2 * SEGMENT, 3 * SEGMENT, 3 * SEGMENT + 17, 5 * SEGMENT - 3, 8 * SEGMENT, 9 * SEGMENT + 100})
    void matchesASinglePassCommitment(int length) throws Exception {
        byte[] data = random(length, length);
        DataCidSize result = commit(data, small(4), length);

        assertEquals(reference(data), result);
        assertEquals(length, result.payloadSize());
    }

    @Test
    void resultDoesNotDependOnChunkingOrConcurrency() throws Exception {
        byte[] data = random(6 * SEGMENT + 333, 42);
        DataCidSize expected = reference(data);

        for (int concurrency : new int[]{1, 2, 8}) {
            for (int chunk : new int[]{1, 7, 1000, SEGMENT, data.length}) {
                assertEquals(expected, commit(data, small(concurrency), chunk),
                    "concurrency " + concurrency + ", chunk " + chunk);
            }
        }
    }

    @Test
    void shortPayloadIsCommittedDirectly() throws Exception {
        byte[] data = random(300, 1);
        DataCidSize result = commit(data, small(2), 300);

        assertEquals(300, result.payloadSize());
        assertEquals(512, result.pieceSize());
        assertEquals(reference(data).pieceCid(), result.pieceCid());
    }

    @Test
    void oneZeroSegmentIsTheZeroPiece() throws Exception {
        DataCidSize result = commit(new byte[SEGMENT], small(2), SEGMENT);

        assertEquals(ZeroComm.INSTANCE.zeroPieceCommitment(SEGMENT), result.pieceCid());
        assertEquals(PADDED_SEGMENT, result.pieceSize());
    }

    @Test
    void twoSegmentsFromSeparateWrites() throws Exception {
        byte[] data = random(2 * SEGMENT, 2);
        DataCidSize result;
        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(small(2))) {
            writer.write(Arrays.copyOfRange(data, 0, SEGMENT));
            writer.write(Arrays.copyOfRange(data, SEGMENT, 2 * SEGMENT));
            assertEquals(2, writer.dispatchedSegments());
            result = writer.sum();
        }
        assertEquals(2 * PADDED_SEGMENT, result.pieceSize());
        assertEquals(reference(data), result);
    }

    @Test
    void oneByteOverASegmentDoublesThePiece() throws Exception {
        byte[] data = random(SEGMENT + 1, 3);
        DataCidSize result = commit(data, small(2), 100);

        assertEquals(SEGMENT + 1, result.payloadSize());
        assertEquals(2 * PADDED_SEGMENT, result.pieceSize());
        assertEquals(reference(data).pieceCid(), result.pieceCid());
    }

    @Test
    void threeSegmentsAreClosedWithAZeroLeaf() throws Exception {
        byte[] data = random(3 * SEGMENT, 4);
        DataCidSize result = commit(data, small(3), 4096);

        assertEquals(4 * PADDED_SEGMENT, result.pieceSize());
        assertEquals(reference(data).pieceCid(), result.pieceCid());
    }

    @Test
    void byteBufferAndOutputStreamWritesAgree() throws Exception {
        byte[] data = random(4 * SEGMENT + 50, 5);
        DataCidSize expected = reference(data);

        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(small(2))) {
            ByteBuffer buffer = ByteBuffer.wrap(data);
            assertEquals(data.length, writer.write(buffer));
            assertFalse(buffer.hasRemaining());
            assertEquals(expected, writer.sum());
        }

        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(small(2))) {
            OutputStream out = writer.asOutputStream();
            out.write(data[0]);
            out.write(data, 1, data.length - 1);
            out.close();
            assertEquals(data.length, writer.payloadSize());
            assertEquals(expected, writer.sum());
        }
    }

    @Test
    void channelHelperReadsToTheEnd() throws Exception {
        byte[] data = random(7 * SEGMENT + 9, 6);
        ReadableByteChannel channel = Channels.newChannel(new ByteArrayInputStream(data));

        assertEquals(reference(data), PieceCommitmentWriter.sumOf(channel, small(3)));
    }

    @Test
    void channelReadFailureIsAnInputFailure() {
        ReadableByteChannel failing = new ReadableByteChannel() {
            private int reads;

            @Override
            public int read(ByteBuffer dst) throws IOException {
                if (reads++ > 0) {
                    throw new IOException("disk went away");
                }
                dst.put(new byte[100]);
                return 100;
            }

            @Override
            public boolean isOpen() {
                return true;
            }

            @Override
            public void close() {
            }
        };

        InputReadException e = assertThrows(InputReadException.class, () -> PieceCommitmentWriter.sumOf(failing, small(1)));
        assertEquals("disk went away", e.getCause().getMessage());
        assertTrue(e.getMessage().contains("100"), e.getMessage());
    }

    @Test
    void emptyStreamHasNoCommitment() {
        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(small(1))) {
            assertThrows(EmptyPayloadException.class, writer::sum);
        }
    }

    @Test
    void tooShortStreamFailsAtTheFirstLeaf() throws Exception {
        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(small(1))) {
            writer.write(new byte[64]);
            LeafComputationException e = assertThrows(LeafComputationException.class, writer::sum);
            assertEquals(0, e.getSegmentIndex());
            assertTrue(e.getMessage().startsWith("processing leaf 0: "), e.getMessage());
        }
    }

    @Test
    void earliestFailedSegmentIsReported() throws Exception {
        // segment 0 is slow, segments 2 and 4 fail fast
        LeafHasher hasher = (data, offset, length) -> {
            switch (data[offset]) {
                case 1:
                    sleep(100);
                    break;
                case 2:
                case 4:
                    throw new IllegalStateException("bad segment " + data[offset]);
                default:
                    break;
            }
            return Fr32CommPHasher.INSTANCE.digest(data, offset, length);
        };
        CommPConfig config = small(4).toBuilder().leafHasher(hasher).build();

        byte[] data = new byte[6 * SEGMENT];
        data[0] = 1;
        data[2 * SEGMENT] = 2;
        data[4 * SEGMENT] = 4;

        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(config)) {
            writer.write(data);
            LeafComputationException e = assertThrows(LeafComputationException.class, writer::sum);
            assertEquals(2, e.getSegmentIndex());
            assertEquals("bad segment 2", e.getCause().getMessage());
        }
    }

    @Test
    void hashingNeverExceedsTheConcurrencyLimit() throws Exception {
        int limit = 3;
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        LeafHasher hasher = (data, offset, length) -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                sleep(5);
                return Fr32CommPHasher.INSTANCE.digest(data, offset, length);
            } finally {
                running.decrementAndGet();
            }
        };
        CommPConfig config = small(limit).toBuilder().leafHasher(hasher).build();

        byte[] data = random(20 * SEGMENT, 7);
        DataCidSize result = commit(data, config, 3000);

        assertEquals(reference(data), result);
        assertTrue(peak.get() <= limit, "peak concurrency " + peak.get());
        assertTrue(peak.get() >= 1);
    }

    @Test
    void writeWaitsForAFreeSegmentBuffer() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        LeafHasher blocking = (data, offset, length) -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Fr32CommPHasher.INSTANCE.digest(data, offset, length);
        };
        CommPConfig config = small(2).toBuilder().leafHasher(blocking).build();
        byte[] data = random(3 * SEGMENT, 8);

        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(config)) {
            CountDownLatch written = new CountDownLatch(1);
            Thread producer = new Thread(() -> {
                try {
                    writer.write(data);
                    written.countDown();
                } catch (InterruptedIOException e) {
                    Thread.currentThread().interrupt();
                }
            });
            producer.start();

            assertFalse(written.await(300, TimeUnit.MILLISECONDS), "the third segment should wait for a buffer");
            release.countDown();
            assertTrue(written.await(10, TimeUnit.SECONDS));
            producer.join(5000);

            assertEquals(reference(data), writer.sum());
        }
    }

    @Test
    void interruptedWriteReportsTheBytesTaken() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        LeafHasher blocking = (data, offset, length) -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Fr32CommPHasher.INSTANCE.digest(data, offset, length);
        };
        CommPConfig config = small(1).toBuilder().leafHasher(blocking).build();

        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(config)) {
            writer.write(new byte[SEGMENT + 10]);

            AtomicReference<InterruptedIOException> thrown = new AtomicReference<>();
            AtomicReference<Boolean> stillInterrupted = new AtomicReference<>();
            Thread producer = new Thread(() -> {
                Thread.currentThread().interrupt();
                try {
                    writer.write(new byte[2 * SEGMENT]);
                } catch (InterruptedIOException e) {
                    thrown.set(e);
                    stillInterrupted.set(Thread.currentThread().isInterrupted());
                }
            });
            producer.start();
            producer.join(5000);

            assertNotNull(thrown.get());
            assertEquals(0, thrown.get().bytesTransferred);
            assertTrue(stillInterrupted.get());
            assertEquals(SEGMENT + 10, writer.payloadSize());
            release.countDown();
        }
    }

    @Test
    void interruptedSumEndsTheWriter() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        LeafHasher blocking = (data, offset, length) -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Fr32CommPHasher.INSTANCE.digest(data, offset, length);
        };
        CommPConfig config = small(1).toBuilder().leafHasher(blocking).build();

        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(config)) {
            writer.write(random(SEGMENT + 10, 11));

            AtomicReference<Throwable> thrown = new AtomicReference<>();
            AtomicReference<Throwable> second = new AtomicReference<>();
            Thread finisher = new Thread(() -> {
                Thread.currentThread().interrupt();
                try {
                    writer.sum();
                } catch (Throwable t) {
                    thrown.set(t);
                }
                try {
                    writer.sum();
                } catch (Throwable t) {
                    second.set(t);
                }
            });
            finisher.start();
            finisher.join(5000);
            release.countDown();

            assertInstanceOf(InterruptedException.class, thrown.get());
            assertFalse(writer.isOpen());
            assertInstanceOf(IllegalStateException.class, second.get());
        }
    }

    @Test
    void channelHelperRejectsNonBlockingChannels() throws Exception {
        Pipe pipe = Pipe.open();
        try (Pipe.SourceChannel source = pipe.source(); Pipe.SinkChannel sink = pipe.sink()) {
            source.configureBlocking(false);
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PieceCommitmentWriter.sumOf(source, small(1)));
            assertTrue(e.getMessage().contains("blocking"), e.getMessage());
        }
    }

    @Test
    void finalizedWriterRejectsFurtherUse() throws Exception {
        PieceCommitmentWriter writer = new PieceCommitmentWriter(small(1));
        writer.write(new byte[200]);
        assertTrue(writer.isOpen());
        writer.sum();

        assertFalse(writer.isOpen());
        assertThrows(IllegalStateException.class, writer::sum);
        assertThrows(IllegalStateException.class, () -> writer.write(new byte[1]));
        writer.close();
    }

    @Test
    void closedWriterRejectsWrites() throws Exception {
        PieceCommitmentWriter writer = new PieceCommitmentWriter(small(1));
        writer.write(new byte[SEGMENT * 2]);
        writer.close();
        writer.close();

        assertFalse(writer.isOpen());
        assertThrows(IllegalStateException.class, () -> writer.write(new byte[1]));
        assertThrows(IllegalStateException.class, writer::sum);
    }

    @Test
    void writeRangeIsChecked() {
        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(small(1))) {
            assertThrows(IndexOutOfBoundsException.class, () -> writer.write(new byte[10], 5, 6));
            assertThrows(IndexOutOfBoundsException.class, () -> writer.write(new byte[10], -1, 2));
            assertEquals(0, writer.payloadSize());
        }
    }

    @Test
    void pieceLargerThanTheSectorCannotBeCombined() throws Exception {
        CommPConfig config = small(2).toBuilder().sealProof(SealProof.STACKED_DRG_2KIB_V1).build();

        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(config)) {
            writer.write(random(3 * SEGMENT, 9));
            MerkleGenerationException e = assertThrows(MerkleGenerationException.class, writer::sum);
            assertTrue(e.getMessage().startsWith("generating unsealed CID: "), e.getMessage());
        }
    }

    @Test
    void defaultSegmentSizeStream() throws Exception {
        CommPConfig config = CommPConfig.builder().concurrency(2).build();
        assertEquals(8L << 20, config.paddedSegmentSize());

        byte[] data = random(config.unpaddedSegmentSize() + 4096, 10);
        DataCidSize result = commit(data, config, 1 << 20);

        assertEquals(16L << 20, result.pieceSize());
        assertEquals(reference(data), result);
        assertTrue(result.pieceCid().toString().startsWith("baga6ea4se"));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
