package io.nosqlbench.commp.tree;

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

import io.nosqlbench.commp.CommPConfig;
import io.nosqlbench.commp.DataCidSize;
import io.nosqlbench.commp.EmptyPayloadException;
import io.nosqlbench.commp.LeafComputationException;
import io.nosqlbench.commp.MerkleGenerationException;
import io.nosqlbench.commp.cid.PieceCid;
import io.nosqlbench.commp.hash.PieceInfo;
import io.nosqlbench.commp.hash.PieceSizes;
import io.nosqlbench.commp.leaf.LeafCommitmentTask;
import io.nosqlbench.commp.leaf.LeafResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/// Folds the ordered segment commitments of a stream into its piece commitment.
///
/// ```
///  slots:    [leaf 0] [leaf 1] ... [leaf k-1]   (awaited in order, first failure wins)
///  trailing: partial segment, zero filled to S_u when leaves already exist
///  padding:  [leaf 0] ... [leaf k-1] [zero] ... [zero]   (to the next power of two)
///  root:     the single leaf, or the root combination of (leaf, S_p) pairs
/// ```
///
/// A trailing segment that is the whole stream and reports a padded size below one
/// segment short-circuits: its own commitment is the result.
public final class TreeAggregator {
    private static final Logger logger = LogManager.getLogger(TreeAggregator.class);

    private final CommPConfig config;
    private final int segmentSize;
    private final long paddedSegmentSize;

    public TreeAggregator(CommPConfig config) {
        this.config = config;
        this.segmentSize = config.unpaddedSegmentSize();
        this.paddedSegmentSize = config.paddedSegmentSize();
    }

    /// @param slots the per-segment results of every full segment, in segment order
    /// @param trailing buffer holding the trailing partial segment at its start; it may be
    ///                 zero filled in place, and must be at least one segment long
    /// @param trailingLength number of valid bytes in the trailing buffer, below one segment
    /// @param payloadSize the total number of bytes written
    /// @return the piece commitment of the stream
    /// @throws LeafComputationException if any segment failed, for the first failed segment
    /// @throws MerkleGenerationException if the leaves cannot be combined
    /// @throws EmptyPayloadException if nothing was written
    /// @throws InterruptedException if interrupted while waiting for a segment
    public DataCidSize aggregate(
        List<CompletableFuture<LeafResult>> slots,
        byte[] trailing,
        int trailingLength,
        long payloadSize
    ) throws InterruptedException {
        if (slots.isEmpty() && trailingLength == 0) {
            throw new EmptyPayloadException();
        }
        if (trailingLength < 0 || trailingLength >= segmentSize || trailing.length < segmentSize) {
            throw new IllegalArgumentException("trailing segment of " + trailingLength
                + " bytes in a buffer of " + trailing.length + " does not fit segment size " + segmentSize);
        }

        List<PieceCid> leaves = new ArrayList<>(slots.size() + 1);
        for (CompletableFuture<LeafResult> slot : slots) {
            leaves.add(await(slot, leaves.size()).pieceCid());
        }

        if (trailingLength > 0) {
            int hashLength = trailingLength;
            if (!leaves.isEmpty()) {
                Arrays.fill(trailing, trailingLength, segmentSize, (byte) 0);
                hashLength = segmentSize;
            }
            LeafResult last = new LeafCommitmentTask(leaves.size(), hashLength,
                config.leafHasher(), config.commitmentEncoder()).apply(trailing).orThrow();

            if (last.paddedSize() < paddedSegmentSize) {
                logger.debug("payload of {} bytes fits below one segment, piece size {}", payloadSize, last.paddedSize());
                return new DataCidSize(payloadSize, last.paddedSize(), last.pieceCid());
            }
            leaves.add(last.pieceCid());
        }

        int realLeaves = leaves.size();
        long leafCount = PieceSizes.nextPowerOfTwo(realLeaves);
        if (leafCount > realLeaves) {
            PieceCid filler = zeroLeaf();
            while (leaves.size() < leafCount) {
                leaves.add(filler);
            }
        }
        long pieceSize = leafCount * paddedSegmentSize;
        logger.debug("combining {} leaves ({} zero fillers) into a piece of {} bytes",
            leafCount, leafCount - realLeaves, pieceSize);

        if (leaves.size() == 1) {
            return new DataCidSize(payloadSize, pieceSize, leaves.get(0));
        }

        List<PieceInfo> pieces = new ArrayList<>(leaves.size());
        for (PieceCid leaf : leaves) {
            pieces.add(new PieceInfo(paddedSegmentSize, leaf));
        }
        try {
            PieceCid root = config.rootCombiner().combine(config.sealProof(), pieces);
            return new DataCidSize(payloadSize, pieceSize, root);
        } catch (RuntimeException e) {
            throw new MerkleGenerationException("generating unsealed CID: " + e.getMessage(), e);
        }
    }

    private LeafResult await(CompletableFuture<LeafResult> slot, int index) throws InterruptedException {
        try {
            return slot.get().orThrow();
        } catch (ExecutionException e) {
            throw new LeafComputationException(index, e.getCause());
        }
    }

    private PieceCid zeroLeaf() {
        try {
            return config.zeroLeafGenerator().zeroPieceCommitment(segmentSize);
        } catch (RuntimeException e) {
            throw new MerkleGenerationException("no zero commitment for " + segmentSize + " byte segments: " + e.getMessage(), e);
        }
    }
}
