package io.nosqlbench.commp.hash;

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
import io.nosqlbench.commp.cid.PieceCid;

import java.security.MessageDigest;

/// Precomputed commitments of all-zero pieces, one per tree level.
///
/// Level 0 is a single zero node of 32 bytes; level n+1 is the node hash of level n
/// with itself. fr32 padding maps zeroes to zeroes, so level n is also the commitment
/// of `32 * 2^n` padded bytes of zero payload.
public final class ZeroComm implements ZeroLeafGenerator {

    /// Levels 0..31 cover pieces up to 64GiB padded
    public static final int LEVELS = 32;

    public static final ZeroComm INSTANCE = new ZeroComm();

    private static final byte[][] ZERO_NODES = new byte[LEVELS][];
    private static final PieceCid[] ZERO_PIECES = new PieceCid[LEVELS];

    static {
        MessageDigest sha = Sha254.newDigest();
        ZERO_NODES[0] = new byte[PieceSizes.NODE_SIZE];
        for (int level = 1; level < LEVELS; level++) {
            ZERO_NODES[level] = Sha254.combine(sha, ZERO_NODES[level - 1], ZERO_NODES[level - 1]);
        }
        for (int level = 0; level < LEVELS; level++) {
            ZERO_PIECES[level] = CommCid.pieceCommitmentToCid(ZERO_NODES[level]);
        }
    }

    private ZeroComm() {
    }

    /// @param level a tree level, 0 being a single node
    /// @return a copy of the zero node at that level
    public static byte[] zeroNode(int level) {
        return node(level).clone();
    }

    /// @param paddedSize a valid padded piece size
    /// @return the commitment of an all-zero piece of that padded size
    public static PieceCid forPaddedSize(long paddedSize) {
        PieceSizes.validatePadded(paddedSize);
        return ZERO_PIECES[checkLevel(PieceSizes.levelOf(paddedSize))];
    }

    @Override
    public PieceCid zeroPieceCommitment(long unpaddedSize) {
        return forPaddedSize(PieceSizes.padded(unpaddedSize));
    }

    // shared table entry, callers must not modify it
    static byte[] node(int level) {
        return ZERO_NODES[checkLevel(level)];
    }

    private static int checkLevel(int level) {
        if (level < 0 || level >= LEVELS) {
            throw new IllegalArgumentException("zero commitments are tabled for levels 0.." + (LEVELS - 1) + ", not " + level);
        }
        return level;
    }
}
