package io.nosqlbench.commp.leaf;

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

import io.nosqlbench.commp.cid.CommitmentEncoder;
import io.nosqlbench.commp.cid.PieceCid;
import io.nosqlbench.commp.hash.LeafDigest;
import io.nosqlbench.commp.hash.LeafHasher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.Function;

/// Commits to a single segment: hash the segment bytes, then encode the digest.
///
/// The task is applied to a buffer it owns for its whole run, either a leased pool
/// buffer on a worker thread or the writer's own scratch buffer at finalization.
/// It never throws for a hashing or encoding failure; the failure is returned in the
/// {@link LeafResult} so that sibling segments are unaffected.
public final class LeafCommitmentTask implements Function<byte[], LeafResult> {
    private static final Logger logger = LogManager.getLogger(LeafCommitmentTask.class);

    private final int index;
    private final int length;
    private final LeafHasher hasher;
    private final CommitmentEncoder encoder;

    /// @param index position of the segment in the stream
    /// @param length number of segment bytes at the start of the buffer
    /// @param hasher the leaf hash
    /// @param encoder turns the raw digest into a commitment identifier
    public LeafCommitmentTask(int index, int length, LeafHasher hasher, CommitmentEncoder encoder) {
        this.index = index;
        this.length = length;
        this.hasher = hasher;
        this.encoder = encoder;
    }

    @Override
    public LeafResult apply(byte[] segment) {
        long start = System.nanoTime();
        try {
            LeafDigest digest = hasher.digest(segment, 0, length);
            PieceCid pieceCid = encoder.encode(digest.commitment());
            if (logger.isTraceEnabled()) {
                logger.trace("leaf {} ({} bytes) -> {} in {}us",
                    index, length, pieceCid, (System.nanoTime() - start) / 1000);
            }
            return LeafResult.success(index, pieceCid, digest.paddedSize());
        } catch (RuntimeException e) {
            logger.debug("leaf {} ({} bytes) failed: {}", index, length, e.getMessage());
            return LeafResult.failure(index, e);
        }
    }

    public int index() {
        return index;
    }

    public int length() {
        return length;
    }
}
