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

import io.nosqlbench.commp.LeafComputationException;
import io.nosqlbench.commp.cid.PieceCid;

/// The outcome of committing to one segment: a commitment and its padded size, or the
/// failure that prevented it.
public final class LeafResult {
    private final int index;
    private final PieceCid pieceCid;
    private final long paddedSize;
    private final Throwable failure;

    private LeafResult(int index, PieceCid pieceCid, long paddedSize, Throwable failure) {
        this.index = index;
        this.pieceCid = pieceCid;
        this.paddedSize = paddedSize;
        this.failure = failure;
    }

    public static LeafResult success(int index, PieceCid pieceCid, long paddedSize) {
        return new LeafResult(index, pieceCid, paddedSize, null);
    }

    public static LeafResult failure(int index, Throwable failure) {
        return new LeafResult(index, null, 0, failure);
    }

    public int index() {
        return index;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /// @return the commitment, or null if this segment failed
    public PieceCid pieceCid() {
        return pieceCid;
    }

    /// @return the padded piece size reported by the hasher, or 0 if this segment failed
    public long paddedSize() {
        return paddedSize;
    }

    /// @return what went wrong, or null on success
    public Throwable failure() {
        return failure;
    }

    /// @return this result if it succeeded
    /// @throws LeafComputationException carrying the segment index if it failed
    public LeafResult orThrow() {
        if (failure != null) {
            throw new LeafComputationException(index, failure);
        }
        return this;
    }

    @Override
    public String toString() {
        return isSuccess()
            ? "LeafResult{" + index + ": " + pieceCid + " @" + paddedSize + "}"
            : "LeafResult{" + index + ": failed, " + failure + "}";
    }
}
