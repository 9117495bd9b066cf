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

/// The leaf hash or the commitment encoder failed for one segment.
///
/// Only the first failing segment, in segment order, is ever reported.
public class LeafComputationException extends PieceCommitmentException {

    /// The index of the segment whose commitment failed
    private final int segmentIndex;

    /// @param segmentIndex the 0-based position of the failed segment
    /// @param cause what the hasher or encoder threw
    public LeafComputationException(int segmentIndex, Throwable cause) {
        super("processing leaf " + segmentIndex + ": " + (cause == null ? "unknown failure" : cause.getMessage()), cause);
        this.segmentIndex = segmentIndex;
    }

    /// @return the 0-based position of the failed segment in the stream
    public int getSegmentIndex() {
        return segmentIndex;
    }
}
