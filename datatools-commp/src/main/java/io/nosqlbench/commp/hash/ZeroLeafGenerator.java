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

import io.nosqlbench.commp.cid.PieceCid;

/// Supplies the commitment of an all-zero piece.
@FunctionalInterface
public interface ZeroLeafGenerator {

    /// @param unpaddedSize the payload size of the all-zero piece
    /// @return the commitment of that many zero bytes
    PieceCid zeroPieceCommitment(long unpaddedSize);
}
