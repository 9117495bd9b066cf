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

import java.util.List;

/// Folds an ordered list of piece commitments into the commitment of their concatenation.
@FunctionalInterface
public interface RootCombiner {

    /// @param sealProof bounds the combined size by its sector size
    /// @param pieces the pieces, in order
    /// @return the root commitment
    /// @throws IllegalArgumentException if the pieces violate the scheme's constraints
    PieceCid combine(SealProof sealProof, List<PieceInfo> pieces);
}
