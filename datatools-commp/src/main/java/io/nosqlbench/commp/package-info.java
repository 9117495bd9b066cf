/// ## commp
///
/// Streaming piece commitment (commP) computation.
///
/// A [io.nosqlbench.commp.PieceCommitmentWriter] accepts a byte stream of any length,
/// cuts it into fixed segments, commits to each segment on a bounded set of worker
/// threads and folds the ordered segment commitments into one piece commitment when the
/// stream is finalized.
///
/// ```
/// bytes -> segment buffer -> pool lease -> leaf task -> ordered slot
/// sum() -> awaited slots + trailing segment + zero leaves -> root CID
/// ```
///
/// The hashing primitives live in [io.nosqlbench.commp.hash] and the CID encoding in
/// [io.nosqlbench.commp.cid]; both sit behind interfaces that a
/// [io.nosqlbench.commp.CommPConfig] can replace.
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
