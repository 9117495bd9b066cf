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

/// Computes the piece commitment of one run of payload bytes.
///
/// Implementations are called from several worker threads at once and must be
/// deterministic: the same bytes always give the same digest.
@FunctionalInterface
public interface LeafHasher {

    /// @param data source array
    /// @param offset first payload byte
    /// @param length number of payload bytes
    /// @return the raw commitment with the padded size of the piece
    /// @throws IllegalArgumentException if no commitment is defined for this input
    LeafDigest digest(byte[] data, int offset, int length);
}
