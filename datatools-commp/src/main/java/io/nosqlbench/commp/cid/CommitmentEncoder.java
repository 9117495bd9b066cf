package io.nosqlbench.commp.cid;

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

/// Turns a raw commitment digest into its canonical identifier.
@FunctionalInterface
public interface CommitmentEncoder {

    /// @param digest the raw commitment digest
    /// @return the canonical identifier of the commitment
    /// @throws IllegalArgumentException if the digest cannot be a commitment
    PieceCid encode(byte[] digest);
}
