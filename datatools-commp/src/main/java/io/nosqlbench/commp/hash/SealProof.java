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

/// Registered seal proof types. For commitment purposes a proof type only
/// contributes its sector size, which bounds the total size of a combined piece.
public enum SealProof {
    STACKED_DRG_2KIB_V1(0, 2L << 10),
    STACKED_DRG_8MIB_V1(1, 8L << 20),
    STACKED_DRG_512MIB_V1(2, 512L << 20),
    STACKED_DRG_32GIB_V1(3, 32L << 30),
    STACKED_DRG_64GIB_V1(4, 64L << 30);

    private final int registeredId;
    private final long sectorSize;

    SealProof(int registeredId, long sectorSize) {
        this.registeredId = registeredId;
        this.sectorSize = sectorSize;
    }

    /// @return the chain's numeric identifier for this proof type
    public int registeredId() {
        return registeredId;
    }

    /// @return the sector size in padded bytes
    public long sectorSize() {
        return sectorSize;
    }
}
