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

/// Conversions between raw unsealed commitments (commP, commD) and their CIDs.
///
/// Both piece and data commitments use the `fil-commitment-unsealed` codec with a
/// `sha2-256-trunc254-padded` multihash over exactly 32 bytes.
public final class CommCid implements CommitmentEncoder {

    /// Length in bytes of every unsealed commitment
    public static final int COMMITMENT_LENGTH = 32;

    /// Shared encoder; the class holds no state.
    public static final CommCid INSTANCE = new CommCid();

    private CommCid() {
    }

    @Override
    public PieceCid encode(byte[] digest) {
        return pieceCommitmentToCid(digest);
    }

    /// @param commP a 32 byte piece commitment
    /// @return its CID
    /// @throws IllegalArgumentException if the commitment is not 32 bytes long
    public static PieceCid pieceCommitmentToCid(byte[] commP) {
        if (commP == null) {
            throw new IllegalArgumentException("commitment must not be null");
        }
        if (commP.length != COMMITMENT_LENGTH) {
            throw new IllegalArgumentException(
                "commitments must be " + COMMITMENT_LENGTH + " bytes long, got " + commP.length);
        }
        return PieceCid.of(PieceCid.FIL_COMMITMENT_UNSEALED, PieceCid.SHA2_256_TRUNC254_PADDED, commP);
    }

    /// @param cid an unsealed commitment CID
    /// @return the 32 byte commitment it carries
    /// @throws IllegalArgumentException if the CID is not an unsealed commitment
    public static byte[] cidToPieceCommitment(PieceCid cid) {
        if (cid == null) {
            throw new IllegalArgumentException("CID must not be null");
        }
        if (cid.codec() != PieceCid.FIL_COMMITMENT_UNSEALED) {
            throw new IllegalArgumentException(
                "incorrect codec 0x" + Long.toHexString(cid.codec()) + " for an unsealed commitment: " + cid);
        }
        if (cid.multihashType() != PieceCid.SHA2_256_TRUNC254_PADDED) {
            throw new IllegalArgumentException(
                "incorrect multihash 0x" + Long.toHexString(cid.multihashType()) + " for an unsealed commitment: " + cid);
        }
        byte[] digest = cid.digest();
        if (digest.length != COMMITMENT_LENGTH) {
            throw new IllegalArgumentException(
                "commitment digest must be " + COMMITMENT_LENGTH + " bytes, got " + digest.length);
        }
        return digest;
    }
}
