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

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/// The node function of unsealed commitment trees: SHA-256 of the two children,
/// truncated to 254 bits by clearing the top two bits of the last byte.
public final class Sha254 {

    private Sha254() {
    }

    /// @return a fresh SHA-256 digest; digests are not thread safe, so each worker needs its own
    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /// @param sha a digest owned by the caller
    /// @param left the left child node
    /// @param right the right child node
    /// @return the parent node
    public static byte[] combine(MessageDigest sha, byte[] left, byte[] right) {
        sha.reset();
        sha.update(left, 0, PieceSizes.NODE_SIZE);
        sha.update(right, 0, PieceSizes.NODE_SIZE);
        byte[] parent = sha.digest();
        parent[PieceSizes.NODE_SIZE - 1] &= 0x3F;
        return parent;
    }
}
