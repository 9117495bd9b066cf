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

/// Arithmetic between padded and unpadded piece sizes.
///
/// Every 127 bytes of payload occupy 128 bytes once fr32 padded, so a padded size `p`
/// holds `p - p/128` payload bytes. Valid padded piece sizes are powers of two of at
/// least 128 bytes.
public final class PieceSizes {

    /// Size of one tree node, and of every commitment
    public static final int NODE_SIZE = 32;

    /// Smallest padded piece: one fr32 quad
    public static final long MIN_PADDED_SIZE = 128;

    /// Bytes of payload carried by one fr32 quad
    public static final int QUAD_PAYLOAD = 127;

    /// Bytes one fr32 quad occupies after padding
    public static final int QUAD_PADDED = 128;

    private PieceSizes() {
    }

    /// @param paddedSize a valid padded piece size
    /// @return the payload capacity of that piece
    /// @throws IllegalArgumentException if the padded size is not valid
    public static long unpadded(long paddedSize) {
        validatePadded(paddedSize);
        return paddedSize - paddedSize / QUAD_PADDED;
    }

    /// @param unpaddedSize the payload capacity of a valid padded piece
    /// @return the padded piece size
    /// @throws IllegalArgumentException if no valid padded piece has this capacity
    public static long padded(long unpaddedSize) {
        if (unpaddedSize < QUAD_PAYLOAD || unpaddedSize % QUAD_PAYLOAD != 0) {
            throw new IllegalArgumentException(
                "unpadded piece size must be a positive multiple of " + QUAD_PAYLOAD + ", got " + unpaddedSize);
        }
        long padded = unpaddedSize + unpaddedSize / QUAD_PAYLOAD;
        validatePadded(padded);
        return padded;
    }

    /// @param paddedSize a candidate padded piece size
    /// @throws IllegalArgumentException unless it is a power of two of at least 128 bytes
    public static void validatePadded(long paddedSize) {
        if (paddedSize < MIN_PADDED_SIZE) {
            throw new IllegalArgumentException(
                "padded piece size must be at least " + MIN_PADDED_SIZE + " bytes, got " + paddedSize);
        }
        if (!isPowerOfTwo(paddedSize)) {
            throw new IllegalArgumentException("padded piece size must be a power of two, got " + paddedSize);
        }
    }

    public static boolean isPowerOfTwo(long value) {
        return value > 0 && Long.bitCount(value) == 1;
    }

    /// @param value a positive value
    /// @return the smallest power of two that is not below value
    public static long nextPowerOfTwo(long value) {
        if (value < 1) {
            throw new IllegalArgumentException("no power of two is defined for " + value);
        }
        if (value > (1L << 62)) {
            throw new IllegalArgumentException("value too large to round up to a power of two: " + value);
        }
        return isPowerOfTwo(value) ? value : Long.highestOneBit(value) << 1;
    }

    /// @param paddedSize a valid padded piece size
    /// @return the tree level whose nodes each cover that many padded bytes
    static int levelOf(long paddedSize) {
        return Long.numberOfTrailingZeros(paddedSize) - Long.numberOfTrailingZeros(NODE_SIZE);
    }
}
