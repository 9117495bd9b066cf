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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/// Unsigned LEB128 varints as used by the multiformats (CID, multicodec, multihash) encodings.
final class Varint {

    /// multiformats caps varints at nine bytes (63 bits of payload)
    static final int MAX_LENGTH = 9;

    private Varint() {
    }

    /// Appends the varint form of a non-negative value.
    /// @param value the value to encode
    /// @param out where the encoded bytes go
    static void write(long value, ByteArrayOutputStream out) {
        if (value < 0) {
            throw new IllegalArgumentException("varints are unsigned, got " + value);
        }
        while ((value & ~0x7FL) != 0) {
            out.write((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        out.write((int) value);
    }

    /// Reads one varint from the buffer's current position, advancing it.
    /// @param in the source buffer
    /// @return the decoded value
    /// @throws IllegalArgumentException if the buffer ends mid-varint, or the varint is too long
    static long read(ByteBuffer in) {
        long value = 0;
        for (int i = 0; i < MAX_LENGTH; i++) {
            if (!in.hasRemaining()) {
                throw new IllegalArgumentException("truncated varint after " + i + " bytes");
            }
            int b = in.get() & 0xFF;
            value |= (long) (b & 0x7F) << (7 * i);
            if ((b & 0x80) == 0) {
                if (b == 0 && i > 0) {
                    throw new IllegalArgumentException("varint is not minimally encoded");
                }
                return value;
            }
        }
        throw new IllegalArgumentException("varint longer than " + MAX_LENGTH + " bytes");
    }
}
