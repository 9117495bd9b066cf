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

/// fr32 padding: 127 payload bytes (1016 bits) become four 254 bit field elements,
/// each stored in 32 bytes with its two top bits zero.
///
/// ```
///  in:  {{ C7 C6 }} X7 X6 X5 X4 X3 X2 X1 X0  Y7 Y6 ...
/// out:              X5 X4 X3 X2 X1 X0 C7 C6  Y5 Y4 ...
/// ```
/// Each following element is shifted two more bits than the one before it.
public final class Fr32 {

    private Fr32() {
    }

    /// Expands one 127 byte quad into 128 bytes.
    /// @param in source array
    /// @param inOffset start of the quad in the source
    /// @param out target array
    /// @param outOffset start of the 128 byte expansion in the target
    public static void expandQuad(byte[] in, int inOffset, byte[] out, int outOffset) {
        System.arraycopy(in, inOffset, out, outOffset, 32);
        out[outOffset + 31] &= 0x3F;

        for (int i = 31; i < 63; i++) {
            out[outOffset + i + 1] = (byte) (((in[inOffset + i + 1] & 0xFF) << 2) | ((in[inOffset + i] & 0xFF) >>> 6));
        }
        out[outOffset + 63] &= 0x3F;

        for (int i = 63; i < 95; i++) {
            out[outOffset + i + 1] = (byte) (((in[inOffset + i + 1] & 0xFF) << 4) | ((in[inOffset + i] & 0xFF) >>> 4));
        }
        out[outOffset + 95] &= 0x3F;

        for (int i = 95; i < 126; i++) {
            out[outOffset + i + 1] = (byte) (((in[inOffset + i + 1] & 0xFF) << 6) | ((in[inOffset + i] & 0xFF) >>> 2));
        }

        // the last six bits are the whole of the final byte
        out[outOffset + 127] = (byte) ((in[inOffset + 126] & 0xFF) >>> 2);
    }
}
