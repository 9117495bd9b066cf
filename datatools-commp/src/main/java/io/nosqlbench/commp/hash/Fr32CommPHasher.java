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
import java.util.Arrays;

/// Piece commitment (commP) of a run of payload bytes.
///
/// The payload is zero-filled to a whole number of 127 byte quads, each quad is fr32
/// expanded to 128 bytes, and the resulting 32 byte nodes are folded into a binary
/// tree with {@link Sha254}. Nodes are folded as they arrive on a stack of pending
/// nodes, one slot per level, so memory stays constant regardless of input size. At
/// the end any unpaired node is closed against the zero commitment of its level,
/// which is the same as padding the piece with zeroes to the next power of two.
///
/// Stateless and safe for concurrent use; each call owns its digest.
public final class Fr32CommPHasher implements LeafHasher {

    /// commP is not defined for shorter inputs
    public static final int MIN_PAYLOAD = 65;

    /// Tree levels above the 32 byte nodes of the largest supported piece
    public static final int MAX_LAYERS = ZeroComm.LEVELS - 1;

    /// Largest supported payload: the unpadded capacity of a 2^(MAX_LAYERS+5) byte piece
    public static final long MAX_PAYLOAD = (1L << (MAX_LAYERS + 5)) / PieceSizes.QUAD_PADDED * PieceSizes.QUAD_PAYLOAD;

    public static final Fr32CommPHasher INSTANCE = new Fr32CommPHasher();

    private Fr32CommPHasher() {
    }

    @Override
    public LeafDigest digest(byte[] data, int offset, int length) {
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
        if (offset < 0 || length < 0 || offset > data.length - length) {
            throw new IllegalArgumentException(
                "range [" + offset + "," + (offset + length) + ") is outside a " + data.length + " byte array");
        }
        if (length < MIN_PAYLOAD) {
            throw new IllegalArgumentException(
                "commP is not defined for inputs shorter than " + MIN_PAYLOAD + " bytes, got " + length);
        }
        if (length > MAX_PAYLOAD) {
            throw new IllegalArgumentException("input of " + length + " bytes exceeds the maximum piece payload of " + MAX_PAYLOAD);
        }

        NodeStack stack = new NodeStack(Sha254.newDigest());
        byte[] expanded = new byte[PieceSizes.QUAD_PADDED];
        long quads = 0;

        int position = offset;
        int end = offset + length;
        while (end - position >= PieceSizes.QUAD_PAYLOAD) {
            Fr32.expandQuad(data, position, expanded, 0);
            stack.pushQuad(expanded);
            position += PieceSizes.QUAD_PAYLOAD;
            quads++;
        }
        if (position < end) {
            byte[] tail = new byte[PieceSizes.QUAD_PAYLOAD];
            System.arraycopy(data, position, tail, 0, end - position);
            Fr32.expandQuad(tail, 0, expanded, 0);
            stack.pushQuad(expanded);
            quads++;
        }

        long paddedSize = PieceSizes.nextPowerOfTwo(quads * PieceSizes.QUAD_PADDED);
        byte[] commP = stack.collapse(PieceSizes.levelOf(paddedSize));
        return new LeafDigest(commP, paddedSize);
    }

    private static final class NodeStack {
        private final MessageDigest sha;
        private final byte[][] pending = new byte[ZeroComm.LEVELS + 1][];

        private NodeStack(MessageDigest sha) {
            this.sha = sha;
        }

        private void pushQuad(byte[] expanded) {
            for (int node = 0; node < PieceSizes.QUAD_PADDED; node += PieceSizes.NODE_SIZE) {
                push(0, Arrays.copyOfRange(expanded, node, node + PieceSizes.NODE_SIZE));
            }
        }

        private void push(int level, byte[] node) {
            while (pending[level] != null) {
                node = Sha254.combine(sha, pending[level], node);
                pending[level] = null;
                level++;
            }
            pending[level] = node;
        }

        private byte[] collapse(int rootLevel) {
            for (int level = 0; level < rootLevel; level++) {
                if (pending[level] != null) {
                    byte[] closed = Sha254.combine(sha, pending[level], ZeroComm.node(level));
                    pending[level] = null;
                    push(level + 1, closed);
                }
            }
            byte[] root = pending[rootLevel];
            if (root == null) {
                throw new IllegalStateException("no root at level " + rootLevel);
            }
            return root;
        }
    }
}
