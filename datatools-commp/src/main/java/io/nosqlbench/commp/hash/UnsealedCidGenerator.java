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

import io.nosqlbench.commp.cid.CommCid;
import io.nosqlbench.commp.cid.PieceCid;

import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.List;

/// Computes the unsealed (data) commitment of a sequence of pieces.
///
/// Pieces are pushed onto a stack in order. Whenever the two topmost entries have the
/// same size they are replaced by their parent. Before a piece larger than the top of
/// the stack is pushed, the top is padded with zero commitments of its own size until
/// the left limb is balanced. At the end the stack is padded the same way until a
/// single root remains.
public final class UnsealedCidGenerator implements RootCombiner {

    public static final UnsealedCidGenerator INSTANCE = new UnsealedCidGenerator();

    private UnsealedCidGenerator() {
    }

    @Override
    public PieceCid combine(SealProof sealProof, List<PieceInfo> pieces) {
        if (sealProof == null) {
            throw new IllegalArgumentException("seal proof must not be null");
        }
        if (pieces == null || pieces.isEmpty()) {
            throw new IllegalArgumentException("no pieces provided");
        }
        long maxSize = sealProof.sectorSize();

        List<Frame> todo = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            PieceInfo piece = pieces.get(i);
            long size = piece.paddedSize();
            if (size < PieceSizes.MIN_PADDED_SIZE) {
                throw new IllegalArgumentException("invalid size of piece " + i + ": value " + size + " is too small");
            }
            if (size > maxSize) {
                throw new IllegalArgumentException("invalid size of piece " + i + ": value " + size
                    + " is larger than the sector size of " + sealProof);
            }
            if (!PieceSizes.isPowerOfTwo(size)) {
                throw new IllegalArgumentException("invalid size of piece " + i + ": value " + size + " is not a power of 2");
            }
            byte[] commP;
            try {
                commP = CommCid.cidToPieceCommitment(piece.pieceCid());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("invalid commitment of piece " + i + ": " + e.getMessage(), e);
            }
            todo.add(new Frame(size, commP));
        }

        MessageDigest sha = Sha254.newDigest();
        List<Frame> stack = new ArrayList<>();
        stack.add(todo.get(0));

        for (Frame frame : todo.subList(1, todo.size())) {
            while (top(stack).size < frame.size) {
                padTop(stack, sha);
            }
            stack.add(frame);
            reduce(stack, sha);
        }
        while (stack.size() > 1) {
            padTop(stack, sha);
        }

        Frame root = stack.get(0);
        if (root.size > maxSize) {
            throw new IllegalArgumentException("provided pieces sum up to " + root.size
                + " bytes, which is larger than the sector size of " + sealProof);
        }
        return CommCid.pieceCommitmentToCid(root.commP);
    }

    private static Frame top(List<Frame> stack) {
        return stack.get(stack.size() - 1);
    }

    private static void padTop(List<Frame> stack, MessageDigest sha) {
        long size = top(stack).size;
        stack.add(new Frame(size, ZeroComm.node(PieceSizes.levelOf(size))));
        reduce(stack, sha);
    }

    private static void reduce(List<Frame> stack, MessageDigest sha) {
        while (stack.size() > 1 && stack.get(stack.size() - 2).size == top(stack).size) {
            Frame right = stack.remove(stack.size() - 1);
            Frame left = stack.remove(stack.size() - 1);
            stack.add(new Frame(left.size * 2, Sha254.combine(sha, left.commP, right.commP)));
        }
    }

    private static final class Frame {
        private final long size;
        private final byte[] commP;

        private Frame(long size, byte[] commP) {
            this.size = size;
            this.commP = commP;
        }
    }
}
