package io.nosqlbench.commp;

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
import io.nosqlbench.commp.cid.CommitmentEncoder;
import io.nosqlbench.commp.hash.Fr32CommPHasher;
import io.nosqlbench.commp.hash.LeafHasher;
import io.nosqlbench.commp.hash.PieceSizes;
import io.nosqlbench.commp.hash.RootCombiner;
import io.nosqlbench.commp.hash.SealProof;
import io.nosqlbench.commp.hash.UnsealedCidGenerator;
import io.nosqlbench.commp.hash.ZeroComm;
import io.nosqlbench.commp.hash.ZeroLeafGenerator;

/// Settings for a {@link PieceCommitmentWriter}.
///
/// Defaults come from the system properties `commp.concurrency` and
/// `commp.segment.size` when they are set, otherwise from the number of available
/// processors and an 8MiB padded segment.
///
/// ```
/// CommPConfig config = CommPConfig.builder()
///     .concurrency(4)
///     .paddedSegmentSize(1 << 20)
///     .build();
/// ```
public final class CommPConfig {

    /// System property overriding the default concurrency limit
    public static final String CONCURRENCY_PROPERTY = "commp.concurrency";

    /// System property overriding the default padded segment size
    public static final String SEGMENT_SIZE_PROPERTY = "commp.segment.size";

    /// Padded size of one segment unless configured otherwise
    public static final long DEFAULT_PADDED_SEGMENT_SIZE = 8L << 20;

    /// Segments are held in byte arrays, so they stay well inside the array limit
    public static final long MAX_PADDED_SEGMENT_SIZE = 1L << 30;

    /// Seal proof whose sector size bounds the combined piece
    public static final SealProof DEFAULT_SEAL_PROOF = SealProof.STACKED_DRG_32GIB_V1;

    private final int concurrency;
    private final long paddedSegmentSize;
    private final SealProof sealProof;
    private final LeafHasher leafHasher;
    private final CommitmentEncoder commitmentEncoder;
    private final ZeroLeafGenerator zeroLeafGenerator;
    private final RootCombiner rootCombiner;

    private CommPConfig(Builder builder) {
        this.concurrency = builder.concurrency;
        this.paddedSegmentSize = builder.paddedSegmentSize;
        this.sealProof = builder.sealProof;
        this.leafHasher = builder.leafHasher;
        this.commitmentEncoder = builder.commitmentEncoder;
        this.zeroLeafGenerator = builder.zeroLeafGenerator;
        this.rootCombiner = builder.rootCombiner;
    }

    /// @return a configuration with every default applied
    public static CommPConfig defaults() {
        return builder().build();
    }

    /// @return a builder preloaded with the defaults
    public static Builder builder() {
        return new Builder();
    }

    /// @return the maximum number of segments hashed at the same time
    public int concurrency() {
        return concurrency;
    }

    /// @return the padded size of one segment (S_p)
    public long paddedSegmentSize() {
        return paddedSegmentSize;
    }

    /// @return the number of payload bytes in one segment (S_u)
    public int unpaddedSegmentSize() {
        return (int) PieceSizes.unpadded(paddedSegmentSize);
    }

    public SealProof sealProof() {
        return sealProof;
    }

    public LeafHasher leafHasher() {
        return leafHasher;
    }

    public CommitmentEncoder commitmentEncoder() {
        return commitmentEncoder;
    }

    public ZeroLeafGenerator zeroLeafGenerator() {
        return zeroLeafGenerator;
    }

    public RootCombiner rootCombiner() {
        return rootCombiner;
    }

    /// @return a builder starting from this configuration
    public Builder toBuilder() {
        return new Builder()
            .concurrency(concurrency)
            .paddedSegmentSize(paddedSegmentSize)
            .sealProof(sealProof)
            .leafHasher(leafHasher)
            .commitmentEncoder(commitmentEncoder)
            .zeroLeafGenerator(zeroLeafGenerator)
            .rootCombiner(rootCombiner);
    }

    @Override
    public String toString() {
        return "CommPConfig{concurrency=" + concurrency
            + ", paddedSegmentSize=" + paddedSegmentSize
            + ", sealProof=" + sealProof + "}";
    }

    /// Builder for {@link CommPConfig}; validation happens in {@link #build()}.
    public static final class Builder {
        private int concurrency = intProperty(CONCURRENCY_PROPERTY, Runtime.getRuntime().availableProcessors());
        private long paddedSegmentSize = longProperty(SEGMENT_SIZE_PROPERTY, DEFAULT_PADDED_SEGMENT_SIZE);
        private SealProof sealProof = DEFAULT_SEAL_PROOF;
        private LeafHasher leafHasher = Fr32CommPHasher.INSTANCE;
        private CommitmentEncoder commitmentEncoder = CommCid.INSTANCE;
        private ZeroLeafGenerator zeroLeafGenerator = ZeroComm.INSTANCE;
        private RootCombiner rootCombiner = UnsealedCidGenerator.INSTANCE;

        private Builder() {
        }

        /// @param concurrency the maximum number of segments hashed at once, at least 1
        /// @return this builder
        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        /// @param paddedSegmentSize padded segment size, a power of two from 128 bytes up to 1GiB
        /// @return this builder
        public Builder paddedSegmentSize(long paddedSegmentSize) {
            this.paddedSegmentSize = paddedSegmentSize;
            return this;
        }

        public Builder sealProof(SealProof sealProof) {
            this.sealProof = sealProof;
            return this;
        }

        public Builder leafHasher(LeafHasher leafHasher) {
            this.leafHasher = leafHasher;
            return this;
        }

        public Builder commitmentEncoder(CommitmentEncoder commitmentEncoder) {
            this.commitmentEncoder = commitmentEncoder;
            return this;
        }

        public Builder zeroLeafGenerator(ZeroLeafGenerator zeroLeafGenerator) {
            this.zeroLeafGenerator = zeroLeafGenerator;
            return this;
        }

        public Builder rootCombiner(RootCombiner rootCombiner) {
            this.rootCombiner = rootCombiner;
            return this;
        }

        /// @return the validated configuration
        /// @throws IllegalArgumentException if any setting is out of range or missing
        public CommPConfig build() {
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
            }
            PieceSizes.validatePadded(paddedSegmentSize);
            if (paddedSegmentSize > MAX_PADDED_SEGMENT_SIZE) {
                throw new IllegalArgumentException(
                    "padded segment size must be at most " + MAX_PADDED_SEGMENT_SIZE + ", got " + paddedSegmentSize);
            }
            if (sealProof == null) {
                throw new IllegalArgumentException("seal proof must not be null");
            }
            if (paddedSegmentSize > sealProof.sectorSize()) {
                throw new IllegalArgumentException("padded segment size " + paddedSegmentSize
                    + " exceeds the sector size " + sealProof.sectorSize() + " of " + sealProof);
            }
            if (leafHasher == null || commitmentEncoder == null || zeroLeafGenerator == null || rootCombiner == null) {
                throw new IllegalArgumentException("hasher, encoder, zero leaf generator and root combiner are all required");
            }
            return new CommPConfig(this);
        }

        private static int intProperty(String name, int fallback) {
            String value = System.getProperty(name);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("system property " + name + " is not an integer: '" + value + "'", e);
            }
        }

        private static long longProperty(String name, long fallback) {
            String value = System.getProperty(name);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("system property " + name + " is not an integer: '" + value + "'", e);
            }
        }
    }
}
