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

/// Base of all failures raised while computing a piece commitment.
///
/// Finalization fails as a whole: when one of these is thrown no partial result exists.
/// Nothing is retried; to try again, replay the same bytes through a new writer.
public class PieceCommitmentException extends RuntimeException {

    /// @param message what failed
    public PieceCommitmentException(String message) {
        super(message);
    }

    /// @param message what failed
    /// @param cause the underlying failure
    public PieceCommitmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
