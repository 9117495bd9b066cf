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

/// A writer was finalized without a single byte written. No commitment is defined
/// for an empty payload, so it is rejected rather than given a made-up value.
public class EmptyPayloadException extends PieceCommitmentException {

    public EmptyPayloadException() {
        super("no commitment is defined for an empty payload: zero bytes were written");
    }
}
