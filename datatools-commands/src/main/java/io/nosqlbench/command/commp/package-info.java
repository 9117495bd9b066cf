/// ## commp
///
/// Prints the piece commitment of a file.
/// * The only argument is the file to commit to; anything else prints usage.
/// * The file is streamed in 1 MiB reads unless `--preload` asks for it to be read first.
/// * Output is the elapsed time, a `commP: <cid>` line and the result as JSON.
package io.nosqlbench.command.commp;

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
