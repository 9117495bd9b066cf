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

import io.nosqlbench.commp.CommPConfig;
import io.nosqlbench.commp.DataCidSize;
import io.nosqlbench.commp.InputReadException;
import io.nosqlbench.commp.LeafComputationException;
import io.nosqlbench.commp.PieceCommitmentException;
import io.nosqlbench.commp.PieceCommitmentWriter;
import io.nosqlbench.commp.hash.SealProof;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.PrintWriter;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Compute the piece commitment (commP) of a file.
///
/// The file is streamed through a {@link PieceCommitmentWriter} in 1 MiB reads, or with
/// `--preload` read into memory first so that read time and hashing time are reported
/// separately.
///
/// ## Usage
///
/// ```bash
/// commp data.car
/// commp --concurrency 8 --preload data.car
/// commp --segment-size 1048576 --seal-proof STACKED_DRG_64GIB_V1 data.car
/// ```
///
/// ## Output
///
/// ```
/// Elapsed commP time: 1.532s
/// commP: baga6ea4seaq...
/// {
///   "PayloadSize": 1234,
///   "PieceSize": 2048,
///   "PieceCID": {
///     "/": "baga6ea4seaq..."
///   }
/// }
/// ```
@Command(
    name = "commp",
    header = "Compute the piece commitment of a file",
    description = "Streams a file through the fr32 padded binary merkle tree and prints its "
        + "payload size, padded piece size and piece CID.",
    mixinStandardHelpOptions = true,
    version = "commp 0.1.0",
    exitCodeList = {
        "0: Success, or a usage error",
        "1: The file could not be read or committed to"
    }
)
public class CMD_commp implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_commp.class);

    private static final int READ_SIZE = 1 << 20;
    private static final long MAX_PRELOAD = Integer.MAX_VALUE - 8;

    @Parameters(index = "0", arity = "1", description = "File to compute the piece commitment of")
    private Path file;

    @Option(names = {"-c", "--concurrency"},
        description = "Number of segments hashed in parallel (default: available processors)")
    private Integer concurrency;

    @Option(names = {"--segment-size"},
        description = "Padded size of one segment, a power of two (default: 8388608)")
    private Long segmentSize;

    @Option(names = {"--seal-proof"},
        description = "Seal proof whose sector size bounds the piece: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "STACKED_DRG_32GIB_V1")
    private SealProof sealProof = SealProof.STACKED_DRG_32GIB_V1;

    @Option(names = {"--preload"},
        description = "Read the whole file into memory before hashing it")
    private boolean preload = false;

    /// Create the command with default settings
    public CMD_commp() {
    }

    /// Builds the command line for this command. Usage errors print the problem and the
    /// usage text to stderr and exit with status 0.
    /// @return the configured command line
    public static CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(new CMD_commp())
            .setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setParameterExceptionHandler((ex, args) -> {
            CommandLine cmd = ex.getCommandLine();
            PrintWriter err = cmd.getErr();
            err.println(ex.getMessage());
            cmd.usage(err, cmd.getColorScheme());
            err.flush();
            return 0;
        });
        return commandLine;
    }

    /// Run the commp command
    /// @param args command line arguments
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommPConfig config;
        try {
            config = configure();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid settings: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
        logger.info("Computing commP of {} with {}", file, config);

        try {
            DataCidSize result = preload ? preloaded(config) : streamed(config);
            System.out.println("commP: " + result.pieceCid());
            System.out.println(CommPJson.toJson(result));
            return 0;
        } catch (InputReadException e) {
            logger.error("Reading {} failed: {}", file, e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (LeafComputationException e) {
            logger.error("Leaf {} of {} failed: {}", e.getSegmentIndex(), file, e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (PieceCommitmentException e) {
            logger.error("Committing to {} failed: {}", file, e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while computing commP of {}", file);
            System.err.println("Error: interrupted");
            return 1;
        }
    }

    private CommPConfig configure() {
        CommPConfig.Builder builder = CommPConfig.builder().sealProof(sealProof);
        if (concurrency != null) {
            builder.concurrency(concurrency);
        }
        if (segmentSize != null) {
            builder.paddedSegmentSize(segmentSize);
        }
        return builder.build();
    }

    private DataCidSize streamed(CommPConfig config) throws InterruptedException {
        long start = System.nanoTime();
        DataCidSize result;
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            result = PieceCommitmentWriter.sumOf(channel, config, READ_SIZE);
        } catch (IOException e) {
            throw new InputReadException("opening " + file + ": " + e.getMessage(), e);
        }
        System.out.println("Elapsed commP time: " + format(Duration.ofNanos(System.nanoTime() - start)));
        return result;
    }

    private DataCidSize preloaded(CommPConfig config) throws InterruptedException {
        long start = System.nanoTime();
        byte[] data;
        try {
            long size = Files.size(file);
            if (size > MAX_PRELOAD) {
                throw new IOException("file of " + size + " bytes is too large to preload, stream it instead");
            }
            data = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new InputReadException("reading " + file + ": " + e.getMessage(), e);
        }
        System.out.println("Elapsed file read time: " + format(Duration.ofNanos(System.nanoTime() - start)));

        start = System.nanoTime();
        DataCidSize result;
        try (PieceCommitmentWriter writer = new PieceCommitmentWriter(config)) {
            writer.write(data);
            result = writer.sum();
        } catch (InterruptedIOException e) {
            InterruptedException interrupted = new InterruptedException(e.getMessage());
            interrupted.initCause(e);
            throw interrupted;
        }
        System.out.println("Elapsed commP time: " + format(Duration.ofNanos(System.nanoTime() - start)));
        return result;
    }

    static String format(Duration elapsed) {
        long nanos = elapsed.toNanos();
        if (nanos < 1_000L) {
            return nanos + "ns";
        }
        if (nanos < 1_000_000L) {
            return String.format(Locale.ROOT, "%.3fµs", nanos / 1e3);
        }
        if (nanos < 1_000_000_000L) {
            return String.format(Locale.ROOT, "%.3fms", nanos / 1e6);
        }
        return String.format(Locale.ROOT, "%.3fs", nanos / 1e9);
    }
}
