/*
 * GoFix - Automated Go Source Migration
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.gofix.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link RewritePipeline} over files and directories, or over standard input.
 *
 * <p>Directories are searched recursively for files with the configured extension, skipping
 * names that start with a dot. Files are processed independently on a bounded worker pool; a
 * failure in one file is recorded in its outcome and never stops the others. Outcomes are
 * reported to the listener sorted by path once all files are done.
 *
 * <p>{@link #cancel()} stops files from starting; a file already being processed finishes,
 * including its write, so a file is never left half written. Interrupting the thread in {@link
 * #run} cancels the run the same way: it still waits for files in progress, reports their
 * outcomes, and returns with the interrupt flag set.
 */
public class RewriteRunner {
    private static final Logger logger = LoggerFactory.getLogger(RewriteRunner.class);

    public static final String STDIN_NAME = "standard input";

    private final RewritePipeline pipeline;
    private final RewriteMode mode;
    private final RewriteSettings settings;
    private final RewriteListener listener;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public RewriteRunner(
            RewritePipeline pipeline,
            RewriteMode mode,
            RewriteSettings settings,
            RewriteListener listener) {
        this.pipeline = pipeline;
        this.mode = mode;
        this.settings = settings;
        this.listener = listener;
    }

    public void cancel() {
        if (!cancelled.getAndSet(true)) {
            logger.info("Run cancelled; files already started will finish");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /** Processes the given files and directory trees. */
    public RunSummary run(List<Path> roots) {
        List<RewriteOutcome> outcomes = new ArrayList<>();
        List<Path> files = new ArrayList<>(collectFiles(roots, outcomes));
        logger.debug("Processing {} file(s) with {} worker(s)", files.size(), settings.workers());

        int skipped = 0;
        boolean interrupted = false;
        if (!files.isEmpty()) {
            ExecutorService pool =
                    Executors.newFixedThreadPool(Math.min(settings.workers(), files.size()));
            try {
                List<Future<RewriteOutcome>> futures = new ArrayList<>(files.size());
                for (Path file : files) {
                    futures.add(pool.submit(() -> cancelled.get() ? null : processFile(file)));
                }
                for (int i = 0; i < futures.size(); i++) {
                    Future<RewriteOutcome> future = futures.get(i);
                    while (true) {
                        try {
                            RewriteOutcome outcome = await(future, files.get(i));
                            if (outcome == null) {
                                skipped++;
                            } else {
                                outcomes.add(outcome);
                            }
                            break;
                        } catch (InterruptedException e) {
                            // Files already started still finish and are reported.
                            interrupted = true;
                            cancel();
                        }
                    }
                }
            } finally {
                pool.shutdown();
                interrupted |= awaitTermination(pool);
                if (interrupted) {
                    cancel();
                    Thread.currentThread().interrupt();
                }
            }
        }

        outcomes.sort(Comparator.comparing(RewriteOutcome::path));
        outcomes.forEach(this::report);
        RunSummary summary = new RunSummary(outcomes, skipped);
        listener.onSummary(summary);
        return summary;
    }

    /**
     * Reads all of {@code in} as one source file and writes the result to {@code out}: the new
     * text in write mode, the diff in diff mode. Nothing is written if the input fails.
     *
     * @throws IOException if reading the input or writing the output fails
     */
    public RewriteOutcome runStream(InputStream in, OutputStream out) throws IOException {
        String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        RewriteOutcome outcome = pipeline.process(STDIN_NAME, text);
        if (outcome.isFailure()) {
            listener.onFileFailed(outcome);
            return outcome;
        }
        String result =
                mode == RewriteMode.DIFF ? UnifiedDiffRenderer.render(outcome) : outcome.newText();
        out.write(result.getBytes(StandardCharsets.UTF_8));
        out.flush();
        if (outcome.changed()) {
            listener.onFileRewritten(outcome);
        }
        return outcome;
    }

    private Set<Path> collectFiles(List<Path> roots, List<RewriteOutcome> failures) {
        Set<Path> files = new LinkedHashSet<>();
        for (Path root : roots) {
            if (Files.isDirectory(root)) {
                List<Path> found = new ArrayList<>();
                discover(root, found, failures);
                found.sort(Comparator.naturalOrder());
                files.addAll(found);
            } else {
                files.add(root);
            }
        }
        return files;
    }

    private void discover(Path root, List<Path> found, List<RewriteOutcome> failures) {
        String extension = settings.extension();
        try {
            Files.walkFileTree(
                    root,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult preVisitDirectory(
                                Path dir, BasicFileAttributes attrs) {
                            if (!dir.equals(root) && isHidden(dir)) {
                                return FileVisitResult.SKIP_SUBTREE;
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                            if (attrs.isRegularFile()
                                    && !isHidden(file)
                                    && file.getFileName().toString().endsWith(extension)) {
                                found.add(file);
                            }
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult visitFileFailed(Path file, IOException exc) {
                            logger.warn("Cannot read {}: {}", file, exc.getMessage());
                            failures.add(RewriteOutcome.failure(file.toString(), "", exc));
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (IOException e) {
            logger.warn("Cannot walk {}: {}", root, e.getMessage());
            failures.add(RewriteOutcome.failure(root.toString(), "", e));
        }
    }

    private static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    private RewriteOutcome processFile(Path file) {
        String path = file.toString();
        logger.debug("Processing {}", path);
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Cannot read {}: {}", path, e.getMessage());
            return RewriteOutcome.failure(path, "", e);
        }

        RewriteOutcome outcome = pipeline.process(path, text);
        if (mode == RewriteMode.WRITE && outcome.changed() && !outcome.isFailure()) {
            try {
                writeAtomically(file, outcome.newText());
            } catch (IOException e) {
                logger.warn("Cannot write {}: {}", path, e.getMessage());
                return outcome.withError(e);
            }
        }
        return outcome;
    }

    private RewriteOutcome await(Future<RewriteOutcome> future, Path file)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Unexpected failure processing {}", file, cause);
            return RewriteOutcome.failure(
                    file.toString(),
                    "",
                    new RewriteException("internal error: " + cause.getMessage(), cause));
        }
    }

    // Returns whether the wait was interrupted; the pool is left to finish either way.
    private static boolean awaitTermination(ExecutorService pool) {
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(1, TimeUnit.MINUTES)) {
                    return interrupted;
                }
                logger.warn("Still waiting for files in progress");
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
    }

    private void report(RewriteOutcome outcome) {
        if (outcome.isFailure()) {
            listener.onFileFailed(outcome);
        } else if (outcome.changed()) {
            if (mode == RewriteMode.DIFF) {
                listener.onDiff(outcome, UnifiedDiffRenderer.render(outcome));
            }
            listener.onFileRewritten(outcome);
        } else {
            listener.onFileUnchanged(outcome);
        }
    }

    /**
     * Replaces {@code target} with {@code text} through a temporary file in the same directory,
     * so readers see either the old or the new content.
     */
    static void writeAtomically(Path target, String text) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(dir, "." + target.getFileName() + ".", ".tmp");
        try {
            Files.writeString(temp, text, StandardCharsets.UTF_8);
            copyPermissions(target, temp);
            try {
                Files.move(
                        temp,
                        target,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}; replacing directly", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        try {
            Files.setPosixFilePermissions(to, Files.getPosixFilePermissions(from));
        } catch (UnsupportedOperationException e) {
            logger.debug("No POSIX permissions to copy for {}", from);
        }
    }
}
