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

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import net.boyechko.gofix.fix.Fix;
import net.boyechko.gofix.syntax.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RewriteRunnerTest {

    private static final String OLD = "package p\n\nvar v = a\n";
    private static final String NEW = "package p\n\nvar v = b\n";
    private static final String BROKEN = "package p\n\nfunc f( {\n";

    @TempDir Path dir;

    private final RecordingRewriteListener listener = new RecordingRewriteListener();

    private RewriteRunner runner(RewriteMode mode) {
        RewritePipeline pipeline =
                RewritePipeline.builder()
                        .withFixes(List.of(TestFixes.rename("atob", "2011-01-01", "a", "b")))
                        .build();
        return new RewriteRunner(
                pipeline, mode, RewriteSettings.defaults().withWorkers(2), listener);
    }

    private Path write(String name, String text) throws IOException {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void writeModeRewritesFilesInPlace() throws IOException {
        Path changed = write("a.go", OLD);
        Path same = write("b.go", "package p\n\nvar w = c\n");

        RunSummary summary = runner(RewriteMode.WRITE).run(List.of(changed, same));

        assertEquals(NEW, Files.readString(changed));
        assertEquals("package p\n\nvar w = c\n", Files.readString(same));
        assertEquals(1, summary.changedCount());
        assertFalse(summary.hasFailures());
        assertEquals(List.of("atob"), listener.rewritten.get(0).appliedFixNames());
        assertEquals(1, listener.unchanged.size());
        try (var leftovers = Files.list(dir)) {
            assertEquals(2, leftovers.count(), "no temporary files should remain");
        }
    }

    @Test
    void diffModeLeavesFilesAlone() throws IOException {
        Path file = write("a.go", OLD);

        runner(RewriteMode.DIFF).run(List.of(file));

        assertEquals(OLD, Files.readString(file));
        assertEquals(1, listener.diffs.size());
        String diff = listener.diffs.get(0);
        assertTrue(diff.contains("\n-var v = a\n"), diff);
        assertTrue(diff.contains("\n+var v = b\n"), diff);
        assertEquals(
                List.of("diff " + file, "rewritten " + file, "summary"), listener.events);
    }

    @Test
    void directoriesAreSearchedForSourceFiles() throws IOException {
        Path top = write("a.go", OLD);
        Path nested = write("sub/deeper/c.go", OLD);
        write(".hidden/d.go", OLD);
        write("sub/.e.go", OLD);
        write("notes.txt", OLD);

        RunSummary summary = runner(RewriteMode.WRITE).run(List.of(dir));

        assertEquals(2, summary.outcomes().size());
        assertEquals(NEW, Files.readString(top));
        assertEquals(NEW, Files.readString(nested));
        assertEquals(OLD, Files.readString(dir.resolve(".hidden/d.go")));
        assertEquals(OLD, Files.readString(dir.resolve("sub/.e.go")));
        assertEquals(OLD, Files.readString(dir.resolve("notes.txt")));
    }

    @Test
    void badFileDoesNotStopTheRun() throws IOException {
        Path bad = write("a.go", BROKEN);
        Path good = write("b.go", OLD);

        RunSummary summary = runner(RewriteMode.WRITE).run(List.of(bad, good));

        assertTrue(summary.hasFailures());
        assertEquals(1, summary.failureCount());
        assertEquals(BROKEN, Files.readString(bad));
        assertEquals(NEW, Files.readString(good));
        assertInstanceOf(ParseException.class, listener.failed.get(0).error());
    }

    @Test
    void missingFileIsReportedAsFailure() {
        Path missing = dir.resolve("missing.go");

        RunSummary summary = runner(RewriteMode.WRITE).run(List.of(missing));

        assertEquals(1, summary.failureCount());
        assertInstanceOf(NoSuchFileException.class, listener.failed.get(0).error());
    }

    @Test
    void cancelledRunSkipsFiles() throws IOException {
        Path file = write("a.go", OLD);
        RewriteRunner runner = runner(RewriteMode.WRITE);
        runner.cancel();

        RunSummary summary = runner.run(List.of(file));

        assertTrue(runner.isCancelled());
        assertEquals(1, summary.skipped());
        assertTrue(summary.outcomes().isEmpty());
        assertEquals(OLD, Files.readString(file));
    }

    @Test
    void interruptedRunStillReportsFilesInProgress() throws Exception {
        Path a = write("a.go", OLD);
        Path b = write("b.go", OLD);
        Path c = write("c.go", OLD);
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        Fix blocking =
                Fix.of(
                        "atob",
                        "2011-01-01",
                        "renames a to b once released",
                        file -> {
                            started.countDown();
                            try {
                                release.await();
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                                throw new IllegalStateException(e);
                            }
                            return TestFixes.rename("atob", "2011-01-01", "a", "b")
                                    .transform(file);
                        });
        RewriteRunner runner =
                new RewriteRunner(
                        RewritePipeline.builder().withFixes(List.of(blocking)).build(),
                        RewriteMode.WRITE,
                        RewriteSettings.defaults().withWorkers(2),
                        listener);
        AtomicReference<RunSummary> summary = new AtomicReference<>();
        AtomicBoolean interruptKept = new AtomicBoolean();
        Thread caller =
                new Thread(
                        () -> {
                            summary.set(runner.run(List.of(a, b, c)));
                            interruptKept.set(Thread.currentThread().isInterrupted());
                        });

        caller.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));
        caller.interrupt();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!runner.isCancelled() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(runner.isCancelled());
        release.countDown();
        caller.join(TimeUnit.SECONDS.toMillis(10));

        assertFalse(caller.isAlive());
        assertTrue(interruptKept.get());
        assertEquals(2, summary.get().outcomes().size());
        assertEquals(1, summary.get().skipped());
        assertEquals(NEW, Files.readString(a));
        assertEquals(NEW, Files.readString(b));
        assertEquals(OLD, Files.readString(c));
        assertEquals(List.of("rewritten " + a, "rewritten " + b, "summary"), listener.events);
    }

    @Test
    void outcomesAreReportedInPathOrder() throws IOException {
        Path c = write("c.go", OLD);
        Path a = write("a.go", OLD);
        Path b = write("b.go", BROKEN);

        runner(RewriteMode.WRITE).run(List.of(c, a, b));

        assertEquals(
                List.of("rewritten " + a, "failed " + b, "rewritten " + c, "summary"),
                listener.events);
    }

    @Test
    void streamWriteModePrintsNewText() throws IOException {
        var out = new ByteArrayOutputStream();

        RewriteOutcome outcome = runner(RewriteMode.WRITE).runStream(input(OLD), out);

        assertEquals(NEW, out.toString(StandardCharsets.UTF_8));
        assertEquals(RewriteRunner.STDIN_NAME, outcome.path());
        assertEquals(List.of("rewritten standard input"), listener.events);
    }

    @Test
    void streamDiffModePrintsDiff() throws IOException {
        var out = new ByteArrayOutputStream();

        runner(RewriteMode.DIFF).runStream(input(OLD), out);

        String diff = out.toString(StandardCharsets.UTF_8);
        assertTrue(diff.startsWith("diff standard input fixed/standard input\n"), diff);
        assertTrue(diff.contains("+var v = b"), diff);
    }

    @Test
    void streamFailureWritesNothing() throws IOException {
        var out = new ByteArrayOutputStream();

        RewriteOutcome outcome = runner(RewriteMode.WRITE).runStream(input(BROKEN), out);

        assertTrue(outcome.isFailure());
        assertEquals(0, out.size());
        assertEquals(List.of("failed standard input"), listener.events);
    }

    @Test
    void runsWithoutListener() throws IOException {
        Path file = write("a.go", OLD);
        RewritePipeline pipeline =
                RewritePipeline.builder()
                        .withFixes(List.of(TestFixes.rename("atob", "2011-01-01", "a", "b")))
                        .build();
        RewriteRunner runner =
                new RewriteRunner(
                        pipeline,
                        RewriteMode.WRITE,
                        RewriteSettings.defaults(),
                        RewriteListener.none());

        RunSummary summary = runner.run(List.of(file));

        assertEquals(1, summary.changedCount());
        assertEquals(NEW, Files.readString(file));
    }

    @Test
    void atomicWriteReplacesContent() throws IOException {
        Path file = write("x.go", "old\n");

        RewriteRunner.writeAtomically(file, "new\n");

        assertEquals("new\n", Files.readString(file));
        try (var entries = Files.list(dir)) {
            assertEquals(1, entries.count());
        }
    }

    private static ByteArrayInputStream input(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
