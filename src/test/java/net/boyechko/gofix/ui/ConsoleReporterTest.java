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
package net.boyechko.gofix.ui;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.util.List;
import net.boyechko.gofix.ast.Position;
import net.boyechko.gofix.core.RewriteOutcome;
import net.boyechko.gofix.core.RunSummary;
import net.boyechko.gofix.core.VerbosityLevel;
import net.boyechko.gofix.syntax.ParseException;
import org.junit.jupiter.api.Test;

class ConsoleReporterTest {
    private final ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();

    private ConsoleReporter reporter(VerbosityLevel level) {
        return new ConsoleReporter(
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8),
                level);
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private static RewriteOutcome fixed(String path) {
        return RewriteOutcome.success(path, "a\n", "b\n", List.of("sortslice", "netipv6zone"));
    }

    @Test
    void rewrittenFileGetsOneLinePerFix() {
        reporter(VerbosityLevel.NORMAL).onFileRewritten(fixed("x.go"));
        assertEquals("x.go: fixed sortslice\nx.go: fixed netipv6zone\n", err());
        assertEquals("", out());
    }

    @Test
    void quietModeOnlyReportsFailures() {
        ConsoleReporter reporter = reporter(VerbosityLevel.QUIET);
        reporter.onFileRewritten(fixed("x.go"));
        reporter.onFileUnchanged(RewriteOutcome.success("y.go", "a\n", "a\n", List.of()));
        reporter.onFileFailed(
                RewriteOutcome.failure("z.go", "", new NoSuchFileException("z.go")));
        assertEquals("z.go: no such file\n", err());
    }

    @Test
    void parseErrorShowsCaretUnderColumn() {
        String text = "package p\n\nfunc f( {\n";
        var error = new ParseException("bad.go", new Position(3, 9), "expected ')'");
        reporter(VerbosityLevel.NORMAL).onFileFailed(RewriteOutcome.failure("bad.go", text, error));
        assertEquals("bad.go:3:9: expected ')'\nfunc f( {\n        ^\n", err());
    }

    @Test
    void diffGoesToStandardOutput() {
        reporter(VerbosityLevel.NORMAL).onDiff(fixed("x.go"), "diff x.go fixed/x.go\n");
        assertEquals("diff x.go fixed/x.go\n", out());
        assertEquals("", err());
    }

    @Test
    void verboseModeReportsUnchangedAndSummary() {
        ConsoleReporter reporter = reporter(VerbosityLevel.VERBOSE);
        RewriteOutcome same = RewriteOutcome.success("y.go", "a\n", "a\n", List.of());
        reporter.onFileUnchanged(same);
        reporter.onSummary(new RunSummary(List.of(same, fixed("x.go")), 0));
        assertEquals("y.go: unchanged\n2 file(s): 1 fixed, 0 failed\n", err());
    }

    @Test
    void cancelledRunIsMentioned() {
        reporter(VerbosityLevel.NORMAL).onSummary(new RunSummary(List.of(), 3));
        assertEquals("Cancelled; 3 file(s) not processed\n", err());
    }
}
