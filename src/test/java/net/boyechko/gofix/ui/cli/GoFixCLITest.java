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
package net.boyechko.gofix.ui.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import net.boyechko.gofix.core.FixDefaults;
import net.boyechko.gofix.core.RewriteMode;
import net.boyechko.gofix.core.RewriteSettings;
import net.boyechko.gofix.core.VerbosityLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GoFixCLITest {
    private static final String NET_SOURCE =
            "package main\n\nimport \"net\"\n\nvar a = &net.TCPAddr{ip, 0}\n";
    private static final String NET_FIXED =
            "package main\n\nimport \"net\"\n\nvar a = &net.TCPAddr{IP: ip}\n";

    @TempDir Path dir;

    private final ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();

    private int run(InputStream in, String... args) {
        GoFixCLI cli =
                new GoFixCLI(FixDefaults.registry(), RewriteSettings.defaults().withWorkers(2));
        return cli.run(
                args,
                in,
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) {
        return run(InputStream.nullInputStream(), args);
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    private Path write(String name, String text) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void helpListsAvailableFixes() {
        assertEquals(GoFixCLI.EXIT_OK, run("-h"));
        assertTrue(out().startsWith("Usage: gofix"), out());
        assertTrue(out().contains("\nnetipv6zone (2012-11-26)\n\t"), out());
        assertTrue(out().indexOf("sortslice") < out().indexOf("netipv6zone"));
    }

    @Test
    void unknownFixIsUsageError() throws IOException {
        Path file = write("a.go", NET_SOURCE);
        assertEquals(GoFixCLI.EXIT_USAGE, run("-r", "bogus", file.toString()));
        assertTrue(err().contains("Error: unknown fix: bogus"), err());
        assertEquals(NET_SOURCE, Files.readString(file));
    }

    @Test
    void unknownOptionIsUsageError() {
        assertEquals(GoFixCLI.EXIT_USAGE, run("-x"));
        assertTrue(err().startsWith("Error: Unknown option: -x"), err());
        assertTrue(err().contains("Usage: gofix"));
    }

    @Test
    void rewritesFilesInPlace() throws IOException {
        Path file = write("a.go", NET_SOURCE);
        assertEquals(GoFixCLI.EXIT_OK, run(dir.toString()));
        assertEquals(NET_FIXED, Files.readString(file));
        assertTrue(err().contains(file + ": fixed netipv6zone"), err());
    }

    @Test
    void selectedFixesOnly() throws IOException {
        Path file = write("a.go", NET_SOURCE);
        assertEquals(GoFixCLI.EXIT_OK, run("-r=sortslice", file.toString()));
        assertEquals(NET_SOURCE, Files.readString(file));
    }

    @Test
    void diffModePrintsWithoutWriting() throws IOException {
        Path file = write("a.go", NET_SOURCE);
        assertEquals(GoFixCLI.EXIT_OK, run("-diff", file.toString()));
        assertEquals(NET_SOURCE, Files.readString(file));
        assertTrue(out().contains("\n-var a = &net.TCPAddr{ip, 0}\n"), out());
        assertTrue(out().contains("\n+var a = &net.TCPAddr{IP: ip}\n"), out());
    }

    @Test
    void readsStandardInputWithoutPaths() {
        var in = new ByteArrayInputStream(NET_SOURCE.getBytes(StandardCharsets.UTF_8));
        assertEquals(GoFixCLI.EXIT_OK, run(in));
        assertEquals(NET_FIXED, out());
    }

    @Test
    void parseFailureGivesFailureExitCode() throws IOException {
        Path bad = write("bad.go", "package p\n\nfunc f( {\n");
        Path good = write("good.go", NET_SOURCE);
        assertEquals(GoFixCLI.EXIT_FAILURES, run("-q", bad.toString(), good.toString()));
        assertTrue(err().contains(bad + ":3:"), err());
        assertTrue(err().contains("^"), err());
        assertEquals(NET_FIXED, Files.readString(good));
    }

    @Test
    void parsesOptions() throws GoFixCLI.CLIException {
        GoFixCLI.CLIConfig config =
                GoFixCLI.parseArguments(
                        new String[] {"-diff", "-v", "--fixes", "math, sortslice", "a.go", "b"});
        assertEquals(RewriteMode.DIFF, config.mode());
        assertEquals(VerbosityLevel.VERBOSE, config.verbosity());
        assertEquals(Set.of("math", "sortslice"), config.fixNames());
        assertEquals(List.of(Path.of("a.go"), Path.of("b")), config.paths());
        assertFalse(config.useStdin());
    }

    @Test
    void defaultsToWriteModeOnStandardInput() throws GoFixCLI.CLIException {
        GoFixCLI.CLIConfig config = GoFixCLI.parseArguments(new String[0]);
        assertEquals(RewriteMode.WRITE, config.mode());
        assertEquals(VerbosityLevel.NORMAL, config.verbosity());
        assertTrue(config.useStdin());
    }

    @Test
    void missingFixListIsRejected() {
        var ex =
                assertThrows(
                        GoFixCLI.CLIException.class,
                        () -> GoFixCLI.parseArguments(new String[] {"-r"}));
        assertEquals("Fix names not specified after -r", ex.getMessage());
    }
}
