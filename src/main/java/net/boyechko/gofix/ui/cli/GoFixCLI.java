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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import net.boyechko.gofix.core.FixDefaults;
import net.boyechko.gofix.core.RewriteListener;
import net.boyechko.gofix.core.RewriteMode;
import net.boyechko.gofix.core.RewriteOutcome;
import net.boyechko.gofix.core.RewritePipeline;
import net.boyechko.gofix.core.RewriteRunner;
import net.boyechko.gofix.core.RewriteSettings;
import net.boyechko.gofix.core.RunSummary;
import net.boyechko.gofix.core.VerbosityLevel;
import net.boyechko.gofix.fix.Fix;
import net.boyechko.gofix.fix.FixRegistry;
import net.boyechko.gofix.fix.UnknownFixException;
import net.boyechko.gofix.ui.ConsoleReporter;
import net.boyechko.gofix.ui.LoggingListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GoFixCLI {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURES = 1;
    public static final int EXIT_USAGE = 2;

    private static final Logger logger = LoggerFactory.getLogger(GoFixCLI.class);

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            List<Path> paths,
            Set<String> fixNames,
            RewriteMode mode,
            VerbosityLevel verbosity,
            boolean helpRequested) {
        public CLIConfig {
            paths = List.copyOf(paths);
            fixNames = Set.copyOf(fixNames);
            if (mode == null) {
                throw new IllegalArgumentException("Rewrite mode is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }

        /** No paths given: read standard input, write standard output. */
        public boolean useStdin() {
            return paths.isEmpty();
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        List<Path> paths = new ArrayList<>();
        Set<String> fixNames = new LinkedHashSet<>();
        RewriteMode mode = RewriteMode.WRITE;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;
        boolean helpRequested;

        CLIConfig build() {
            return new CLIConfig(paths, fixNames, mode, verbosity, helpRequested);
        }
    }

    private final FixRegistry registry;
    private final RewriteSettings settings;
    private boolean installShutdownHook;

    public GoFixCLI(FixRegistry registry, RewriteSettings settings) {
        this.registry = registry;
        this.settings = settings;
    }

    public static void main(String[] args) {
        GoFixCLI cli = new GoFixCLI(FixDefaults.registry(), RewriteSettings.resolve());
        cli.installShutdownHook = true;
        System.exit(cli.run(args, System.in, System.out, System.err));
    }

    /** Runs the tool and returns the process exit code. */
    public int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        CLIConfig config;
        try {
            config = parseArguments(args);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            err.println(usageMessage(registry));
            return EXIT_USAGE;
        }
        if (config.helpRequested()) {
            out.println(usageMessage(registry));
            return EXIT_OK;
        }
        configureLogging(config.verbosity());

        List<Fix> fixes;
        try {
            fixes =
                    config.fixNames().isEmpty()
                            ? registry.all()
                            : registry.select(config.fixNames());
        } catch (UnknownFixException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
        logger.info("Running fixes {} in {} mode", names(fixes), config.mode());

        RewritePipeline pipeline =
                RewritePipeline.builder().withFixes(fixes).withSettings(settings).build();
        RewriteListener listener = new ConsoleReporter(out, err, config.verbosity());
        if (config.verbosity().isAtLeast(VerbosityLevel.DEBUG)) {
            listener = RewriteListener.compose(listener, new LoggingListener());
        }
        RewriteRunner runner = new RewriteRunner(pipeline, config.mode(), settings, listener);

        if (config.useStdin()) {
            return processStdin(runner, in, out, err);
        }
        return processPaths(runner, config.paths());
    }

    private static int processStdin(
            RewriteRunner runner, InputStream in, PrintStream out, PrintStream err) {
        try {
            RewriteOutcome outcome = runner.runStream(in, out);
            return outcome.isFailure() ? EXIT_FAILURES : EXIT_OK;
        } catch (IOException e) {
            err.println("Error: cannot process standard input: " + e.getMessage());
            return EXIT_FAILURES;
        }
    }

    private int processPaths(RewriteRunner runner, List<Path> paths) {
        CountDownLatch done = new CountDownLatch(1);
        Thread hook = null;
        if (installShutdownHook) {
            hook = new Thread(() -> awaitAfterCancel(runner, done), "gofix-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
        }
        try {
            RunSummary summary = runner.run(paths);
            return summary.hasFailures() ? EXIT_FAILURES : EXIT_OK;
        } finally {
            done.countDown();
            if (hook != null) {
                removeHook(hook);
            }
        }
    }

    // Lets files being written finish when the process is interrupted.
    private static void awaitAfterCancel(RewriteRunner runner, CountDownLatch done) {
        runner.cancel();
        try {
            if (!done.await(10, TimeUnit.SECONDS)) {
                logger.warn("Gave up waiting for files in progress");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("Already shutting down; keeping shutdown hook");
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--fixes=")) {
                b.fixNames.addAll(parseCommaSeparated(arg.substring("--fixes=".length())));
            } else if (arg.startsWith("-r=")) {
                b.fixNames.addAll(parseCommaSeparated(arg.substring("-r=".length())));
            } else {
                switch (arg) {
                    case "-r", "--fixes" -> {
                        if (i + 1 < args.length) {
                            b.fixNames.addAll(parseCommaSeparated(args[++i]));
                        } else {
                            throw new CLIException("Fix names not specified after " + arg);
                        }
                    }
                    case "-diff", "--diff" -> b.mode = RewriteMode.DIFF;
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "-h", "--help", "-?" -> b.helpRequested = true;
                    default -> {
                        if (arg.startsWith("-") && arg.length() > 1) {
                            throw new CLIException("Unknown option: " + arg);
                        }
                        b.paths.add(Paths.get(arg));
                    }
                }
            }
        }

        return b.build();
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        Level level =
                switch (verbosity) {
                    case QUIET -> Level.ERROR;
                    case NORMAL -> Level.WARN;
                    case VERBOSE -> Level.INFO;
                    case DEBUG -> Level.DEBUG;
                };
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx) {
            ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
    }

    private static Set<String> parseCommaSeparated(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static List<String> names(List<Fix> fixes) {
        return fixes.stream().map(Fix::name).toList();
    }

    static String usageMessage(FixRegistry registry) {
        StringBuilder sb = new StringBuilder();
        sb.append("Usage: gofix [-diff] [-r fixname,...] [-q|-v|-vv] [path ...]\n")
                .append("  -h, --help          Show this help message\n")
                .append("  -diff, --diff       Print diffs to standard output instead of rewriting files\n")
                .append("  -r, --fixes <names> Run only these fixes (comma-separated)\n")
                .append("  -q, --quiet         Only report failures\n")
                .append("  -v, --verbose       Also report unchanged files and a summary\n")
                .append("  -vv, --debug        Show all debug information\n")
                .append("With no path, reads standard input and writes standard output.\n")
                .append("Directories are searched recursively for .go files.\n")
                .append("\nAvailable fixes:\n");
        for (Fix fix : registry.all()) {
            sb.append("\n").append(fix.name()).append(" (").append(fix.date()).append(")\n");
            sb.append("\t").append(fix.description()).append("\n");
        }
        return sb.toString();
    }
}
