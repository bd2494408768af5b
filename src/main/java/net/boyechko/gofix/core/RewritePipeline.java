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

import java.util.List;
import net.boyechko.gofix.ast.GoFile;
import net.boyechko.gofix.fix.Fix;
import net.boyechko.gofix.syntax.GoParser;
import net.boyechko.gofix.syntax.GoPrinter;
import net.boyechko.gofix.syntax.ParseException;
import net.boyechko.gofix.syntax.SourceParser;
import net.boyechko.gofix.syntax.SourcePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites one source text: parse, drive the fixes to a fixed point, print.
 *
 * <p>{@link #process(String, String)} never throws; parse errors, fix failures and
 * non-convergence end up in the returned {@link RewriteOutcome}. When no fix applies the
 * original text is returned untouched, so files are never reformatted just for being read.
 *
 * <p>Instances are immutable and may be shared by worker threads.
 */
public class RewritePipeline {
    private static final Logger logger = LoggerFactory.getLogger(RewritePipeline.class);

    private final SourceParser parser;
    private final SourcePrinter printer;
    private final List<Fix> fixes;
    private final int maxPasses;
    private final boolean refreshAfterFix;

    public static class RewritePipelineBuilder {
        private SourceParser parser = new GoParser();
        private SourcePrinter printer = new GoPrinter();
        private List<? extends Fix> fixes;
        private int maxPasses = RewriteSettings.DEFAULT_MAX_PASSES;
        private boolean refreshAfterFix = true;

        public RewritePipelineBuilder withParser(SourceParser parser) {
            this.parser = parser;
            return this;
        }

        public RewritePipelineBuilder withPrinter(SourcePrinter printer) {
            this.printer = printer;
            return this;
        }

        /** Fixes in the order they should run, normally from {@code FixRegistry}. */
        public RewritePipelineBuilder withFixes(List<? extends Fix> fixes) {
            this.fixes = fixes;
            return this;
        }

        public RewritePipelineBuilder withMaxPasses(int maxPasses) {
            this.maxPasses = maxPasses;
            return this;
        }

        public RewritePipelineBuilder withSettings(RewriteSettings settings) {
            this.maxPasses = settings.maxPasses();
            return this;
        }

        /** Whether to print and re-parse the tree after every fix that changed it. */
        public RewritePipelineBuilder withRefreshAfterFix(boolean refreshAfterFix) {
            this.refreshAfterFix = refreshAfterFix;
            return this;
        }

        public RewritePipeline build() {
            if (fixes == null) {
                throw new IllegalStateException(
                        "Fixes must be provided via withFixes(...) before building RewritePipeline");
            }
            return new RewritePipeline(this);
        }
    }

    public static RewritePipelineBuilder builder() {
        return new RewritePipelineBuilder();
    }

    private RewritePipeline(RewritePipelineBuilder builder) {
        this.parser = builder.parser;
        this.printer = builder.printer;
        this.fixes = List.copyOf(builder.fixes);
        this.maxPasses = builder.maxPasses;
        this.refreshAfterFix = builder.refreshAfterFix;
    }

    public List<Fix> getFixes() {
        return fixes;
    }

    /** Rewrites {@code text}, read from {@code path}. */
    public RewriteOutcome process(String path, String text) {
        GoFile file;
        try {
            file = parser.parse(path, text);
        } catch (ParseException e) {
            logger.warn("{}: {}", path, e.getMessage());
            return RewriteOutcome.failure(path, text, e);
        }
        SourceUnit unit = new SourceUnit(path, text, file);

        try {
            DriveResult result = driverFor(path).drive(unit.getFile(), fixes);
            unit.setFile(result.file());
            if (!result.changed()) {
                return RewriteOutcome.success(path, text, text, List.of());
            }
            String rendered = printer.print(unit.getFile());
            logger.debug(
                    "{}: applied {} in {} pass(es)",
                    path,
                    result.appliedFixNames(),
                    result.passes());
            return RewriteOutcome.success(path, text, rendered, result.appliedFixNames());
        } catch (RewriteException e) {
            logger.warn("{}: {}", path, e.getMessage());
            return RewriteOutcome.failure(path, text, e);
        } catch (RuntimeException e) {
            logger.error("{}: unexpected error while rewriting", path, e);
            return RewriteOutcome.failure(
                    path, text, new RewriteException("internal error: " + e.getMessage(), e));
        }
    }

    private FixedPointDriver driverFor(String path) {
        if (!refreshAfterFix) {
            return new FixedPointDriver(maxPasses, FixedPointDriver.Refresher.NONE, printer);
        }
        return new FixedPointDriver(
                maxPasses, tree -> parser.parse(path, printer.print(tree)), printer);
    }
}
