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

import java.io.PrintStream;
import java.nio.file.NoSuchFileException;
import net.boyechko.gofix.core.RewriteListener;
import net.boyechko.gofix.core.RewriteOutcome;
import net.boyechko.gofix.core.RunSummary;
import net.boyechko.gofix.core.SourceUnit;
import net.boyechko.gofix.core.VerbosityLevel;
import net.boyechko.gofix.syntax.ParseException;

/**
 * Prints run results for a person at a terminal. Diffs go to {@code out}; everything else goes
 * to {@code err}, so {@code out} can be piped into {@code patch}.
 */
public class ConsoleReporter implements RewriteListener {
    private final PrintStream out;
    private final PrintStream err;
    private final VerbosityLevel verbosity;

    public ConsoleReporter(PrintStream out, PrintStream err, VerbosityLevel verbosity) {
        this.out = out;
        this.err = err;
        this.verbosity = verbosity;
    }

    /** One {@code path: fixed name} line per applied fix, in the order they were applied. */
    @Override
    public void onFileRewritten(RewriteOutcome outcome) {
        if (verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            for (String fixName : outcome.appliedFixNames()) {
                err.println(outcome.path() + ": fixed " + fixName);
            }
        }
    }

    @Override
    public void onFileFailed(RewriteOutcome outcome) {
        err.println(describeFailure(outcome));
    }

    @Override
    public void onFileUnchanged(RewriteOutcome outcome) {
        if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            err.println(outcome.path() + ": unchanged");
        }
    }

    @Override
    public void onDiff(RewriteOutcome outcome, String diff) {
        out.print(diff);
        out.flush();
    }

    @Override
    public void onSummary(RunSummary summary) {
        if (summary.skipped() > 0) {
            err.println("Cancelled; " + summary.skipped() + " file(s) not processed");
        }
        if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            err.printf(
                    "%d file(s): %d fixed, %d failed%n",
                    summary.outcomes().size(), summary.changedCount(), summary.failureCount());
        }
    }

    /** A parse error shows the offending line with a caret under the column. */
    static String describeFailure(RewriteOutcome outcome) {
        if (outcome.error() instanceof ParseException pe) {
            return SourceUnit.excerpt(
                    outcome.path(), outcome.originalText(), pe.getPosition(), pe.getDetail());
        }
        if (outcome.error() instanceof NoSuchFileException) {
            return outcome.path() + ": no such file";
        }
        return outcome.path() + ": " + outcome.errorMessage();
    }
}
