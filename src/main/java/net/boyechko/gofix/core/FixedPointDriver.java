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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.gofix.ast.GoFile;
import net.boyechko.gofix.fix.Fix;
import net.boyechko.gofix.syntax.ParseException;
import net.boyechko.gofix.syntax.SourcePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies an ordered list of fixes to one tree until a whole pass changes nothing.
 *
 * <p>One pass runs every fix in order, calling {@link Fix#transform} when its precondition holds.
 * Repeating the passes lets a fix pick up patterns that another fix (or itself) only just
 * produced. Correct fix sets settle in one or two passes; reaching {@code maxPasses} raises
 * {@link ConvergenceException}.
 *
 * <p>With a {@link SourcePrinter} the driver also checks every fix that reports no change: if
 * the printout differs from the one taken before the fix ran, the fix is blamed with {@link
 * UnreportedChangeException}.
 *
 * <p>Not thread safe per tree, but a driver holds no per-tree state and may be shared.
 */
public class FixedPointDriver {
    private static final Logger logger = LoggerFactory.getLogger(FixedPointDriver.class);

    /** Replaces the tree after a fix has changed it, e.g. by printing and re-parsing it. */
    @FunctionalInterface
    public interface Refresher {
        Refresher NONE = file -> file;

        GoFile refresh(GoFile file) throws ParseException;
    }

    private final int maxPasses;
    private final Refresher refresher;
    private final SourcePrinter checker;

    public FixedPointDriver() {
        this(RewriteSettings.DEFAULT_MAX_PASSES, Refresher.NONE);
    }

    public FixedPointDriver(int maxPasses) {
        this(maxPasses, Refresher.NONE);
    }

    public FixedPointDriver(int maxPasses, Refresher refresher) {
        this(maxPasses, refresher, null);
    }

    /**
     * @param checker prints the tree around each fix that reports no change, or {@code null} to
     *     trust the fixes
     */
    public FixedPointDriver(int maxPasses, Refresher refresher, SourcePrinter checker) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be at least 1: " + maxPasses);
        }
        this.maxPasses = maxPasses;
        this.refresher = refresher;
        this.checker = checker;
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    /**
     * Drives {@code fixes} over {@code file} to a fixed point.
     *
     * @throws ConvergenceException if fixes still report changes after {@code maxPasses} passes
     * @throws FixFailedException if a fix throws or its result cannot be refreshed
     * @throws UnreportedChangeException if a fix changed the tree but returned {@code false}
     */
    public DriveResult drive(GoFile file, List<? extends Fix> fixes) throws RewriteException {
        GoFile current = file;
        Set<String> applied = new LinkedHashSet<>();
        List<String> firedLastPass = List.of();
        int pass = 0;
        String before = snapshot(null, current);
        while (true) {
            pass++;
            if (pass > maxPasses) {
                throw new ConvergenceException(maxPasses, firedLastPass);
            }
            List<String> fired = new ArrayList<>();
            for (Fix fix : fixes) {
                if (!run(fix, current)) {
                    if (checker != null && !snapshot(fix, current).equals(before)) {
                        throw new UnreportedChangeException(fix.name());
                    }
                    continue;
                }
                fired.add(fix.name());
                applied.add(fix.name());
                logger.debug("Pass {}: applied {}", pass, fix.name());
                current = refresh(fix, current);
                before = snapshot(fix, current);
            }
            if (fired.isEmpty()) {
                logger.debug("Converged after {} pass(es); applied {}", pass, applied);
                return new DriveResult(current, new ArrayList<>(applied), pass);
            }
            firedLastPass = fired;
        }
    }

    private static boolean run(Fix fix, GoFile file) throws FixFailedException {
        try {
            return fix.precondition(file) && fix.transform(file);
        } catch (RuntimeException e) {
            throw new FixFailedException(fix.name(), String.valueOf(e.getMessage()), e);
        }
    }

    // Null when unchecked; a fix that leaves an unprintable tree is blamed like a failed refresh.
    private String snapshot(Fix fix, GoFile file) throws FixFailedException {
        if (checker == null) {
            return null;
        }
        try {
            return checker.print(file);
        } catch (RuntimeException e) {
            if (fix == null) {
                throw e;
            }
            throw new FixFailedException(
                    fix.name(), "produced a tree that cannot be printed: " + e.getMessage(), e);
        }
    }

    private GoFile refresh(Fix fix, GoFile file) throws FixFailedException {
        try {
            return refresher.refresh(file);
        } catch (ParseException e) {
            throw new FixFailedException(
                    fix.name(), "produced source that does not parse: " + e.getDetail(), e);
        } catch (RuntimeException e) {
            throw new FixFailedException(
                    fix.name(), "produced a tree that cannot be printed: " + e.getMessage(), e);
        }
    }
}
