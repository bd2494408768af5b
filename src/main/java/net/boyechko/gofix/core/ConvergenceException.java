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

/**
 * The fix set was still changing the file after the maximum number of passes. This means a fix
 * keeps undoing another fix's work, or its own.
 */
public class ConvergenceException extends RewriteException {
    private final int passes;
    private final List<String> stillFiring;

    public ConvergenceException(int passes, List<String> stillFiring) {
        super(
                "fixes did not converge after "
                        + passes
                        + " passes; still applying: "
                        + String.join(", ", stillFiring));
        this.passes = passes;
        this.stillFiring = List.copyOf(stillFiring);
    }

    public int getPasses() {
        return passes;
    }

    /** Fixes that reported a change in the last pass. */
    public List<String> getStillFiring() {
        return stillFiring;
    }
}
