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

/**
 * How much a run reports.
 *
 * <ul>
 *   <li>QUIET - only failures
 *   <li>NORMAL - one line per rewritten file (default)
 *   <li>VERBOSE - also unchanged files and the run summary
 *   <li>DEBUG - everything, including debug logs
 * </ul>
 */
public enum VerbosityLevel {
    QUIET(0),
    NORMAL(1),
    VERBOSE(2),
    DEBUG(3);

    private final int level;

    VerbosityLevel(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /** True if this level is at least as verbose as {@code other}. */
    public boolean isAtLeast(VerbosityLevel other) {
        return this.level >= other.level;
    }
}
