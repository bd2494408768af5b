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

/**
 * Result of driving fixes to a fixed point.
 *
 * @param file the final tree; a new instance if the driver re-parsed after a fix
 * @param appliedFixNames fixes that changed the tree, in order of first application
 * @param passes passes run, including the final pass that changed nothing
 */
public record DriveResult(GoFile file, List<String> appliedFixNames, int passes) {

    public DriveResult {
        appliedFixNames = List.copyOf(appliedFixNames);
    }

    public boolean changed() {
        return !appliedFixNames.isEmpty();
    }
}
