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
package net.boyechko.gofix.fixes;

import java.time.LocalDate;
import java.util.Map;

public final class MathFix extends RenamePackageMemberFix {

    public MathFix() {
        super(
                "math",
                LocalDate.of(2011, 9, 29),
                "Remove the leading F from math functions such as Fabs.",
                "math",
                Map.of(
                        "Fabs", "Abs",
                        "Fdim", "Dim",
                        "Fmax", "Max",
                        "Fmin", "Min",
                        "Fmod", "Mod"));
    }
}
