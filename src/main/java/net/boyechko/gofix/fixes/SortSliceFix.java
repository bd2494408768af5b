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

/** {@code sort.SortInts} and friends became {@code sort.Ints}, {@code sort.Float64s}, ... */
public final class SortSliceFix extends RenamePackageMemberFix {

    public SortSliceFix() {
        super(
                "sortslice",
                LocalDate.of(2011, 5, 24),
                "Adapt code from sort.Sort[Ints|Float64s|Strings] to sort.[Ints|Float64s|Strings].",
                "sort",
                Map.of(
                        "SortInts", "Ints",
                        "SortFloat64s", "Float64s",
                        "SortStrings", "Strings"));
    }
}
