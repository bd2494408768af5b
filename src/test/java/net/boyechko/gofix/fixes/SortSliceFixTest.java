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

import net.boyechko.gofix.GoSourceTestBase;
import org.junit.jupiter.api.Test;

class SortSliceFixTest extends GoSourceTestBase {
    private final SortSliceFix fix = new SortSliceFix();

    @Test
    void renamesSortFunctions() {
        assertFix(
                fix,
                "package main\n\nimport (\n\t\"sort\"\n)\n\nfunc main() {\n"
                        + "\tvar s []string\n\tsort.SortStrings(s)\n"
                        + "\tvar i []int\n\tsort.SortInts(i)\n"
                        + "\tvar f []float64\n\tsort.SortFloat64s(f)\n}\n",
                "package main\n\nimport (\n\t\"sort\"\n)\n\nfunc main() {\n"
                        + "\tvar s []string\n\tsort.Strings(s)\n"
                        + "\tvar i []int\n\tsort.Ints(i)\n"
                        + "\tvar f []float64\n\tsort.Float64s(f)\n}\n");
    }

    @Test
    void followsImportAlias() {
        assertFix(
                fix,
                "package main\n\nimport s2 \"sort\"\n\nfunc main() {\n\ts2.SortInts(x)\n}\n",
                "package main\n\nimport s2 \"sort\"\n\nfunc main() {\n\ts2.Ints(x)\n}\n");
    }

    @Test
    void leavesOtherReceiversAlone() {
        assertNoFix(
                fix,
                "package main\n\nimport \"sort\"\n\nfunc main() {\n\tx.SortInts(a)\n"
                        + "\tsort.Sort(y)\n}\n");
    }

    @Test
    void needsTheImport() {
        assertNoFix(fix, "package main\n\nfunc main() {\n\tsort.SortInts(a)\n}\n");
    }
}
