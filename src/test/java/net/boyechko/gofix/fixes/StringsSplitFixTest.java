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

class StringsSplitFixTest extends GoSourceTestBase {
    private final StringsSplitFix fix = new StringsSplitFix();

    @Test
    void dropsMinusOneAndMovesOtherCountsToSplitN() {
        assertFix(
                fix,
                "package main\n\nimport (\n\t\"bytes\"\n\t\"strings\"\n)\n\nfunc f() {\n"
                        + "\ta := strings.Split(s, \",\", -1)\n"
                        + "\tb := strings.Split(s, \",\", 2)\n"
                        + "\tc := bytes.SplitAfter(buf, sep, n)\n"
                        + "\td := strings.Split(s, \",\")\n"
                        + "}\n",
                "package main\n\nimport (\n\t\"bytes\"\n\t\"strings\"\n)\n\nfunc f() {\n"
                        + "\ta := strings.Split(s, \",\")\n"
                        + "\tb := strings.SplitN(s, \",\", 2)\n"
                        + "\tc := bytes.SplitAfterN(buf, sep, n)\n"
                        + "\td := strings.Split(s, \",\")\n"
                        + "}\n");
    }

    @Test
    void leavesSpreadCallsAndOtherFunctionsAlone() {
        assertNoFix(
                fix,
                "package main\n\nimport \"strings\"\n\nfunc f() {\n"
                        + "\tstrings.Split(args...)\n\tstrings.Fields(s, sep, 1)\n}\n");
    }
}
