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
package net.boyechko.gofix;

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.gofix.ast.GoFile;
import net.boyechko.gofix.fix.Fix;
import net.boyechko.gofix.syntax.GoParser;
import net.boyechko.gofix.syntax.GoPrinter;
import net.boyechko.gofix.syntax.ParseException;

/** Parsing and printing helpers shared by tests that work on Go source text. */
public abstract class GoSourceTestBase {
    protected static final GoParser PARSER = new GoParser();
    protected static final GoPrinter PRINTER = new GoPrinter();

    protected static GoFile parse(String source) {
        try {
            return PARSER.parse("test.go", source);
        } catch (ParseException e) {
            return fail("test source does not parse: " + e.getMessage());
        }
    }

    protected static String print(GoFile file) {
        return PRINTER.print(file);
    }

    /**
     * Runs {@code fix} once over {@code in} and checks the printed result. Then runs it again
     * over the re-parsed result and checks that it finds nothing more to do.
     */
    protected static void assertFix(Fix fix, String in, String expected) {
        GoFile file = parse(in);
        boolean changed = fix.precondition(file) && fix.transform(file);
        String out = print(file);
        assertEquals(expected, out);
        assertEquals(!in.equals(out), changed, "transform must report exactly when it changes");

        GoFile again = parse(out);
        assertFalse(
                fix.precondition(again) && fix.transform(again),
                fix.name() + " should not apply to its own output");
        assertEquals(out, print(again));
    }

    /** Checks that {@code fix} leaves {@code in} alone. */
    protected static void assertNoFix(Fix fix, String in) {
        GoFile file = parse(in);
        assertFalse(fix.precondition(file) && fix.transform(file), "fix should not apply");
        assertEquals(in, print(file));
    }
}
