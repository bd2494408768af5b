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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.gofix.GoSourceTestBase;
import net.boyechko.gofix.ast.GoFile;
import net.boyechko.gofix.ast.Position;
import net.boyechko.gofix.fix.Fix;
import net.boyechko.gofix.syntax.ParseException;
import org.junit.jupiter.api.Test;

class FixedPointDriverTest extends GoSourceTestBase {

    @Test
    void laterFixOutputIsPickedUpByEarlierFixInNextPass() throws RewriteException {
        GoFile file = parse("package p\n\nvar v = a\n");
        Fix bToC = TestFixes.rename("btoc", "2011-01-01", "b", "c");
        Fix aToB = TestFixes.rename("atob", "2012-01-01", "a", "b");

        DriveResult result = new FixedPointDriver().drive(file, List.of(bToC, aToB));

        assertEquals("package p\n\nvar v = c\n", print(result.file()));
        assertEquals(List.of("atob", "btoc"), result.appliedFixNames());
        assertEquals(3, result.passes());
        assertTrue(result.changed());
    }

    @Test
    void settlesInOnePassWhenNothingApplies() throws RewriteException {
        GoFile file = parse("package p\n\nvar v = a\n");
        Fix unused = TestFixes.rename("n", "2011-01-01", "q", "r");
        DriveResult result = new FixedPointDriver().drive(file, List.of(unused));
        assertFalse(result.changed());
        assertEquals(1, result.passes());
        assertSame(file, result.file());
    }

    @Test
    void togglingFixHitsPassLimit() {
        GoFile file = parse("package p\n\nvar v = x\n");
        var ex =
                assertThrows(
                        ConvergenceException.class,
                        () -> new FixedPointDriver(5).drive(file, List.of(TestFixes.toggle())));
        assertEquals(5, ex.getPasses());
        assertEquals(List.of("toggle"), ex.getStillFiring());
    }

    @Test
    void throwingFixBecomesFixFailure() {
        GoFile file = parse("package p\n\nvar v = x\n");
        var ex =
                assertThrows(
                        FixFailedException.class,
                        () -> new FixedPointDriver().drive(file, List.of(TestFixes.throwing())));
        assertEquals("boom", ex.getFixName());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertTrue(ex.getMessage().contains("kaboom"));
    }

    @Test
    void transformIsSkippedWhenPreconditionFails() throws RewriteException {
        Fix guarded =
                Fix.of(
                        "guarded",
                        "2011-01-01",
                        "never runs",
                        f -> false,
                        f -> {
                            throw new AssertionError("transform must not run");
                        });
        DriveResult result = new FixedPointDriver().drive(parse("package p\n"), List.of(guarded));
        assertFalse(result.changed());
    }

    @Test
    void refreshFailureIsBlamedOnTheFix() {
        GoFile file = parse("package p\n\nvar v = a\n");
        FixedPointDriver driver =
                new FixedPointDriver(
                        10,
                        tree -> {
                            throw new ParseException("t.go", new Position(3, 9), "bad token");
                        });
        Fix aToB = TestFixes.rename("atob", "2011-01-01", "a", "b");
        var ex = assertThrows(FixFailedException.class, () -> driver.drive(file, List.of(aToB)));
        assertEquals("atob", ex.getFixName());
        assertTrue(ex.getMessage().contains("does not parse"), ex.getMessage());
    }

    @Test
    void checkerBlamesFixThatHidesItsChange() {
        GoFile file = parse("package p\n\nvar v = a\n");
        FixedPointDriver driver =
                new FixedPointDriver(10, FixedPointDriver.Refresher.NONE, PRINTER);
        Fix liar = TestFixes.silentRename("liar", "2011-01-01", "b", "c");
        Fix aToB = TestFixes.rename("atob", "2011-02-01", "a", "b");

        var ex =
                assertThrows(
                        UnreportedChangeException.class,
                        () -> driver.drive(file, List.of(liar, aToB)));
        assertEquals("liar", ex.getFixName());
    }

    @Test
    void withoutCheckerSilentChangesGoUnnoticed() throws RewriteException {
        GoFile file = parse("package p\n\nvar v = a\n");
        Fix liar = TestFixes.silentRename("liar", "2011-01-01", "b", "c");
        Fix aToB = TestFixes.rename("atob", "2011-02-01", "a", "b");

        DriveResult result = new FixedPointDriver().drive(file, List.of(liar, aToB));

        assertEquals(List.of("atob"), result.appliedFixNames());
        assertEquals("package p\n\nvar v = c\n", print(result.file()));
    }

    @Test
    void rejectsNonPositivePassLimit() {
        assertThrows(IllegalArgumentException.class, () -> new FixedPointDriver(0));
    }
}
