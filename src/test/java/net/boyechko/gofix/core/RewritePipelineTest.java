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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.boyechko.gofix.fix.Fix;
import net.boyechko.gofix.syntax.GoParser;
import net.boyechko.gofix.syntax.GoPrinter;
import net.boyechko.gofix.syntax.ParseException;
import org.junit.jupiter.api.Test;

class RewritePipelineTest {

    private static final String NET_SOURCE =
            "package main\n\nimport \"net\"\n\nvar a = &net.TCPAddr{ip, 0}\n";

    private static RewritePipeline pipeline(Fix... fixes) {
        return RewritePipeline.builder().withFixes(List.of(fixes)).build();
    }

    private static RewritePipeline defaults() {
        return RewritePipeline.builder().withFixes(FixDefaults.registry().all()).build();
    }

    @Test
    void rewritesAndReportsAppliedFixes() {
        RewriteOutcome outcome = defaults().process("a.go", NET_SOURCE);
        assertFalse(outcome.isFailure());
        assertTrue(outcome.changed());
        assertEquals(List.of("netipv6zone"), outcome.appliedFixNames());
        assertEquals(
                "package main\n\nimport \"net\"\n\nvar a = &net.TCPAddr{IP: ip}\n",
                outcome.newText());
        assertEquals(NET_SOURCE, outcome.originalText());
    }

    @Test
    void untouchedFileKeepsItsExactText() {
        String messy = "package p\n\n\n\nfunc f() {\n  x:=1\n}";
        RewriteOutcome outcome = defaults().process("messy.go", messy);
        assertFalse(outcome.changed());
        assertTrue(outcome.appliedFixNames().isEmpty());
        assertSame(messy, outcome.newText());
    }

    @Test
    void parseErrorIsRecordedNotThrown() {
        RewriteOutcome outcome = defaults().process("bad.go", "package p\n\nfunc f( {\n");
        assertTrue(outcome.isFailure());
        assertInstanceOf(ParseException.class, outcome.error());
        assertFalse(outcome.changed());
        assertEquals(outcome.originalText(), outcome.newText());
        assertTrue(outcome.errorMessage().startsWith("bad.go:3:"), outcome.errorMessage());
    }

    @Test
    void oneBadFileDoesNotAffectTheOthers() {
        RewritePipeline pipeline = defaults();
        RewriteOutcome first = pipeline.process("1.go", NET_SOURCE);
        RewriteOutcome second = pipeline.process("2.go", "package p\n\nvar = 1\n");
        RewriteOutcome third = pipeline.process("3.go", NET_SOURCE);
        assertFalse(first.isFailure());
        assertTrue(second.isFailure());
        assertFalse(third.isFailure());
        assertEquals(first.newText(), third.newText());
    }

    @Test
    void unsupportedSelectFailsOnlyThatFile() {
        RewritePipeline pipeline = defaults();
        String withSelect =
                "package main\n\nimport \"net\"\n\nfunc f(c chan int) {\n"
                        + "\tselect {\n\tcase <-c:\n\t}\n\t_ = &net.TCPAddr{ip, 0}\n}\n";
        RewriteOutcome selectOutcome = pipeline.process("sel.go", withSelect);
        RewriteOutcome plain = pipeline.process("net.go", NET_SOURCE);

        var ex = assertInstanceOf(ParseException.class, selectOutcome.error());
        assertTrue(ex.getDetail().contains("select"), ex.getDetail());
        assertEquals(withSelect, selectOutcome.newText());
        assertTrue(plain.changed());
    }

    @Test
    void silentTreeChangeIsCaught() {
        RewriteOutcome outcome =
                pipeline(TestFixes.dishonest()).process("a.go", "package p\n\nvar v = a\n");
        assertTrue(outcome.isFailure());
        var ex = assertInstanceOf(UnreportedChangeException.class, outcome.error());
        assertEquals("liar", ex.getFixName());
        assertEquals(outcome.originalText(), outcome.newText());
    }

    @Test
    void silentChangeIsCaughtWhenAnotherFixFires() {
        Fix liar = TestFixes.silentRename("liar", "2011-01-01", "b", "c");
        Fix atob = TestFixes.rename("atob", "2011-02-01", "a", "b");
        RewriteOutcome outcome =
                pipeline(liar, atob).process("a.go", "package p\n\nvar v = a\n");
        assertTrue(outcome.isFailure());
        var ex = assertInstanceOf(UnreportedChangeException.class, outcome.error());
        assertEquals("liar", ex.getFixName());
        assertFalse(outcome.changed());
        assertEquals(outcome.originalText(), outcome.newText());
    }

    @Test
    void nonConvergingFixesFail() {
        RewriteOutcome outcome =
                RewritePipeline.builder()
                        .withFixes(List.of(TestFixes.toggle()))
                        .withMaxPasses(4)
                        .build()
                        .process("t.go", "package p\n\nvar v = x\n");
        var ex = assertInstanceOf(ConvergenceException.class, outcome.error());
        assertEquals(4, ex.getPasses());
    }

    @Test
    void independentFixesGiveSameResultInAnyOrder() {
        String source =
                "package main\n\nimport (\n\t\"math\"\n\t\"net\"\n)\n\n"
                        + "var a = &net.UDPAddr{ip, 53}\n\nvar b = math.Fabs(c)\n";
        List<Fix> reversed = new ArrayList<>(FixDefaults.registry().all());
        Collections.reverse(reversed);

        RewriteOutcome inOrder = defaults().process("o.go", source);
        RewriteOutcome outOfOrder =
                RewritePipeline.builder().withFixes(reversed).build().process("o.go", source);

        assertTrue(inOrder.changed());
        assertEquals(inOrder.newText(), outOfOrder.newText());
    }

    @Test
    void nonConvergingFileDoesNotAffectOthers() {
        RewritePipeline pipeline = pipeline(TestFixes.toggle());
        RewriteOutcome stuck = pipeline.process("1.go", "package p\n\nvar v = x\n");
        RewriteOutcome fine = pipeline.process("2.go", "package p\n\nvar v = z\n");
        assertInstanceOf(ConvergenceException.class, stuck.error());
        assertFalse(fine.isFailure());
        assertFalse(fine.changed());
    }

    @Test
    void throwingFixFailsOnlyThatFile() {
        RewriteOutcome outcome =
                pipeline(TestFixes.throwing()).process("t.go", "package p\n");
        var ex = assertInstanceOf(FixFailedException.class, outcome.error());
        assertEquals("boom", ex.getFixName());
    }

    @Test
    void fixThatBreaksSyntaxIsBlamed() {
        Fix breaker = TestFixes.rename("breaker", "2011-01-01", "a", "1x");
        RewriteOutcome outcome = pipeline(breaker).process("b.go", "package p\n\nvar v = a\n");
        var ex = assertInstanceOf(FixFailedException.class, outcome.error());
        assertEquals("breaker", ex.getFixName());
        assertTrue(ex.getMessage().contains("does not parse"), ex.getMessage());
    }

    @Test
    void outputIsDeterministic() {
        RewritePipeline pipeline = defaults();
        String source =
                "package main\n\nimport (\n\t\"math\"\n\t\"net\"\n\t\"sort\"\n)\n\n"
                        + "var a = &net.UDPAddr{ip, 53}\n\nvar b = math.Fabs(sort.SortInts)\n";
        RewriteOutcome first = pipeline.process("d.go", source);
        RewriteOutcome second = pipeline.process("d.go", source);
        assertEquals(first.newText(), second.newText());
        assertEquals(List.of("sortslice", "math", "netipv6zone"), first.appliedFixNames());
    }

    @Test
    void rewritesWithoutRefreshingBetweenFixes() {
        Fix atob = TestFixes.rename("atob", "2011-01-01", "a", "b");
        Fix btoc = TestFixes.rename("btoc", "2011-02-01", "b", "c");
        RewritePipeline pipeline =
                RewritePipeline.builder()
                        .withParser(new GoParser())
                        .withPrinter(new GoPrinter())
                        .withFixes(List.of(atob, btoc))
                        .withRefreshAfterFix(false)
                        .build();
        assertEquals(List.of(atob, btoc), pipeline.getFixes());

        RewriteOutcome outcome = pipeline.process("r.go", "package p\n\nvar v = a\n");
        assertEquals("package p\n\nvar v = c\n", outcome.newText());
        assertEquals(List.of("atob", "btoc"), outcome.appliedFixNames());
    }

    @Test
    void builderRequiresFixes() {
        var ex = assertThrows(IllegalStateException.class, () -> RewritePipeline.builder().build());
        assertTrue(ex.getMessage().contains("withFixes"));
    }
}
