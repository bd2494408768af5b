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
import org.junit.jupiter.api.Test;

class UnifiedDiffRendererTest {

    @Test
    void rendersHeaderAndHunk() {
        String diff = UnifiedDiffRenderer.render("a.go", "x\ny\nz\n", "x\nY\nz\n");
        List<String> lines = diff.lines().toList();
        assertEquals("diff a.go fixed/a.go", lines.get(0));
        assertEquals("--- a.go", lines.get(1));
        assertEquals("+++ fixed/a.go", lines.get(2));
        assertTrue(lines.get(3).startsWith("@@ -1,3 +1,3 @@"), lines.get(3));
        assertTrue(lines.contains("-y"));
        assertTrue(lines.contains("+Y"));
        assertTrue(lines.contains(" x"));
    }

    @Test
    void unchangedOutcomeHasNoDiff() {
        RewriteOutcome same = RewriteOutcome.success("a.go", "x\n", "x\n", List.of());
        assertEquals("", UnifiedDiffRenderer.render(same));
    }

    @Test
    void contextIsLimitedToThreeLines() {
        String before = "1\n2\n3\n4\n5\n6\n7\n8\n9\n";
        String after = "1\n2\n3\n4\n5\n6\n7\n8\nnine\n";
        String diff = UnifiedDiffRenderer.render("n.go", before, after);
        assertFalse(diff.contains("\n 5\n"), diff);
        assertTrue(diff.contains("\n 6\n"), diff);
    }
}
