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

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.util.Arrays;
import java.util.List;

/** Formats the change in a {@link RewriteOutcome} as a unified diff. */
public final class UnifiedDiffRenderer {
    private static final int CONTEXT_LINES = 3;

    private UnifiedDiffRenderer() {}

    /** The diff for a changed outcome, or an empty string if nothing changed. */
    public static String render(RewriteOutcome outcome) {
        if (!outcome.changed()) {
            return "";
        }
        return render(outcome.path(), outcome.originalText(), outcome.newText());
    }

    public static String render(String path, String before, String after) {
        List<String> beforeLines = lines(before);
        List<String> afterLines = lines(after);
        Patch<String> patch = DiffUtils.diff(beforeLines, afterLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unified =
                UnifiedDiffUtils.generateUnifiedDiff(
                        path, "fixed/" + path, beforeLines, patch, CONTEXT_LINES);
        StringBuilder sb = new StringBuilder();
        sb.append("diff ").append(path).append(" fixed/").append(path).append('\n');
        for (String line : unified) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    private static List<String> lines(String text) {
        String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
        return body.isEmpty() ? List.of() : Arrays.asList(body.split("\n", -1));
    }
}
