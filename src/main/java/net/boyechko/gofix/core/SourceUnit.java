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

import net.boyechko.gofix.ast.GoFile;
import net.boyechko.gofix.ast.Position;
import net.boyechko.gofix.syntax.LineIndex;

/** One file being rewritten: its path, its text as read, and its current tree. */
public final class SourceUnit {
    private final String path;
    private final String originalText;
    private GoFile file;

    public SourceUnit(String path, String originalText, GoFile file) {
        this.path = path;
        this.originalText = originalText;
        this.file = file;
    }

    public String getPath() {
        return path;
    }

    public String getOriginalText() {
        return originalText;
    }

    public GoFile getFile() {
        return file;
    }

    public void setFile(GoFile file) {
        this.file = file;
    }

    /** {@code path:line:column: message} followed by the offending source line and a caret. */
    public static String excerpt(String path, String text, Position pos, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append(path).append(':').append(pos).append(": ").append(message);
        if (pos.isKnown()) {
            String line = new LineIndex(text).lineText(pos.line());
            if (!line.isEmpty()) {
                sb.append('\n').append(line).append('\n');
                for (int i = 1; i < pos.column() && i <= line.length(); i++) {
                    sb.append(line.charAt(i - 1) == '\t' ? '\t' : ' ');
                }
                sb.append('^');
            }
        }
        return sb.toString();
    }
}
