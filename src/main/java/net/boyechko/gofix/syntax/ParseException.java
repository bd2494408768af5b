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
package net.boyechko.gofix.syntax;

import net.boyechko.gofix.ast.Position;

/** Malformed or unsupported input in one source file. */
public class ParseException extends Exception {
    private final String path;
    private final Position position;
    private final String detail;

    public ParseException(String path, Position position, String detail) {
        super(path + ":" + position + ": " + detail);
        this.path = path;
        this.position = position;
        this.detail = detail;
    }

    public String getPath() {
        return path;
    }

    public Position getPosition() {
        return position;
    }

    /** The message without the path and position prefix. */
    public String getDetail() {
        return detail;
    }
}
