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

/** Lexical categories. Keywords and operators carry their spelling in {@link Token#text()}. */
public enum TokenType {
    IDENT,
    INT,
    FLOAT,
    IMAG,
    CHAR,
    STRING,
    KEYWORD,
    OPERATOR,
    /** Explicit {@code ;} or one inserted at a line break, in which case the text is a newline. */
    SEMICOLON,
    COMMENT,
    EOF;

    public boolean isLiteral() {
        return this == INT || this == FLOAT || this == IMAG || this == CHAR || this == STRING;
    }
}
