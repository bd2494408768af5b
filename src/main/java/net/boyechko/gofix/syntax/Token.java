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

/**
 * A lexical token. {@code endLine} differs from {@code line} only for raw strings and block
 * comments that span several lines.
 */
public record Token(TokenType type, String text, int line, int column, int endLine) {

    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isOperator(String op) {
        return is(TokenType.OPERATOR, op);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenType.KEYWORD, keyword);
    }

    /** Human readable form for error messages. */
    public String describe() {
        return switch (type) {
            case EOF -> "EOF";
            case SEMICOLON -> "\n".equals(text) ? "newline" : "';'";
            case STRING, CHAR, INT, FLOAT, IMAG -> "literal " + text;
            default -> "'" + text + "'";
        };
    }
}
