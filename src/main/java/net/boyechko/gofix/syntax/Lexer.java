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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.boyechko.gofix.ast.Position;

/**
 * Converts Go source text into tokens, applying the automatic semicolon rule: a line break ends a
 * statement when the last token on the line is an identifier, a literal, one of the keywords
 * {@code break continue fallthrough return}, or one of {@code ++ -- ) ] }}.
 *
 * <p>Comments are kept as {@link TokenType#COMMENT} tokens so the parser can attach them to
 * nodes. A semicolon inserted at a line end is emitted before a comment on that line.
 */
public class Lexer {
    static final Set<String> KEYWORDS =
            Set.of(
                    "break", "case", "chan", "const", "continue", "default", "defer", "else",
                    "fallthrough", "for", "func", "go", "goto", "if", "import", "interface", "map",
                    "package", "range", "return", "select", "struct", "switch", "type", "var");

    // Longest first within each leading character.
    private static final String[] OPERATORS = {
        "<<=", ">>=", "&^=", "...", "&&", "||", "<-", "++", "--", "==", "!=", "<=", ">=", ":=",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<", ">>", "&^", "+", "-", "*", "/", "%",
        "&", "|", "^", "<", ">", "=", "!", "(", ")", "[", "]", "{", "}", ",", ".", ":", "~"
    };

    private final String source;
    private final String path;
    private final List<Token> tokens = new ArrayList<>();
    private int start;
    private int current;
    private int line = 1;
    private int lineStart;
    private boolean insertSemi;

    public Lexer(String source, String path) {
        this.source = source;
        this.path = path;
    }

    /** Tokenizes the whole input; the last token is always {@link TokenType#EOF}. */
    public List<Token> scanTokens() throws ParseException {
        while (current < source.length()) {
            scanToken();
        }
        if (insertSemi) {
            emitAutoSemicolon();
        }
        tokens.add(new Token(TokenType.EOF, "", line, column(current), line));
        return tokens;
    }

    private void scanToken() throws ParseException {
        start = current;
        char c = source.charAt(current);
        switch (c) {
            case ' ', '\t', '\r' -> current++;
            case '\n' -> {
                if (insertSemi) {
                    emitAutoSemicolon();
                }
                current++;
                line++;
                lineStart = current;
            }
            case '"' -> interpretedString();
            case '`' -> rawString();
            case '\'' -> rune();
            case ';' -> {
                current++;
                add(TokenType.SEMICOLON, line, false);
            }
            default -> {
                if (c == '/' && peek(1) == '/') {
                    lineComment();
                } else if (c == '/' && peek(1) == '*') {
                    blockComment();
                } else if (isLetter(c)) {
                    identifier();
                } else if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
                    number();
                } else {
                    operator();
                }
            }
        }
    }

    private void lineComment() {
        if (insertSemi) {
            emitAutoSemicolon();
            start = current;
        }
        while (current < source.length() && source.charAt(current) != '\n') {
            current++;
        }
        String text = source.substring(start, current).stripTrailing();
        tokens.add(new Token(TokenType.COMMENT, text, line, column(start), line));
    }

    private void blockComment() throws ParseException {
        int startLine = line;
        int startColumn = column(start);
        int close = source.indexOf("*/", current + 2);
        if (close < 0) {
            throw error(startLine, startColumn, "comment not terminated");
        }
        String text = source.substring(start, close + 2);
        boolean spansLines = text.indexOf('\n') >= 0;
        boolean endsLine = restOfLineBlank(close + 2);
        if (insertSemi && (spansLines || endsLine)) {
            emitAutoSemicolon();
        }
        advanceOver(close + 2);
        tokens.add(new Token(TokenType.COMMENT, text, startLine, startColumn, line));
    }

    private boolean restOfLineBlank(int from) {
        for (int i = from; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (c != ' ' && c != '\t' && c != '\r') {
                return false;
            }
        }
        return true;
    }

    private void identifier() {
        while (current < source.length()
                && (isLetter(source.charAt(current)) || isDigit(source.charAt(current)))) {
            current++;
        }
        String text = source.substring(start, current);
        if (KEYWORDS.contains(text)) {
            boolean terminates =
                    switch (text) {
                        case "break", "continue", "fallthrough", "return" -> true;
                        default -> false;
                    };
            add(TokenType.KEYWORD, line, terminates);
        } else {
            add(TokenType.IDENT, line, true);
        }
    }

    private void number() {
        TokenType type = TokenType.INT;
        boolean hex = false;
        if (source.charAt(current) == '0' && "xXbBoO".indexOf(peek(1)) >= 0 && peek(1) != 0) {
            hex = peek(1) == 'x' || peek(1) == 'X';
            current += 2;
        }
        while (current < source.length()) {
            char c = source.charAt(current);
            if (isDigit(c) || c == '_' || (hex && isHexLetter(c))) {
                current++;
            } else if (c == '.' && peek(1) != '.') {
                type = TokenType.FLOAT;
                current++;
            } else if ((!hex && (c == 'e' || c == 'E')) || (hex && (c == 'p' || c == 'P'))) {
                type = TokenType.FLOAT;
                current++;
                if (peek(0) == '+' || peek(0) == '-') {
                    current++;
                }
            } else {
                break;
            }
        }
        if (peek(0) == 'i') {
            type = TokenType.IMAG;
            current++;
        }
        add(type, line, true);
    }

    private void interpretedString() throws ParseException {
        quoted('"', TokenType.STRING, "string literal not terminated");
    }

    private void rune() throws ParseException {
        quoted('\'', TokenType.CHAR, "rune literal not terminated");
    }

    private void quoted(char quote, TokenType type, String message) throws ParseException {
        current++;
        while (true) {
            if (current >= source.length() || source.charAt(current) == '\n') {
                throw error(line, column(start), message);
            }
            char c = source.charAt(current++);
            if (c == '\\') {
                current++;
            } else if (c == quote) {
                break;
            }
        }
        add(type, line, true);
    }

    private void rawString() throws ParseException {
        int startLine = line;
        int close = source.indexOf('`', current + 1);
        if (close < 0) {
            throw error(startLine, column(start), "raw string literal not terminated");
        }
        int startColumn = column(start);
        advanceOver(close + 1);
        tokens.add(
                new Token(
                        TokenType.STRING,
                        source.substring(start, current),
                        startLine,
                        startColumn,
                        line));
        insertSemi = true;
    }

    private void operator() throws ParseException {
        for (String op : OPERATORS) {
            if (source.startsWith(op, current)) {
                current += op.length();
                boolean terminates =
                        switch (op) {
                            case "++", "--", ")", "]", "}" -> true;
                            default -> false;
                        };
                add(TokenType.OPERATOR, line, terminates);
                return;
            }
        }
        throw error(
                line,
                column(current),
                "unexpected character " + describeChar(source.charAt(current)));
    }

    private void emitAutoSemicolon() {
        tokens.add(new Token(TokenType.SEMICOLON, "\n", line, column(current), line));
        insertSemi = false;
    }

    private void add(TokenType type, int tokenLine, boolean terminates) {
        tokens.add(
                new Token(
                        type,
                        source.substring(start, current),
                        tokenLine,
                        column(start),
                        tokenLine));
        insertSemi = terminates;
    }

    // Moves to offset, counting any line breaks on the way.
    private void advanceOver(int offset) {
        while (current < offset) {
            if (source.charAt(current) == '\n') {
                line++;
                lineStart = current + 1;
            }
            current++;
        }
    }

    private char peek(int ahead) {
        int i = current + ahead;
        return i < source.length() ? source.charAt(i) : 0;
    }

    private int column(int offset) {
        return offset - lineStart + 1;
    }

    private ParseException error(int errLine, int errColumn, String message) {
        return new ParseException(path, new Position(errLine, errColumn), message);
    }

    private static boolean isLetter(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexLetter(char c) {
        return (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static String describeChar(char c) {
        return c < ' ' ? String.format("U+%04X", (int) c) : "'" + c + "'";
    }
}
