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
package net.boyechko.gofix.ast;

import java.util.List;

/** A literal of basic type. {@link #getValue()} is the literal exactly as written in source. */
public class BasicLit extends Expr {
    public enum Kind {
        INT,
        FLOAT,
        IMAG,
        CHAR,
        STRING
    }

    private final Kind kind;
    private String value;

    public BasicLit(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    public Kind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    @Override
    public List<Object> children() {
        return List.of();
    }

    @Override
    public String toString() {
        return value;
    }
}
