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

import java.util.ArrayList;
import java.util.List;

/**
 * A composite literal such as {@code net.TCPAddr{ip, 80}} or {@code []int{1, 2}}.
 *
 * <p>The type is {@code null} when it is elided inside an enclosing literal. Elements are either
 * positional expressions or {@link KeyValueExpr}s.
 */
public class CompositeLit extends Expr {
    private Expr type;
    private final List<Expr> elements;
    private boolean multiline;

    public CompositeLit(Expr type, List<? extends Expr> elements) {
        this.type = type;
        this.elements = new ArrayList<>(elements);
    }

    public Expr getType() {
        return type;
    }

    public void setType(Expr type) {
        this.type = type;
    }

    /** The live element list; fixes may edit it in place. */
    public List<Expr> getElements() {
        return elements;
    }

    /** True when the closing brace was on a later line than the opening one. */
    public boolean isMultiline() {
        return multiline;
    }

    public void setMultiline(boolean multiline) {
        this.multiline = multiline;
    }

    @Override
    public List<Object> children() {
        return fields(type, elements);
    }
}
