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

/** {@code [len]T}, or a slice type {@code []T} when the length is {@code null}. */
public class ArrayType extends Expr {
    private Expr len;
    private Expr elt;

    public ArrayType(Expr len, Expr elt) {
        this.len = len;
        this.elt = elt;
    }

    public Expr getLen() {
        return len;
    }

    public void setLen(Expr len) {
        this.len = len;
    }

    public Expr getElt() {
        return elt;
    }

    public void setElt(Expr elt) {
        this.elt = elt;
    }

    @Override
    public List<Object> children() {
        return fields(len, elt);
    }
}
